package com.raditha.quotient.duplication;

import com.raditha.quotient.model.NormalizedToken;

import java.util.List;

/**
 * Polynomial rolling hash over token keys.
 * <p>
 * Token keys are hashed with 64-bit FNV-1a, k-grams with a base-B polynomial modulo
 * 2^64, and each k-gram value is finalized with the MurmurHash3 64-bit mixer so that
 * the window minimum is not biased toward particular token kinds.
 */
public final class RollingHash {

    private static final long FNV_OFFSET = 0xcbf29ce484222325L;
    private static final long FNV_PRIME = 0x100000001b3L;
    private static final long BASE = 1_000_003L;

    private RollingHash() {
    }

    /**
     * 64-bit FNV-1a hash of a token key.
     */
    public static long tokenHash(String key) {
        long h = FNV_OFFSET;
        for (int i = 0; i < key.length(); i++) {
            h ^= key.charAt(i);
            h *= FNV_PRIME;
        }
        return h;
    }

    /**
     * Finalized hash of every k-gram of the stream, indexed by start position.
     * Empty when the stream holds fewer than k tokens.
     */
    public static long[] kgramHashes(List<NormalizedToken> tokens, int k) {
        int n = tokens.size();
        if (k <= 0 || n < k) {
            return new long[0];
        }

        long[] tokenHashes = new long[n];
        for (int i = 0; i < n; i++) {
            tokenHashes[i] = tokenHash(tokens.get(i).key());
        }

        // B^(k-1), the weight of the token leaving the window
        long highPower = 1L;
        for (int i = 1; i < k; i++) {
            highPower *= BASE;
        }

        long[] result = new long[n - k + 1];
        long h = 0L;
        for (int i = 0; i < k; i++) {
            h = h * BASE + tokenHashes[i];
        }
        result[0] = fmix64(h);

        for (int start = 1; start < result.length; start++) {
            h = (h - tokenHashes[start - 1] * highPower) * BASE + tokenHashes[start + k - 1];
            result[start] = fmix64(h);
        }
        return result;
    }

    /**
     * MurmurHash3 64-bit finalizer.
     */
    static long fmix64(long h) {
        h ^= (h >>> 33);
        h *= 0xff51afd7ed558ccdL;
        h ^= (h >>> 33);
        h *= 0xc4ceb9fe1a85ec53L;
        h ^= (h >>> 33);
        return h;
    }
}
