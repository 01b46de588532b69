package com.raditha.quotient.model;

/**
 * A winnowed k-gram hash and where it came from.
 *
 * @param hash       Finalized k-gram hash
 * @param file       Repository-relative path of the file
 * @param startToken Index of the first token of the k-gram
 * @param endToken   Index one past the last token of the k-gram
 */
public record Fingerprint(long hash, String file, int startToken, int endToken) {

    public int length() {
        return endToken - startToken;
    }
}
