package com.raditha.quotient.duplication;

import com.raditha.quotient.model.Fingerprint;

import java.util.ArrayList;
import java.util.List;

/**
 * Selects fingerprints from a file's k-gram hashes by winnowing.
 * <p>
 * Every window of w consecutive hashes contributes its minimum; ties go to the
 * leftmost k-gram. A position chosen by several consecutive windows is recorded once.
 */
public class Winnower {

    private final int k;
    private final int w;

    public Winnower(int k, int w) {
        if (k <= 0 || w <= 0) {
            throw new IllegalArgumentException("k and w must be > 0");
        }
        this.k = k;
        this.w = w;
    }

    /**
     * Winnow the k-gram hashes of one file.
     *
     * @param file   Repository path
     * @param hashes k-gram hashes indexed by start token
     * @return Selected fingerprints in ascending position order
     */
    public List<Fingerprint> winnow(String file, long[] hashes) {
        List<Fingerprint> fingerprints = new ArrayList<>();
        int n = hashes.length;
        if (n == 0) {
            return fingerprints;
        }

        // A short file is a single window
        int windowCount = Math.max(1, n - w + 1);
        int windowLength = Math.min(w, n);
        int lastSelected = -1;

        for (int start = 0; start < windowCount; start++) {
            int selected = start;
            for (int i = start + 1; i < start + windowLength; i++) {
                if (hashes[i] < hashes[selected]) {
                    selected = i;
                }
            }
            if (selected != lastSelected) {
                fingerprints.add(new Fingerprint(hashes[selected], file, selected, selected + k));
                lastSelected = selected;
            }
        }
        return fingerprints;
    }

    public int getK() {
        return k;
    }

    public int getW() {
        return w;
    }
}
