package com.raditha.quotient.duplication;

import com.raditha.quotient.model.Fingerprint;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Global hash to occurrences index.
 * <p>
 * Populated through a {@link Builder} during the indexing phase, then frozen. The frozen
 * index is read-only and iterates hashes in ascending order.
 */
public final class FingerprintIndex {

    private final TreeMap<Long, List<Fingerprint>> occurrences;
    private final int fingerprintCount;

    private FingerprintIndex(TreeMap<Long, List<Fingerprint>> occurrences, int fingerprintCount) {
        this.occurrences = occurrences;
        this.fingerprintCount = fingerprintCount;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Hashes seen at least twice, in ascending hash order, with their occurrences in
     * insertion order.
     */
    public List<List<Fingerprint>> clusters() {
        List<List<Fingerprint>> clusters = new ArrayList<>();
        for (List<Fingerprint> list : occurrences.values()) {
            if (list.size() >= 2) {
                clusters.add(list);
            }
        }
        return clusters;
    }

    public List<Fingerprint> lookup(long hash) {
        return occurrences.getOrDefault(hash, List.of());
    }

    public int distinctHashes() {
        return occurrences.size();
    }

    public int size() {
        return fingerprintCount;
    }

    /**
     * Mutable side of the index. Single-threaded: callers add files in path order.
     */
    public static final class Builder {
        private final Map<Long, List<Fingerprint>> buckets = new TreeMap<>();
        private int count;
        private boolean built;

        private Builder() {
        }

        public Builder addAll(List<Fingerprint> fingerprints) {
            if (built) {
                throw new IllegalStateException("index is frozen");
            }
            for (Fingerprint fingerprint : fingerprints) {
                buckets.computeIfAbsent(fingerprint.hash(), h -> new ArrayList<>()).add(fingerprint);
                count++;
            }
            return this;
        }

        /**
         * Freeze the index. The builder cannot be used afterwards.
         */
        public FingerprintIndex build() {
            built = true;
            TreeMap<Long, List<Fingerprint>> frozen = new TreeMap<>();
            buckets.forEach((hash, list) -> frozen.put(hash, Collections.unmodifiableList(new ArrayList<>(list))));
            return new FingerprintIndex(frozen, count);
        }
    }
}
