package com.raditha.quotient.model;

import java.util.Comparator;

/**
 * Two code spans judged duplicate. The pair is unordered: {@link #of} always puts the
 * canonically smaller span first, so each physical duplication has one value.
 *
 * @param first  Canonically smaller side
 * @param second Canonically larger side
 */
public record ClonePair(CloneSpan first, CloneSpan second) {

    public static final Comparator<ClonePair> CANONICAL_ORDER = Comparator
            .comparing(ClonePair::first, CloneSpan.CANONICAL_ORDER)
            .thenComparing(ClonePair::second, CloneSpan.CANONICAL_ORDER);

    public ClonePair {
        if (CloneSpan.CANONICAL_ORDER.compare(first, second) > 0) {
            CloneSpan tmp = first;
            first = second;
            second = tmp;
        }
    }

    public static ClonePair of(CloneSpan a, CloneSpan b) {
        return new ClonePair(a, b);
    }

    /**
     * Number of duplicated tokens. Both sides have the same length.
     */
    public int tokenLength() {
        return first.tokenCount();
    }

    /**
     * Number of duplicated source lines, taking the larger side.
     */
    public int duplicatedLines() {
        return Math.max(first.lineCount(), second.lineCount());
    }

    public boolean crossFile() {
        return !first.file().equals(second.file());
    }

    /**
     * True when both sides of this pair lie inside the matching sides of the other pair.
     */
    public boolean containedIn(ClonePair other) {
        return first.within(other.first) && second.within(other.second);
    }
}
