package com.raditha.quotient.model;

import java.util.Comparator;

/**
 * One side of a clone: a token range of a file together with the source lines it covers.
 *
 * @param file       Repository-relative path
 * @param startToken First token index (inclusive)
 * @param endToken   Last token index (exclusive)
 * @param startLine  First covered line
 * @param endLine    Last covered line
 */
public record CloneSpan(String file, int startToken, int endToken, int startLine, int endLine) {

    /**
     * Canonical order: path, then start line, then token range.
     */
    public static final Comparator<CloneSpan> CANONICAL_ORDER = Comparator
            .comparing(CloneSpan::file)
            .thenComparingInt(CloneSpan::startLine)
            .thenComparingInt(CloneSpan::startToken)
            .thenComparingInt(CloneSpan::endToken);

    public CloneSpan {
        if (endToken <= startToken) {
            throw new IllegalArgumentException("empty clone span " + startToken + ".." + endToken);
        }
    }

    public int tokenCount() {
        return endToken - startToken;
    }

    public int lineCount() {
        return endLine - startLine + 1;
    }

    /**
     * True when both spans are in the same file and this one lies inside the other.
     */
    public boolean within(CloneSpan other) {
        return file.equals(other.file) && startToken >= other.startToken && endToken <= other.endToken;
    }

    public SourceSpan toSourceSpan() {
        return new SourceSpan(file, startLine, endLine);
    }
}
