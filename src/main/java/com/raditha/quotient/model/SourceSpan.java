package com.raditha.quotient.model;

/**
 * A line range inside one repository file.
 * Simplified wrapper around JavaParser's Range, keyed by the file's repository path.
 *
 * @param file      Repository-relative path using '/' separators
 * @param startLine Starting line number (1-indexed)
 * @param endLine   Ending line number (1-indexed, inclusive)
 */
public record SourceSpan(String file, int startLine, int endLine) {

    /**
     * Create from a JavaParser Range.
     */
    public static SourceSpan from(String file, com.github.javaparser.Range jpRange) {
        return new SourceSpan(file, jpRange.begin.line, jpRange.end.line);
    }

    /**
     * Get total number of lines in this span.
     */
    public int getLineCount() {
        return endLine - startLine + 1;
    }

    /**
     * Format as "L45-52" for display.
     */
    public String toDisplayString() {
        if (startLine == endLine) {
            return "L" + startLine;
        }
        return "L" + startLine + "-" + endLine;
    }

    @Override
    public String toString() {
        return file + ":" + toDisplayString();
    }
}
