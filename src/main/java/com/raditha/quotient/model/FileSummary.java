package com.raditha.quotient.model;

/**
 * Per-file metrics carried into the report.
 *
 * @param path             Repository-relative path
 * @param role             File role
 * @param lines            Physical line count
 * @param tokens           Normalized token count, 0 for files that failed to parse
 * @param parsed           Whether the file parsed
 * @param duplicationRatio Covered tokens / total tokens
 * @param complexity       Aggregated cognitive complexity
 * @param complexityScore  Complexity score in [0,1]
 * @param grade            Composite grade in [0,100] using the effective weights
 */
public record FileSummary(
        String path,
        FileRole role,
        int lines,
        int tokens,
        boolean parsed,
        double duplicationRatio,
        double complexity,
        double complexityScore,
        double grade) {

    public FileSummary withGrade(double newGrade) {
        return new FileSummary(path, role, lines, tokens, parsed, duplicationRatio, complexity, complexityScore,
                newGrade);
    }
}
