package com.raditha.quotient.model;

import java.util.Comparator;

/**
 * Atomic unit of the report: one located, severity-tagged observation.
 *
 * @param file     Repository-relative path, or {@link #REPOSITORY} for a finding about the
 *                 repository as a whole
 * @param line     1-indexed line, 0 when the finding has no line
 * @param category Producer of the finding
 * @param severity Severity
 * @param message  Human readable message
 */
public record Finding(
        String file,
        int line,
        FindingCategory category,
        Severity severity,
        String message) {

    /**
     * Path of repository-level findings, such as an unavailable tool. Such findings
     * carry line 0 and sort before every file.
     */
    public static final String REPOSITORY = "";

    /**
     * Report order: file path, line, severity, then category and message so the
     * order is total.
     */
    public static final Comparator<Finding> REPORT_ORDER = Comparator
            .comparing(Finding::file)
            .thenComparingInt(Finding::line)
            .thenComparing(Finding::severity)
            .thenComparing(Finding::category)
            .thenComparing(Finding::message);

    public static Finding warning(String file, int line, FindingCategory category, String message) {
        return new Finding(file, line, category, Severity.WARNING, message);
    }

    public static Finding error(String file, int line, FindingCategory category, String message) {
        return new Finding(file, line, category, Severity.ERROR, message);
    }

    public static Finding repositoryWarning(FindingCategory category, String message) {
        return warning(REPOSITORY, 0, category, message);
    }

    public static Finding info(String file, int line, FindingCategory category, String message) {
        return new Finding(file, line, category, Severity.INFO, message);
    }

    public boolean repositoryLevel() {
        return REPOSITORY.equals(file);
    }
}
