package com.raditha.quotient.model;

import java.util.Comparator;

/**
 * A named numeric value attached to a file or module.
 *
 * @param subject File path or module identifier the value belongs to
 * @param name    Metric name
 * @param value   Observed value
 */
public record MetricSample(String subject, String name, double value) {

    /**
     * Canonical order used before resampling.
     */
    public static final Comparator<MetricSample> CANONICAL_ORDER = Comparator
            .comparing(MetricSample::subject)
            .thenComparing(MetricSample::name)
            .thenComparingDouble(MetricSample::value);
}
