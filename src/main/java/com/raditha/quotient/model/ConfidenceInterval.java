package com.raditha.quotient.model;

/**
 * Bootstrap confidence interval.
 *
 * @param pointEstimate Statistic over the observed sample
 * @param low           Lower bound
 * @param high          Upper bound
 * @param level         Two-sided confidence level, e.g. 0.95
 * @param sampleSize    Number of observed samples
 * @param resamples     Number of bootstrap resamples
 */
public record ConfidenceInterval(
        double pointEstimate,
        double low,
        double high,
        double level,
        int sampleSize,
        int resamples) {

    public static ConfidenceInterval empty(double level, int resamples) {
        return new ConfidenceInterval(0.0, 0.0, 0.0, level, 0, resamples);
    }

    /**
     * Multiply every bound by a constant, e.g. to move from [0,1] to [0,100].
     */
    public ConfidenceInterval scaled(double factor) {
        return new ConfidenceInterval(pointEstimate * factor, low * factor, high * factor,
                level, sampleSize, resamples);
    }

    public double width() {
        return high - low;
    }
}
