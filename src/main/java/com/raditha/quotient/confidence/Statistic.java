package com.raditha.quotient.confidence;

import java.util.Arrays;

/**
 * Statistic computed over each bootstrap resample.
 */
public enum Statistic {
    MEAN {
        @Override
        public double compute(double[] values) {
            if (values.length == 0) {
                return 0.0;
            }
            double sum = 0.0;
            for (double v : values) {
                sum += v;
            }
            return sum / values.length;
        }
    },
    MEDIAN {
        @Override
        public double compute(double[] values) {
            if (values.length == 0) {
                return 0.0;
            }
            double[] sorted = values.clone();
            Arrays.sort(sorted);
            int mid = sorted.length / 2;
            if (sorted.length % 2 == 1) {
                return sorted[mid];
            }
            return (sorted[mid - 1] + sorted[mid]) / 2.0;
        }
    };

    /**
     * Compute the statistic. Returns 0 for an empty array.
     */
    public abstract double compute(double[] values);
}
