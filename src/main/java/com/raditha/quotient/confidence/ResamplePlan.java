package com.raditha.quotient.confidence;

import java.util.Random;

/**
 * Pre-generated bootstrap index arrays.
 * <p>
 * All indices are drawn from one seeded generator, resample by resample, before any
 * parallel work starts, so the plan depends only on the seed, B and n.
 */
public final class ResamplePlan {

    private final int[][] indices;

    private ResamplePlan(int[][] indices) {
        this.indices = indices;
    }

    /**
     * Draw B index arrays of length n.
     */
    public static ResamplePlan generate(int sampleSize, int resamples, long seed) {
        Random random = new Random(seed);
        int[][] indices = new int[resamples][sampleSize];
        for (int b = 0; b < resamples; b++) {
            for (int i = 0; i < sampleSize; i++) {
                indices[b][i] = random.nextInt(sampleSize);
            }
        }
        return new ResamplePlan(indices);
    }

    public int resamples() {
        return indices.length;
    }

    /**
     * Values of resample b, drawn from the observed values.
     */
    public double[] resample(double[] values, int b) {
        int[] picks = indices[b];
        double[] drawn = new double[picks.length];
        for (int i = 0; i < picks.length; i++) {
            drawn[i] = values[picks[i]];
        }
        return drawn;
    }
}
