package com.raditha.quotient.confidence;

import com.raditha.quotient.config.QualityConfig;
import com.raditha.quotient.model.ConfidenceInterval;
import com.raditha.quotient.model.MetricSample;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.ForkJoinPool;
import java.util.stream.IntStream;

/**
 * Percentile bootstrap over metric samples.
 * <p>
 * Samples are put in canonical order and the resample indices are generated up front
 * from the seed. Resample statistics are then computed in parallel and written at
 * their resample index, so the bounds do not depend on thread count or on the order
 * in which samples arrived.
 */
public class BootstrapEstimator {

    private static final Logger logger = LoggerFactory.getLogger(BootstrapEstimator.class);

    private final int resamples;
    private final double level;
    private final long seed;
    private final Statistic statistic;
    private final ForkJoinPool pool;

    public BootstrapEstimator(QualityConfig.BootstrapSettings settings) {
        this(settings, ForkJoinPool.commonPool());
    }

    public BootstrapEstimator(QualityConfig.BootstrapSettings settings, ForkJoinPool pool) {
        this.resamples = settings.resamples();
        this.level = settings.confidenceLevel();
        this.seed = settings.seed();
        this.statistic = settings.statistic();
        this.pool = pool;
    }

    /**
     * Interval of the configured statistic over the sample values.
     *
     * @param samples Samples in any order
     * @return Interval; degenerate [0,0] for an empty sample
     */
    public ConfidenceInterval estimate(List<MetricSample> samples) {
        if (samples.isEmpty()) {
            return ConfidenceInterval.empty(level, resamples);
        }

        List<MetricSample> canonical = new ArrayList<>(samples);
        canonical.sort(MetricSample.CANONICAL_ORDER);
        double[] values = canonical.stream().mapToDouble(MetricSample::value).toArray();

        double point = statistic.compute(values);
        ResamplePlan plan = ResamplePlan.generate(values.length, resamples, seed);

        double[] statistics = pool.submit(() -> IntStream.range(0, plan.resamples())
                .parallel()
                .mapToDouble(b -> statistic.compute(plan.resample(values, b)))
                .toArray()).join();

        Arrays.sort(statistics);
        double alpha = (1.0 - level) / 2.0;
        int lowIndex = (int) Math.floor(alpha * (statistics.length - 1));
        int highIndex = (int) Math.floor((1.0 - alpha) * (statistics.length - 1));

        logger.debug("Bootstrap over {} samples, {} resamples: [{}, {}]", values.length, resamples,
                statistics[lowIndex], statistics[highIndex]);
        return new ConfidenceInterval(point, statistics[lowIndex], statistics[highIndex], level,
                values.length, resamples);
    }
}
