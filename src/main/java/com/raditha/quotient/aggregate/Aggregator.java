package com.raditha.quotient.aggregate;

import com.raditha.quotient.config.QualityConfig;
import com.raditha.quotient.confidence.BootstrapEstimator;
import com.raditha.quotient.model.ClonePair;
import com.raditha.quotient.model.ConfidenceInterval;
import com.raditha.quotient.model.FileSummary;
import com.raditha.quotient.model.Finding;
import com.raditha.quotient.model.LayerRelation;
import com.raditha.quotient.model.MetricSample;
import com.raditha.quotient.model.Pillar;
import com.raditha.quotient.model.PillarScore;
import com.raditha.quotient.model.Report;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Combines the pillar scores into the final {@link Report}.
 * <p>
 * Weights of unavailable pillars are redistributed over the available ones in
 * proportion to their configured weights, and the report is flagged partial.
 */
public class Aggregator {

    private static final Logger logger = LoggerFactory.getLogger(Aggregator.class);
    static final String GRADE_METRIC = "grade";

    private final QualityConfig.Weights weights;
    private final BootstrapEstimator estimator;

    public Aggregator(QualityConfig.Weights weights, BootstrapEstimator estimator) {
        this.weights = weights;
        this.estimator = estimator;
    }

    public Report aggregate(AggregationInput input) {
        Map<Pillar, PillarScore> pillars = input.pillars();
        Map<Pillar, Double> effective = effectiveWeights(pillars);
        boolean partial = pillars.values().stream().anyMatch(p -> !p.available());

        double overall = 0.0;
        for (Pillar pillar : Pillar.values()) {
            overall += effective.get(pillar) * pillars.get(pillar).score();
        }
        overall = Math.max(0.0, Math.min(100.0, overall * 100.0));

        List<FileSummary> files = new ArrayList<>();
        List<MetricSample> grades = new ArrayList<>();
        for (FileSummary file : input.files()) {
            double grade = fileGrade(file.path(), pillars, effective, input.fileScores());
            files.add(file.withGrade(grade));
            grades.add(new MetricSample(file.path(), GRADE_METRIC, grade));
        }
        files.sort(Comparator.comparing(FileSummary::path));

        ConfidenceInterval confidence = estimator.estimate(grades);

        Map<Pillar, ConfidenceInterval> pillarIntervals = new EnumMap<>(Pillar.class);
        for (Pillar pillar : Pillar.values()) {
            List<MetricSample> samples = input.samples().getOrDefault(pillar, List.of());
            if (pillars.get(pillar).available() && !samples.isEmpty()) {
                pillarIntervals.put(pillar, estimator.estimate(samples));
            }
        }

        List<Finding> findings = new ArrayList<>(input.findings());
        findings.sort(Finding.REPORT_ORDER);
        List<ClonePair> clonePairs = new ArrayList<>(input.clonePairs());
        clonePairs.sort(ClonePair.CANONICAL_ORDER);
        List<LayerRelation> absent = new ArrayList<>(input.absentRelations());
        absent.sort(Comparator.naturalOrder());

        Report report = new Report(overall, partial, pillars, effective, confidence, pillarIntervals,
                findings, clonePairs, absent, files);
        logger.info(report.getSummary());
        return report;
    }

    /**
     * Configured weights with the share of unavailable pillars moved onto the available
     * ones. Every pillar is present in the result; unavailable pillars weigh 0.
     */
    public Map<Pillar, Double> effectiveWeights(Map<Pillar, PillarScore> pillars) {
        Map<Pillar, Double> effective = new EnumMap<>(Pillar.class);
        double availableWeight = 0.0;
        int availableCount = 0;
        for (Pillar pillar : Pillar.values()) {
            if (pillars.get(pillar).available()) {
                availableWeight += weights.weightOf(pillar);
                availableCount++;
            }
        }

        for (Pillar pillar : Pillar.values()) {
            double weight = 0.0;
            if (pillars.get(pillar).available()) {
                // Available pillars configured at 0 share equally when nothing else is left
                weight = availableWeight > 0
                        ? weights.weightOf(pillar) / availableWeight
                        : 1.0 / availableCount;
            }
            effective.put(pillar, weight);
        }
        return effective;
    }

    /**
     * Composite grade of one file on the 0-100 scale. Pillars without a value for the
     * file fall back to the repository score of the pillar.
     */
    double fileGrade(String path, Map<Pillar, PillarScore> pillars, Map<Pillar, Double> effective,
                     Map<Pillar, Map<String, Double>> fileScores) {
        double grade = 0.0;
        for (Pillar pillar : Pillar.values()) {
            double weight = effective.get(pillar);
            if (weight == 0.0) {
                continue;
            }
            double score = fileScores.getOrDefault(pillar, Map.of())
                    .getOrDefault(path, pillars.get(pillar).score());
            grade += weight * score;
        }
        return Math.max(0.0, Math.min(100.0, grade * 100.0));
    }
}
