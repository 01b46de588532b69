package com.raditha.quotient.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * The result of one analysis run. Immutable once produced.
 *
 * @param overallScore     Weighted overall score in [0,100]
 * @param partial          True when at least one pillar was unavailable
 * @param pillars          Score of every pillar
 * @param effectiveWeights Weights after redistribution; unavailable pillars weigh 0
 * @param confidence       Bootstrap interval on the 0-100 scale of the mean per-file grade, every
 *                         file counting equally. It is not an interval around {@code overallScore},
 *                         which is built from role- and length-weighted pillar scores.
 * @param pillarIntervals  Interval per available pillar on the 0-1 scale
 * @param findings         Findings sorted by {@link Finding#REPORT_ORDER}
 * @param clonePairs       Clone pairs sorted canonically
 * @param absentRelations  Declared relations with no realizing edge
 * @param files            Per-file summaries sorted by path
 */
public record Report(
        double overallScore,
        boolean partial,
        Map<Pillar, PillarScore> pillars,
        Map<Pillar, Double> effectiveWeights,
        ConfidenceInterval confidence,
        Map<Pillar, ConfidenceInterval> pillarIntervals,
        List<Finding> findings,
        List<ClonePair> clonePairs,
        List<LayerRelation> absentRelations,
        List<FileSummary> files) {

    public Report {
        pillars = Collections.unmodifiableMap(new EnumMap<>(pillars));
        effectiveWeights = Collections.unmodifiableMap(new EnumMap<>(effectiveWeights));
        pillarIntervals = pillarIntervals.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new EnumMap<>(pillarIntervals));
        findings = List.copyOf(findings);
        clonePairs = List.copyOf(clonePairs);
        absentRelations = List.copyOf(absentRelations);
        files = List.copyOf(files);
    }

    public PillarScore pillar(Pillar pillar) {
        return pillars.get(pillar);
    }

    /**
     * Get summary statistics.
     */
    public String getSummary() {
        return String.format(Locale.ROOT,
                "Overall %.1f/100 (CI %.1f-%.1f at %.0f%%)%s, %d findings, %d clone pairs across %d files",
                overallScore,
                confidence.low(),
                confidence.high(),
                confidence.level() * 100,
                partial ? " [partial]" : "",
                findings.size(),
                clonePairs.size(),
                files.size());
    }
}
