package com.raditha.quotient.aggregate;

import com.raditha.quotient.model.ClonePair;
import com.raditha.quotient.model.FileSummary;
import com.raditha.quotient.model.Finding;
import com.raditha.quotient.model.LayerRelation;
import com.raditha.quotient.model.MetricSample;
import com.raditha.quotient.model.Pillar;
import com.raditha.quotient.model.PillarScore;

import java.util.List;
import java.util.Map;

/**
 * Everything the pillar analyzers produced, handed to the {@link Aggregator}.
 *
 * @param pillars         Score of each of the five pillars
 * @param samples         Per-file or per-module samples of each pillar
 * @param fileScores      Per-file score of each pillar, keyed by path
 * @param files           File summaries without grades
 * @param findings        Findings of every stage, in any order
 * @param clonePairs      Clone pairs, in any order
 * @param absentRelations Absent architecture relations, in any order
 */
public record AggregationInput(
        Map<Pillar, PillarScore> pillars,
        Map<Pillar, List<MetricSample>> samples,
        Map<Pillar, Map<String, Double>> fileScores,
        List<FileSummary> files,
        List<Finding> findings,
        List<ClonePair> clonePairs,
        List<LayerRelation> absentRelations) {

    public AggregationInput {
        for (Pillar pillar : Pillar.values()) {
            if (!pillars.containsKey(pillar)) {
                throw new IllegalArgumentException("missing score for pillar " + pillar.key());
            }
        }
    }
}
