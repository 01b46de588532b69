package com.raditha.quotient.architecture;

import com.raditha.quotient.model.Finding;
import com.raditha.quotient.model.LayerRelation;
import com.raditha.quotient.model.MetricSample;
import com.raditha.quotient.model.PillarScore;

import java.util.List;

/**
 * Output of the conformance checker.
 *
 * @param score               Non-divergent share of classifiable edges, or unavailable
 * @param edges               Classified edges in canonical order
 * @param absentRelations     Allowed relations no edge realizes
 * @param unclassifiedModules In-repository modules no layer claims
 * @param samples             Per-module conformance values
 * @param findings            Divergence errors and unclassified-module warnings
 */
public record ConformanceResult(
        PillarScore score,
        List<ClassifiedEdge> edges,
        List<LayerRelation> absentRelations,
        List<String> unclassifiedModules,
        List<MetricSample> samples,
        List<Finding> findings) {

    public ConformanceResult {
        edges = List.copyOf(edges);
        absentRelations = List.copyOf(absentRelations);
        unclassifiedModules = List.copyOf(unclassifiedModules);
        samples = List.copyOf(samples);
        findings = List.copyOf(findings);
    }

    public static ConformanceResult unavailable(String reason) {
        return new ConformanceResult(PillarScore.unavailable(reason), List.of(), List.of(), List.of(),
                List.of(), List.of());
    }

    public long divergentCount() {
        return edges.stream().filter(ClassifiedEdge::divergent).count();
    }
}
