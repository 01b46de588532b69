package com.raditha.quotient.duplication;

import com.raditha.quotient.model.ClonePair;
import com.raditha.quotient.model.Finding;
import com.raditha.quotient.model.MetricSample;
import com.raditha.quotient.model.PillarScore;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Output of the duplication detector.
 *
 * @param score            Pillar score, 1 minus the repository ratio
 * @param repositoryRatio  Role and length weighted share of duplicated tokens
 * @param clonePairs       Clone pairs in canonical order
 * @param fileRatios       Duplicated token share per file path
 * @param samples          Per-file duplication scores for the confidence estimator
 * @param findings         One INFO finding per clone pair
 */
public record DuplicationResult(
        PillarScore score,
        double repositoryRatio,
        List<ClonePair> clonePairs,
        Map<String, Double> fileRatios,
        List<MetricSample> samples,
        List<Finding> findings) {

    public DuplicationResult {
        clonePairs = List.copyOf(clonePairs);
        fileRatios = Collections.unmodifiableMap(new TreeMap<>(fileRatios));
        samples = List.copyOf(samples);
        findings = List.copyOf(findings);
    }

    public double ratioOf(String path) {
        return fileRatios.getOrDefault(path, 0.0);
    }
}
