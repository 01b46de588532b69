package com.raditha.quotient.complexity;

import com.raditha.quotient.model.MetricSample;
import com.raditha.quotient.model.PillarScore;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Output of the complexity scorer.
 *
 * @param score   Line and role weighted mean of file scores
 * @param files   Per-file complexity keyed by path
 * @param samples Per-file scores for the confidence estimator
 */
public record ComplexityResult(PillarScore score, Map<String, FileComplexity> files, List<MetricSample> samples) {

    public ComplexityResult {
        files = Collections.unmodifiableMap(new TreeMap<>(files));
        samples = List.copyOf(samples);
    }

    public Optional<FileComplexity> file(String path) {
        return Optional.ofNullable(files.get(path));
    }
}
