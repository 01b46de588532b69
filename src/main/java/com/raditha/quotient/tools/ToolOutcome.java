package com.raditha.quotient.tools;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Result of an external tool adapter: either a score with per-file scores or the
 * reason the tool could not be used.
 *
 * @param available   Whether the tool produced a usable result
 * @param score       Pillar value in [0,1]; 0 when unavailable
 * @param fileScores  Per-file scores in [0,1], keyed by repository path
 * @param diagnostics Number of diagnostics the tool reported
 * @param reason      Why the tool is unavailable, null when available
 */
public record ToolOutcome(boolean available, double score, Map<String, Double> fileScores, int diagnostics,
                          String reason) {

    public ToolOutcome {
        fileScores = Collections.unmodifiableMap(new TreeMap<>(fileScores));
    }

    public static ToolOutcome available(double score, Map<String, Double> fileScores, int diagnostics) {
        return new ToolOutcome(true, score, fileScores, diagnostics, null);
    }

    public static ToolOutcome unavailable(String reason) {
        return new ToolOutcome(false, 0.0, Map.of(), 0, reason);
    }
}
