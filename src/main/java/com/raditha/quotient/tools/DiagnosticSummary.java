package com.raditha.quotient.tools;

import java.util.Map;

/**
 * Parsed tool output.
 *
 * @param fileScores  Score in [0,1] for every analysed file
 * @param diagnostics Number of diagnostics attributed to analysed files
 */
public record DiagnosticSummary(Map<String, Double> fileScores, int diagnostics) {

    public DiagnosticSummary {
        fileScores = Map.copyOf(fileScores);
    }
}
