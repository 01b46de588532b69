package com.raditha.quotient.complexity;

import java.util.List;

/**
 * Complexity of one file.
 *
 * @param path      Repository path
 * @param lines     Physical lines
 * @param value     Aggregated function complexity
 * @param score     Normalized score in [0,1], higher is simpler
 * @param functions Function scores in source order
 */
public record FileComplexity(String path, int lines, double value, double score, List<FunctionComplexity> functions) {

    public FileComplexity {
        functions = List.copyOf(functions);
    }
}
