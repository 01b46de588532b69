package com.raditha.quotient.complexity;

/**
 * How function scores are folded into one value per file.
 */
public enum AggregationMode {
    /** Sum of all function scores */
    SUM,
    /** Nearest-rank percentile of the function scores */
    PERCENTILE
}
