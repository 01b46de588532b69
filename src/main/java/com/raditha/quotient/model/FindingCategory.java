package com.raditha.quotient.model;

/**
 * What produced a {@link Finding}.
 */
public enum FindingCategory {
    DUPLICATION,
    ARCHITECTURE,
    PARSE,
    CONFIGURATION,
    TOOL
}
