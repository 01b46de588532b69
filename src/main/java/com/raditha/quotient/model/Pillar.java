package com.raditha.quotient.model;

/**
 * The five quality pillars, in report order.
 */
public enum Pillar {
    DUPLICATION,
    ARCHITECTURE,
    LINT,
    TYPING,
    COMPLEXITY;

    /**
     * Lower-case name used in configuration and serialized reports.
     */
    public String key() {
        return name().toLowerCase(java.util.Locale.ROOT);
    }
}
