package com.raditha.quotient.architecture;

/**
 * Granularity of the ERROR findings raised for divergent dependencies.
 */
public enum DivergencePolicy {
    /** One finding per (source module, target module) pair, at its first import */
    PER_MODULE_PAIR,
    /** One finding per import location */
    PER_OCCURRENCE
}
