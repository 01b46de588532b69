package com.raditha.quotient.model;

/**
 * Reflexion classification of an actual import edge against the declared layer model.
 */
public enum EdgeClass {
    /** Matches a relation the model allows */
    CONVERGENT,

    /** Crosses layers in a way the model forbids */
    DIVERGENT,

    /** Crosses layers with no declared relation in either direction */
    UNSPECIFIED
}
