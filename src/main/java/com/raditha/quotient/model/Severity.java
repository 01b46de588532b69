package com.raditha.quotient.model;

/**
 * Severity of a {@link Finding}. Declaration order is the report sort order.
 */
public enum Severity {
    ERROR,
    WARNING,
    INFO
}
