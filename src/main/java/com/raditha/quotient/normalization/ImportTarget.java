package com.raditha.quotient.normalization;

/**
 * An import declaration as written, before resolution.
 *
 * @param name     Imported name without the trailing ".*"
 * @param wildcard True for on-demand imports
 * @param isStatic True for static imports
 * @param line     Line of the declaration
 */
public record ImportTarget(String name, boolean wildcard, boolean isStatic, int line) {
}
