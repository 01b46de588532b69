package com.raditha.quotient.analyzer;

/**
 * Thrown when a snapshot holds no source files to analyse.
 */
public class EmptyRepositoryException extends IllegalStateException {

    public EmptyRepositoryException(String message) {
        super(message);
    }
}
