package com.raditha.quotient.config;

import java.util.List;

/**
 * Thrown when a configuration cannot be used. Carries every problem found, not just
 * the first one.
 */
public class InvalidConfigurationException extends IllegalArgumentException {

    private final List<String> problems;

    public InvalidConfigurationException(List<String> problems) {
        super("Invalid configuration: " + String.join("; ", problems));
        this.problems = List.copyOf(problems);
    }

    public InvalidConfigurationException(String problem, Throwable cause) {
        super("Invalid configuration: " + problem, cause);
        this.problems = List.of(problem);
    }

    public List<String> getProblems() {
        return problems;
    }
}
