package com.raditha.quotient.tools;

/**
 * What a finished (or abandoned) subprocess left behind.
 *
 * @param exitCode Exit code, -1 when the process timed out
 * @param output   Combined stdout and stderr
 * @param timedOut True when the process was killed at the timeout
 */
public record ProcessOutput(int exitCode, String output, boolean timedOut) {

    public static ProcessOutput timeout(String partialOutput) {
        return new ProcessOutput(-1, partialOutput, true);
    }
}
