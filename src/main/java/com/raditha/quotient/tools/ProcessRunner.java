package com.raditha.quotient.tools;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * Runs an external command. Separated from the adapters so tests can replace it.
 */
public interface ProcessRunner {

    /**
     * Run a command to completion or until the timeout elapses.
     *
     * @param command    Program and arguments
     * @param workingDir Working directory
     * @param timeout    Upper bound on the run time
     * @return Exit code and output
     * @throws IOException          if the process cannot be started
     * @throws InterruptedException if the calling thread is interrupted while waiting
     */
    ProcessOutput run(List<String> command, Path workingDir, Duration timeout)
            throws IOException, InterruptedException;
}
