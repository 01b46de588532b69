package com.raditha.quotient.tools;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * {@link ProcessRunner} backed by {@link ProcessBuilder}.
 * Output goes to a temporary file so a chatty tool can never block on a full pipe.
 */
public class DefaultProcessRunner implements ProcessRunner {

    private static final Logger logger = LoggerFactory.getLogger(DefaultProcessRunner.class);

    @Override
    public ProcessOutput run(List<String> command, Path workingDir, Duration timeout)
            throws IOException, InterruptedException {
        Path outputFile = Files.createTempFile("quotient-tool", ".out");
        try {
            ProcessBuilder pb = new ProcessBuilder(command);
            pb.directory(workingDir.toFile());
            pb.redirectErrorStream(true);
            pb.redirectOutput(outputFile.toFile());

            logger.debug("Running {} in {}", command.get(0), workingDir);
            Process process = pb.start();
            boolean finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (!finished) {
                process.destroyForcibly();
                process.waitFor(5, TimeUnit.SECONDS);
                return ProcessOutput.timeout(readOutput(outputFile));
            }
            return new ProcessOutput(process.exitValue(), readOutput(outputFile), false);
        } finally {
            Files.deleteIfExists(outputFile);
        }
    }

    private String readOutput(Path outputFile) throws IOException {
        byte[] bytes = Files.readAllBytes(outputFile);
        return new String(bytes, StandardCharsets.UTF_8);
    }
}
