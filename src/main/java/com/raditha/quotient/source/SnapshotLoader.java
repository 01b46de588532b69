package com.raditha.quotient.source;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.MalformedInputException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

/**
 * Reads every Java file under a directory into a {@link RepositorySnapshot}.
 */
public class SnapshotLoader {

    private static final Logger logger = LoggerFactory.getLogger(SnapshotLoader.class);

    private final List<String> excludePatterns;

    public SnapshotLoader(List<String> excludePatterns) {
        this.excludePatterns = excludePatterns == null ? List.of() : List.copyOf(excludePatterns);
    }

    /**
     * Walk the directory and load all non-excluded .java files.
     *
     * @param root Repository root
     * @return Snapshot sorted by path
     * @throws IOException if the directory cannot be walked
     */
    public RepositorySnapshot load(Path root) throws IOException {
        Path base = root.toAbsolutePath().normalize();
        if (!Files.isDirectory(base)) {
            throw new IOException("Not a directory: " + root);
        }

        List<SourceFile> files = new ArrayList<>();
        try (Stream<Path> walk = Files.walk(base)) {
            List<Path> candidates = walk
                    .filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().endsWith(".java"))
                    .sorted()
                    .toList();
            for (Path path : candidates) {
                String relative = base.relativize(path).toString().replace('\\', '/');
                if (shouldExclude(relative)) {
                    logger.debug("Excluded {}", relative);
                    continue;
                }
                files.add(new SourceFile(relative, read(path)));
            }
        } catch (UncheckedIOException e) {
            throw e.getCause();
        }

        logger.info("Loaded {} Java files from {}", files.size(), base);
        return RepositorySnapshot.of(base, files);
    }

    private String read(Path path) throws IOException {
        try {
            return Files.readString(path, StandardCharsets.UTF_8);
        } catch (MalformedInputException e) {
            logger.warn("{} is not valid UTF-8, reading as ISO-8859-1", path);
            return Files.readString(path, StandardCharsets.ISO_8859_1);
        }
    }

    /**
     * Check if a file path matches any exclusion pattern.
     */
    public boolean shouldExclude(String filePath) {
        for (String pattern : excludePatterns) {
            if (matchesGlobPattern(filePath, pattern)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Simple glob pattern matching.
     * Supports ** and * wildcards; a leading double-star segment also matches the root.
     */
    static boolean matchesGlobPattern(String path, String pattern) {
        String glob = pattern.startsWith("**/") ? pattern.substring(3) : pattern;
        String regex = glob
                .replace(".", "\\.")
                .replace("**", "\u0000")
                .replace("*", "[^/]*")
                .replace("\u0000", ".*");
        if (pattern.startsWith("**/")) {
            regex = "(.*/)?" + regex;
        }
        return path.matches(regex);
    }
}
