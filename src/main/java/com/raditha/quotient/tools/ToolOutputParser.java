package com.raditha.quotient.tools;

import com.raditha.quotient.source.RepositorySnapshot;
import com.raditha.quotient.source.SourceFile;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Turns the text output of an external tool into per-file scores.
 */
public interface ToolOutputParser {

    /**
     * Score every file of the snapshot. Files the tool said nothing about score 1.
     */
    DiagnosticSummary parse(String output, RepositorySnapshot snapshot);

    /**
     * Map a path as printed by a tool onto a repository path. Tools print absolute
     * paths or paths relative to their working directory.
     */
    static Optional<String> resolvePath(String reported, RepositorySnapshot snapshot) {
        String normalized = reported.trim().replace('\\', '/');
        Optional<Path> root = snapshot.root();
        if (root.isPresent()) {
            String prefix = root.get().toAbsolutePath().normalize().toString().replace('\\', '/') + "/";
            if (normalized.startsWith(prefix)) {
                normalized = normalized.substring(prefix.length());
            }
        }
        if (normalized.startsWith("./")) {
            normalized = normalized.substring(2);
        }
        for (SourceFile file : snapshot.files()) {
            if (file.path().equals(normalized)) {
                return Optional.of(file.path());
            }
        }
        for (SourceFile file : snapshot.files()) {
            if (normalized.endsWith("/" + file.path())) {
                return Optional.of(file.path());
            }
        }
        return Optional.empty();
    }
}
