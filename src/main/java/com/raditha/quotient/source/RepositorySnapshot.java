package com.raditha.quotient.source;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable set of source files to analyse, sorted by path.
 * The root is only needed by the external tool adapters; in-memory snapshots have none.
 */
public final class RepositorySnapshot {

    private final Path root;
    private final List<SourceFile> files;

    private RepositorySnapshot(Path root, List<SourceFile> files) {
        this.root = root;
        List<SourceFile> sorted = new ArrayList<>(files);
        sorted.sort(Comparator.comparing(SourceFile::path));
        Set<String> seen = new HashSet<>();
        for (SourceFile file : sorted) {
            if (!seen.add(file.path())) {
                throw new IllegalArgumentException("duplicate path in snapshot: " + file.path());
            }
        }
        this.files = List.copyOf(sorted);
    }

    /**
     * Snapshot without a filesystem root, for programmatic use.
     */
    public static RepositorySnapshot of(List<SourceFile> files) {
        return new RepositorySnapshot(null, files);
    }

    public static RepositorySnapshot of(Path root, List<SourceFile> files) {
        return new RepositorySnapshot(root, files);
    }

    public Optional<Path> root() {
        return Optional.ofNullable(root);
    }

    public List<SourceFile> files() {
        return files;
    }

    public boolean isEmpty() {
        return files.isEmpty();
    }

    public int size() {
        return files.size();
    }
}
