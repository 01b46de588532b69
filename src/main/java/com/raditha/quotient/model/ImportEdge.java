package com.raditha.quotient.model;

import java.util.Comparator;
import java.util.List;

/**
 * Directed import-use relation between two modules, with every source location
 * realizing it.
 *
 * @param source    Importing module
 * @param target    Imported module
 * @param locations Import sites, sorted by file then line
 */
public record ImportEdge(ModuleNode source, ModuleNode target, List<SourceSpan> locations) {

    public static final Comparator<ImportEdge> CANONICAL_ORDER = Comparator
            .comparing(ImportEdge::source)
            .thenComparing(ImportEdge::target);

    public ImportEdge {
        if (locations == null || locations.isEmpty()) {
            throw new IllegalArgumentException("an import edge needs at least one location");
        }
        locations = locations.stream()
                .sorted(Comparator.comparing(SourceSpan::file).thenComparingInt(SourceSpan::startLine))
                .toList();
    }

    /**
     * True when either endpoint lies outside the repository.
     */
    public boolean touchesBoundary() {
        return source.boundary() || target.boundary();
    }

    public SourceSpan firstLocation() {
        return locations.get(0);
    }
}
