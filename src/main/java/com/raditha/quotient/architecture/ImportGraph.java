package com.raditha.quotient.architecture;

import com.raditha.quotient.model.ImportEdge;
import com.raditha.quotient.model.ModuleNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Whole-repository module dependency graph. Immutable once built; nodes and edges are
 * held in identifier order.
 */
public final class ImportGraph {

    private final Map<String, ModuleNode> nodes;
    private final List<ImportEdge> edges;

    public ImportGraph(Map<String, ModuleNode> nodes, List<ImportEdge> edges) {
        this.nodes = Collections.unmodifiableMap(new TreeMap<>(nodes));
        List<ImportEdge> sorted = new ArrayList<>(edges);
        sorted.sort(ImportEdge.CANONICAL_ORDER);
        this.edges = Collections.unmodifiableList(sorted);
    }

    public List<ImportEdge> edges() {
        return edges;
    }

    public List<ModuleNode> nodes() {
        return List.copyOf(nodes.values());
    }

    public List<ModuleNode> internalModules() {
        return nodes.values().stream().filter(n -> !n.boundary()).toList();
    }

    public Optional<ModuleNode> node(String id) {
        return Optional.ofNullable(nodes.get(id));
    }

    public List<ImportEdge> outgoing(String sourceId) {
        return edges.stream().filter(e -> e.source().id().equals(sourceId)).toList();
    }

    public Optional<ImportEdge> edge(String sourceId, String targetId) {
        return edges.stream()
                .filter(e -> e.source().id().equals(sourceId) && e.target().id().equals(targetId))
                .findFirst();
    }
}
