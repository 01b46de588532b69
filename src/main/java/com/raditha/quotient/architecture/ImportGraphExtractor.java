package com.raditha.quotient.architecture;

import com.raditha.quotient.model.ImportEdge;
import com.raditha.quotient.model.ModuleNode;
import com.raditha.quotient.model.SourceSpan;
import com.raditha.quotient.normalization.ImportTarget;
import com.raditha.quotient.normalization.NormalizedFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Builds the {@link ImportGraph} from normalized files.
 * <p>
 * Every parsed compilation unit is one module named after its package and primary type.
 * Imports that do not resolve to a module of the repository become boundary nodes.
 */
public class ImportGraphExtractor {

    private static final Logger logger = LoggerFactory.getLogger(ImportGraphExtractor.class);

    /**
     * Extract the graph. The whole graph is assembled before it is returned.
     *
     * @param files Normalized files in any order
     * @return Immutable graph
     */
    public ImportGraph extract(List<NormalizedFile> files) {
        List<NormalizedFile> sorted = new ArrayList<>(files);
        sorted.sort(Comparator.comparing(NormalizedFile::path));

        Map<String, ModuleNode> nodes = new TreeMap<>();
        // package -> simple name -> module id
        Map<String, Map<String, String>> packages = new TreeMap<>();
        for (NormalizedFile file : sorted) {
            ModuleNode existing = nodes.get(file.moduleId());
            if (existing != null) {
                logger.debug("Module {} declared by {} and {}, using {}", file.moduleId(), existing.file(),
                        file.path(), existing.file());
                continue;
            }
            nodes.put(file.moduleId(), ModuleNode.internal(file.moduleId(), file.path()));
            packages.computeIfAbsent(file.packageName(), p -> new TreeMap<>())
                    .put(simpleName(file.moduleId()), file.moduleId());
        }

        Map<String, Map<String, List<SourceSpan>>> locations = new TreeMap<>();
        for (NormalizedFile file : sorted) {
            String source = file.moduleId();
            Set<String> importedSimpleNames = new HashSet<>();
            Set<String> explicitTargets = new HashSet<>();

            for (ImportTarget target : file.imports()) {
                SourceSpan at = new SourceSpan(file.path(), target.line(), target.line());
                for (String resolved : resolve(target, file, nodes, packages)) {
                    if (!nodes.containsKey(resolved)) {
                        nodes.put(resolved, ModuleNode.external(resolved));
                    }
                    addEdge(locations, source, resolved, at);
                    explicitTargets.add(resolved);
                }
                if (!target.wildcard()) {
                    importedSimpleNames.add(simpleName(target.name()));
                }
            }

            // Same-package types need no import
            Map<String, String> samePackage = packages.getOrDefault(file.packageName(), Map.of());
            for (Map.Entry<String, Integer> reference : file.referencedTypes().entrySet()) {
                String moduleId = samePackage.get(reference.getKey());
                if (moduleId == null || importedSimpleNames.contains(reference.getKey())
                        || explicitTargets.contains(moduleId)) {
                    continue;
                }
                int line = reference.getValue();
                addEdge(locations, source, moduleId, new SourceSpan(file.path(), line, line));
            }
        }

        List<ImportEdge> edges = new ArrayList<>();
        locations.forEach((source, targets) -> targets.forEach((target, spans) -> {
            if (!source.equals(target)) {
                edges.add(new ImportEdge(nodes.get(source), nodes.get(target), spans));
            }
        }));

        logger.info("Import graph: {} modules ({} internal), {} edges", nodes.size(),
                nodes.values().stream().filter(n -> !n.boundary()).count(), edges.size());
        return new ImportGraph(nodes, edges);
    }

    /**
     * Module identifiers an import refers to. Unresolvable imports yield one boundary id.
     */
    List<String> resolve(ImportTarget target, NormalizedFile file, Map<String, ModuleNode> nodes,
                         Map<String, Map<String, String>> packages) {
        if (target.wildcard()) {
            Map<String, String> members = target.isStatic() ? null : packages.get(target.name());
            if (members != null) {
                List<String> used = new ArrayList<>();
                members.forEach((simple, id) -> {
                    if (file.referencedTypes().containsKey(simple)) {
                        used.add(id);
                    }
                });
                return used;
            }
            String owner = longestInternalPrefix(target.name(), nodes);
            if (owner != null) {
                return List.of(owner);
            }
            return List.of(target.name() + ".*");
        }

        String owner = longestInternalPrefix(target.name(), nodes);
        if (owner != null) {
            return List.of(owner);
        }
        // A static import names a member; its owner type is the dependency
        if (target.isStatic()) {
            int dot = target.name().lastIndexOf('.');
            return List.of(dot > 0 ? target.name().substring(0, dot) : target.name());
        }
        return List.of(target.name());
    }

    /**
     * Strip trailing segments until an in-repository module matches.
     */
    private static String longestInternalPrefix(String name, Map<String, ModuleNode> nodes) {
        String candidate = name;
        while (!candidate.isEmpty()) {
            ModuleNode node = nodes.get(candidate);
            if (node != null && !node.boundary()) {
                return candidate;
            }
            int dot = candidate.lastIndexOf('.');
            if (dot < 0) {
                return null;
            }
            candidate = candidate.substring(0, dot);
        }
        return null;
    }

    private static void addEdge(Map<String, Map<String, List<SourceSpan>>> locations, String source,
                                String target, SourceSpan at) {
        locations.computeIfAbsent(source, s -> new TreeMap<>())
                .computeIfAbsent(target, t -> new ArrayList<>())
                .add(at);
    }

    private static String simpleName(String qualified) {
        return qualified.substring(qualified.lastIndexOf('.') + 1);
    }
}
