package com.raditha.quotient.architecture;

import com.raditha.quotient.config.QualityConfig;
import com.raditha.quotient.model.EdgeClass;
import com.raditha.quotient.model.Finding;
import com.raditha.quotient.model.FindingCategory;
import com.raditha.quotient.model.ImportEdge;
import com.raditha.quotient.model.LayerRelation;
import com.raditha.quotient.model.MetricSample;
import com.raditha.quotient.model.ModuleNode;
import com.raditha.quotient.model.PillarScore;
import com.raditha.quotient.model.SourceSpan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * Reflexion-model conformance check of the actual import graph against the declared layers.
 */
public class ConformanceChecker {

    private static final Logger logger = LoggerFactory.getLogger(ConformanceChecker.class);
    static final String METRIC_NAME = "architecture";

    private final QualityConfig.ArchitectureSettings settings;

    public ConformanceChecker(QualityConfig.ArchitectureSettings settings) {
        this.settings = settings;
    }

    /**
     * Classify every edge of the graph.
     *
     * @param graph Complete import graph
     * @return Score, classified edges, absent relations and findings
     */
    public ConformanceResult check(ImportGraph graph) {
        if (settings.layers().isEmpty()) {
            return ConformanceResult.unavailable("no layer model declared");
        }
        LayerModel model = new LayerModel(settings.layers(), settings.strictUnspecified());

        // Every in-repository module is checked, including ones without any edge
        Map<String, ModuleNode> unclassified = new TreeMap<>();
        for (ModuleNode module : graph.internalModules()) {
            if (model.layerOf(module.id()).isEmpty()) {
                unclassified.put(module.id(), module);
            }
        }

        List<ClassifiedEdge> classified = new ArrayList<>();
        Set<LayerRelation> realized = new HashSet<>();
        // source module -> {non-divergent, classifiable}
        Map<String, int[]> perModule = new TreeMap<>();
        List<Finding> findings = new ArrayList<>();

        for (ImportEdge edge : graph.edges()) {
            if (edge.touchesBoundary()) {
                continue;
            }
            Optional<String> sourceLayer = model.layerOf(edge.source().id());
            Optional<String> targetLayer = model.layerOf(edge.target().id());
            if (sourceLayer.isEmpty() || targetLayer.isEmpty()) {
                continue;
            }

            EdgeClass edgeClass = model.classify(sourceLayer.get(), targetLayer.get());
            ClassifiedEdge result = new ClassifiedEdge(edge, sourceLayer.get(), targetLayer.get(), edgeClass);
            classified.add(result);

            int[] counts = perModule.computeIfAbsent(edge.source().id(), id -> new int[2]);
            counts[1]++;
            if (edgeClass == EdgeClass.CONVERGENT) {
                realized.add(new LayerRelation(sourceLayer.get(), targetLayer.get()));
            }
            if (edgeClass == EdgeClass.DIVERGENT) {
                findings.addAll(divergenceFindings(result));
            } else {
                counts[0]++;
            }
        }

        // One warning per module, at its declaring file
        for (ModuleNode module : unclassified.values()) {
            findings.add(Finding.warning(module.file(), 0, FindingCategory.ARCHITECTURE,
                    "Unclassified module " + module.id() + " matches no declared layer"));
        }

        List<LayerRelation> absent = new ArrayList<>();
        for (LayerRelation relation : model.allowedRelations()) {
            if (!realized.contains(relation)) {
                absent.add(relation);
            }
        }

        long divergent = classified.stream().filter(ClassifiedEdge::divergent).count();
        double score = classified.isEmpty() ? 1.0 : (double) (classified.size() - divergent) / classified.size();

        List<MetricSample> samples = new ArrayList<>();
        perModule.forEach((module, counts) ->
                samples.add(new MetricSample(module, METRIC_NAME, (double) counts[0] / counts[1])));

        logger.info("Architecture: {} classifiable edges, {} divergent, {} absent relations, {} unclassified modules",
                classified.size(), divergent, absent.size(), unclassified.size());

        return new ConformanceResult(PillarScore.of(score), classified, absent,
                new ArrayList<>(unclassified.keySet()), samples, findings);
    }

    private List<Finding> divergenceFindings(ClassifiedEdge classified) {
        ImportEdge edge = classified.edge();
        String relation = String.format(Locale.ROOT, "%s (%s) -> %s (%s)",
                edge.source().id(), classified.sourceLayer(), edge.target().id(), classified.targetLayer());

        List<Finding> findings = new ArrayList<>();
        if (settings.divergencePolicy() == DivergencePolicy.PER_OCCURRENCE) {
            for (SourceSpan location : edge.locations()) {
                findings.add(Finding.error(location.file(), location.startLine(), FindingCategory.ARCHITECTURE,
                        "Divergent dependency " + relation));
            }
        } else {
            SourceSpan first = edge.firstLocation();
            int occurrences = edge.locations().size();
            findings.add(Finding.error(first.file(), first.startLine(), FindingCategory.ARCHITECTURE,
                    String.format(Locale.ROOT, "Divergent dependency %s (%d occurrence%s)", relation,
                            occurrences, occurrences == 1 ? "" : "s")));
        }
        return findings;
    }
}
