package com.raditha.quotient.architecture;

import com.raditha.quotient.model.EdgeClass;
import com.raditha.quotient.model.LayerRelation;
import com.raditha.quotient.model.LayerRule;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;

/**
 * The declared layers and the relations between them.
 */
public class LayerModel {

    private final Map<String, LayerRule> layers = new LinkedHashMap<>();
    private final boolean strictUnspecified;

    public LayerModel(List<LayerRule> rules, boolean strictUnspecified) {
        for (LayerRule rule : rules) {
            layers.putIfAbsent(rule.name(), rule);
        }
        this.strictUnspecified = strictUnspecified;
    }

    public boolean isEmpty() {
        return layers.isEmpty();
    }

    /**
     * Layer of a module: the rule with the most specific matching pattern, earliest
     * declared on ties.
     */
    public Optional<String> layerOf(String moduleId) {
        String best = null;
        int bestSpecificity = -1;
        for (LayerRule rule : layers.values()) {
            int specificity = rule.matchSpecificity(moduleId);
            if (specificity > bestSpecificity) {
                bestSpecificity = specificity;
                best = rule.name();
            }
        }
        return Optional.ofNullable(best);
    }

    /**
     * Reflexion classification of a dependency from one layer to another.
     */
    public EdgeClass classify(String fromLayer, String toLayer) {
        LayerRule from = layers.get(fromLayer);
        LayerRule to = layers.get(toLayer);
        if (fromLayer.equals(toLayer)) {
            return from.forbids(toLayer) ? EdgeClass.DIVERGENT : EdgeClass.CONVERGENT;
        }
        if (from.allows(toLayer)) {
            return EdgeClass.CONVERGENT;
        }
        if (from.forbids(toLayer)) {
            return EdgeClass.DIVERGENT;
        }
        if (to.allows(fromLayer) || strictUnspecified) {
            return EdgeClass.DIVERGENT;
        }
        return EdgeClass.UNSPECIFIED;
    }

    /**
     * Every declared allow relation, sorted.
     */
    public List<LayerRelation> allowedRelations() {
        TreeSet<LayerRelation> relations = new TreeSet<>();
        for (LayerRule rule : layers.values()) {
            for (String target : rule.allow()) {
                relations.add(new LayerRelation(rule.name(), target));
            }
        }
        return new ArrayList<>(relations);
    }
}
