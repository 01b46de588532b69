package com.raditha.quotient.model;

/**
 * A directed relation between two declared layers.
 */
public record LayerRelation(String fromLayer, String toLayer) implements Comparable<LayerRelation> {

    @Override
    public int compareTo(LayerRelation o) {
        int cmp = fromLayer.compareTo(o.fromLayer);
        return cmp != 0 ? cmp : toLayer.compareTo(o.toLayer);
    }

    @Override
    public String toString() {
        return fromLayer + " -> " + toLayer;
    }
}
