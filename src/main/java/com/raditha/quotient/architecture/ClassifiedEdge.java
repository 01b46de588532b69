package com.raditha.quotient.architecture;

import com.raditha.quotient.model.EdgeClass;
import com.raditha.quotient.model.ImportEdge;

/**
 * An import edge together with the layers of its endpoints and its reflexion class.
 */
public record ClassifiedEdge(ImportEdge edge, String sourceLayer, String targetLayer, EdgeClass edgeClass) {

    public boolean divergent() {
        return edgeClass == EdgeClass.DIVERGENT;
    }
}
