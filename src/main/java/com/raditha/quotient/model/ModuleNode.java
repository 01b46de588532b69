package com.raditha.quotient.model;

/**
 * Node of the import graph.
 *
 * @param id       Fully qualified module identifier, e.g. com.acme.core.Service or java.util.List
 * @param file     Declaring file for in-repository modules, null for boundary nodes
 * @param boundary True when the module lives outside the repository
 */
public record ModuleNode(String id, String file, boolean boundary) implements Comparable<ModuleNode> {

    public static ModuleNode internal(String id, String file) {
        return new ModuleNode(id, file, false);
    }

    public static ModuleNode external(String id) {
        return new ModuleNode(id, null, true);
    }

    /**
     * Package part of the identifier.
     */
    public String packageName() {
        int dot = id.lastIndexOf('.');
        return dot < 0 ? "" : id.substring(0, dot);
    }

    @Override
    public int compareTo(ModuleNode o) {
        return id.compareTo(o.id);
    }
}
