package com.architecture.memory.codegraph.model.graph;

/**
 * Kinds of nodes in the code property graph.
 * Each kind carries the prefix used by canonical ids (e.g. {@code function:pkg.mod.calc}).
 */
public enum NodeKind {
    MODULE("module"),
    CLASS("class"),
    FUNCTION("function"),
    VARIABLE("variable"),
    PARAMETER("parameter"),
    TYPE("type"),
    CALL_SITE("callsite");

    private final String idPrefix;

    NodeKind(String idPrefix) {
        this.idPrefix = idPrefix;
    }

    public String getIdPrefix() {
        return idPrefix;
    }
}
