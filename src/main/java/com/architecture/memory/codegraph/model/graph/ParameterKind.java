package com.architecture.memory.codegraph.model.graph;

/**
 * How a parameter binds arguments at a call site.
 */
public enum ParameterKind {
    POSITIONAL,
    KEYWORD_ONLY,
    VAR_POSITIONAL,
    VAR_KEYWORD;

    public boolean isVariadic() {
        return this == VAR_POSITIONAL || this == VAR_KEYWORD;
    }

    /** Marker written before the parameter name in a rendered signature. */
    public String prefix() {
        return switch (this) {
            case VAR_POSITIONAL -> "*";
            case VAR_KEYWORD -> "**";
            default -> "";
        };
    }
}
