package com.architecture.memory.codegraph.model.graph;

import java.util.EnumSet;
import java.util.Set;

/**
 * Relationship types of the code property graph.
 */
public enum EdgeKind {
    DECLARES,
    HAS_PARAMETER,
    HAS_TYPE,
    RETURNS_TYPE,
    INHERITS,
    IMPORTS,
    ASSIGNS_TO,
    READS_FROM,
    REFERENCES,
    HAS_CALLSITE,
    RESOLVES_TO,
    IS_SUBTYPE_OF,
    HAS_DECORATOR,
    DECORATES;

    /** Edges that make a node part of its module's subgraph. */
    public static final Set<EdgeKind> OWNERSHIP = EnumSet.of(DECLARES, HAS_PARAMETER, HAS_CALLSITE);

    /** Symbolic references that must land on an existing node. */
    public static final Set<EdgeKind> SYMBOLIC = EnumSet.of(REFERENCES, ASSIGNS_TO, READS_FROM, IMPORTS);

    public boolean isOwnership() {
        return OWNERSHIP.contains(this);
    }
}
