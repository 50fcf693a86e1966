package com.architecture.memory.codegraph.dto.extraction;

import com.architecture.memory.codegraph.model.graph.EdgeKind;

/**
 * Relationship kinds an extractor may emit. {@link #CALLS} becomes a CallSite node; the others map
 * onto one edge kind each.
 */
public enum RawRelationshipKind {
    CALLS(null),
    INHERITS(EdgeKind.INHERITS),
    IMPORTS(EdgeKind.IMPORTS),
    ASSIGNS_TO(EdgeKind.ASSIGNS_TO),
    READS_FROM(EdgeKind.READS_FROM),
    REFERENCES(EdgeKind.REFERENCES),
    IS_SUBTYPE_OF(EdgeKind.IS_SUBTYPE_OF),
    DECORATES(EdgeKind.DECORATES);

    private final EdgeKind edgeKind;

    RawRelationshipKind(EdgeKind edgeKind) {
        this.edgeKind = edgeKind;
    }

    public EdgeKind getEdgeKind() {
        return edgeKind;
    }
}
