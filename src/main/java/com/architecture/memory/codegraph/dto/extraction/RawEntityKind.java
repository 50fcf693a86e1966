package com.architecture.memory.codegraph.dto.extraction;

import com.architecture.memory.codegraph.model.graph.NodeKind;

/**
 * Entity kinds an extractor may emit. Call sites are not entities; they come from CALLS relationships.
 */
public enum RawEntityKind {
    MODULE(NodeKind.MODULE),
    CLASS(NodeKind.CLASS),
    FUNCTION(NodeKind.FUNCTION),
    VARIABLE(NodeKind.VARIABLE),
    PARAMETER(NodeKind.PARAMETER),
    TYPE(NodeKind.TYPE);

    private final NodeKind nodeKind;

    RawEntityKind(NodeKind nodeKind) {
        this.nodeKind = nodeKind;
    }

    public NodeKind getNodeKind() {
        return nodeKind;
    }
}
