package com.architecture.memory.codegraph.model.graph;

import lombok.Builder;
import lombok.Value;

import java.util.Set;

/**
 * Backend-neutral edge predicate. Null fields match everything.
 */
@Value
@Builder
public class EdgeQuery {

    Set<EdgeKind> kinds;
    String sourceId;
    String targetId;

    public boolean matches(GraphEdge edge) {
        return (kinds == null || kinds.contains(edge.getKind()))
                && (sourceId == null || sourceId.equals(edge.getSourceId()))
                && (targetId == null || targetId.equals(edge.getTargetId()));
    }
}
