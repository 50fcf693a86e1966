package com.architecture.memory.codegraph.model.graph;

import lombok.Value;

/**
 * Identity of an edge. Edges carry no id of their own; two edges with the same source, kind and
 * target are the same edge.
 */
@Value
public class EdgeKey implements Comparable<EdgeKey> {

    String sourceId;
    EdgeKind kind;
    String targetId;

    @Override
    public int compareTo(EdgeKey other) {
        int bySource = sourceId.compareTo(other.sourceId);
        if (bySource != 0) {
            return bySource;
        }
        int byKind = kind.compareTo(other.kind);
        return byKind != 0 ? byKind : targetId.compareTo(other.targetId);
    }

    @Override
    public String toString() {
        return sourceId + "-" + kind + "->" + targetId;
    }
}
