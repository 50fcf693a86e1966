package com.architecture.memory.codegraph.model.snapshot;

import com.architecture.memory.codegraph.model.graph.GraphEdge;
import com.architecture.memory.codegraph.model.graph.GraphNode;
import com.architecture.memory.codegraph.model.graph.GraphState;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Immutable capture of the whole graph at one version. Nodes and edges are immutable values, so
 * copying the lists is a deep copy.
 */
@Value
@Builder
public class GraphSnapshot {

    String id;
    String label;
    Instant createdAt;
    Instant expiresAt;          // null keeps the snapshot until deleted
    long graphVersion;
    List<GraphNode> nodes;
    List<GraphEdge> edges;

    public static GraphSnapshot capture(String id, String label, GraphState state, Instant createdAt, Instant expiresAt) {
        return GraphSnapshot.builder()
                .id(id)
                .label(label)
                .createdAt(createdAt)
                .expiresAt(expiresAt)
                .graphVersion(state.getVersion())
                .nodes(List.copyOf(state.nodes()))
                .edges(List.copyOf(state.edges()))
                .build();
    }

    public GraphState toState() {
        return GraphState.of(graphVersion, nodes, edges);
    }

    public boolean isExpired(Instant now) {
        return expiresAt != null && !expiresAt.isAfter(now);
    }

    public int nodeCount() {
        return nodes.size();
    }

    public int edgeCount() {
        return edges.size();
    }
}
