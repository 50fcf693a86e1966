package com.architecture.memory.codegraph.model.snapshot;

import com.architecture.memory.codegraph.model.graph.EdgeKind;
import com.architecture.memory.codegraph.model.graph.GraphEdge;
import com.architecture.memory.codegraph.model.graph.GraphNode;
import com.architecture.memory.codegraph.model.graph.NodeKind;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * MongoDB document holding one graph snapshot.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "graph_snapshots")
public class GraphSnapshotDocument {

    @Id
    private String id;

    private String label;

    @Indexed
    private Instant createdAt;

    @Indexed
    private Instant expiresAt; // For cleanup scheduler

    private long graphVersion;

    private List<NodeRecord> nodes;
    private List<EdgeRecord> edges;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class NodeRecord {
        private String id;
        private String kind;
        private String moduleId;
        private boolean changed;
        private Map<String, Object> properties;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class EdgeRecord {
        private String sourceId;
        private String kind;
        private String targetId;
        private Map<String, Object> properties;
    }

    public static GraphSnapshotDocument from(GraphSnapshot snapshot) {
        return GraphSnapshotDocument.builder()
                .id(snapshot.getId())
                .label(snapshot.getLabel())
                .createdAt(snapshot.getCreatedAt())
                .expiresAt(snapshot.getExpiresAt())
                .graphVersion(snapshot.getGraphVersion())
                .nodes(snapshot.getNodes().stream()
                        .map(n -> new NodeRecord(n.getId(), n.getKind().name(), n.getModuleId(), n.isChanged(), n.getProperties()))
                        .toList())
                .edges(snapshot.getEdges().stream()
                        .map(e -> new EdgeRecord(e.getSourceId(), e.getKind().name(), e.getTargetId(), e.getProperties()))
                        .toList())
                .build();
    }

    public GraphSnapshot toSnapshot() {
        List<GraphNode> graphNodes = nodes == null ? List.of() : nodes.stream()
                .map(n -> GraphNode.of(n.getId(), NodeKind.valueOf(n.getKind()), n.getModuleId(), n.getProperties(), n.isChanged()))
                .toList();
        List<GraphEdge> graphEdges = edges == null ? List.of() : edges.stream()
                .map(e -> GraphEdge.of(e.getSourceId(), EdgeKind.valueOf(e.getKind()), e.getTargetId(), e.getProperties()))
                .toList();
        return GraphSnapshot.builder()
                .id(id)
                .label(label)
                .createdAt(createdAt)
                .expiresAt(expiresAt)
                .graphVersion(graphVersion)
                .nodes(graphNodes)
                .edges(graphEdges)
                .build();
    }
}
