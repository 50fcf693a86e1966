package com.architecture.memory.codegraph.dto.diff;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Complete structural diff between two graph states.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GraphDiff {
    private String oldSnapshotId;
    private String newSnapshotId;

    @Builder.Default
    private List<NodeChange> addedNodes = new ArrayList<>();
    @Builder.Default
    private List<NodeChange> modifiedNodes = new ArrayList<>();
    @Builder.Default
    private List<NodeChange> removedNodes = new ArrayList<>();
    @Builder.Default
    private List<String> unchangedNodeIds = new ArrayList<>();

    @Builder.Default
    private List<RelationshipChange> addedRelationships = new ArrayList<>();
    @Builder.Default
    private List<RelationshipChange> modifiedRelationships = new ArrayList<>();
    @Builder.Default
    private List<RelationshipChange> removedRelationships = new ArrayList<>();

    private DiffSummary summary;

    public boolean isEmpty() {
        return addedNodes.isEmpty() && modifiedNodes.isEmpty() && removedNodes.isEmpty()
                && addedRelationships.isEmpty() && modifiedRelationships.isEmpty() && removedRelationships.isEmpty();
    }

    public NodeChange modifiedNode(String nodeId) {
        return modifiedNodes.stream().filter(c -> nodeId.equals(c.getNodeId())).findFirst().orElse(null);
    }
}
