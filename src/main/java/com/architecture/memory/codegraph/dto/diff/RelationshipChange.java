package com.architecture.memory.codegraph.dto.diff;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Represents an edge change between two graph states. Edges are identified by
 * (sourceId, relationshipType, targetId).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RelationshipChange {

    public enum ChangeType {
        ADDED,
        MODIFIED,
        REMOVED
    }

    private ChangeType changeType;
    private String relationshipType;
    private String sourceId;
    private String targetId;
    private String displayDescription; // e.g. "function:app.g -HAS_CALLSITE-> callsite:app.g@3:4"

    // For MODIFIED edges
    private List<PropertyDiff> propertyDiffs;
}
