package com.architecture.memory.codegraph.dto.diff;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Represents a single node change between two graph states.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NodeChange {

    public enum ChangeType {
        ADDED,
        MODIFIED,
        REMOVED
    }

    private ChangeType changeType;
    private String nodeId;
    private String nodeKind;        // MODULE, CLASS, FUNCTION, ...
    private String displayName;     // qualified name, or name when there is none

    // For MODIFIED nodes: what changed
    private List<PropertyDiff> propertyDiffs;

    private Map<String, Object> oldProperties;
    private Map<String, Object> newProperties;

    /**
     * The diff of {@code property}, or null if it did not change.
     */
    public PropertyDiff propertyDiff(String property) {
        if (propertyDiffs == null) {
            return null;
        }
        return propertyDiffs.stream().filter(d -> property.equals(d.getProperty())).findFirst().orElse(null);
    }
}
