package com.architecture.memory.codegraph.dto.diff;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Summary statistics for a graph diff.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DiffSummary {
    private int totalChanges;
    private int nodesAdded;
    private int nodesModified;
    private int nodesRemoved;
    private int nodesUnchanged;
    private int relationshipsAdded;
    private int relationshipsModified;
    private int relationshipsRemoved;

    // Breakdown by node kind: e.g., {"FUNCTION": 2, "CALL_SITE": 5}
    private Map<String, Integer> addedByKind;
    private Map<String, Integer> modifiedByKind;
    private Map<String, Integer> removedByKind;
}
