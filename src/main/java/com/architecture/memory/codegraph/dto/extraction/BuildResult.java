package com.architecture.memory.codegraph.dto.extraction;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of applying one module's extraction to the graph.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BuildResult {

    private String moduleId;
    private int nodesAdded;
    private int nodesUpdated;
    private int nodesRemoved;
    private int edgesAdded;
    private int edgesUpdated;
    private int edgesRemoved;

    // Number of store operations committed for this module; 0 when nothing changed
    private int mutationCount;

    @Builder.Default
    private List<String> changedNodeIds = new ArrayList<>();

    // Other modules re-linked after this build
    @Builder.Default
    private List<String> refreshedModules = new ArrayList<>();

    public boolean isUnchanged() {
        return mutationCount == 0;
    }
}
