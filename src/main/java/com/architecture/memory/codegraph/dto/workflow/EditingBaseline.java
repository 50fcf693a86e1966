package com.architecture.memory.codegraph.dto.workflow;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Snapshot and graph size recorded before a batch of edits starts.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EditingBaseline {

    private String snapshotId;
    private String label;
    private long graphVersion;
    private int nodeCount;
    private int edgeCount;

    @Builder.Default
    private List<String> plannedModules = new ArrayList<>();
}
