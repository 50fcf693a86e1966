package com.architecture.memory.codegraph.dto.workflow;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Every validation run of a fix loop, oldest first.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FixLoopResult {

    private String label;
    private int maxIterations;

    // True when the last run passed
    private boolean converged;

    @Builder.Default
    private List<WorkflowResult> iterations = new ArrayList<>();

    public int getIterationCount() {
        return iterations.size();
    }

    public WorkflowResult getFinalResult() {
        return iterations.isEmpty() ? null : iterations.get(iterations.size() - 1);
    }
}
