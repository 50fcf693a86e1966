package com.architecture.memory.codegraph.dto.workflow;

import com.architecture.memory.codegraph.dto.diff.DiffSummary;
import com.architecture.memory.codegraph.dto.validation.ValidationReport;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WorkflowResult {

    public enum Status {
        PASSED,         // every module applied, no error violations
        NEEDS_FIXES,    // error violations or rejected modules
        FAILED          // the run itself could not complete
    }

    private Status status;
    private String label;
    private String beforeSnapshotId;
    private String afterSnapshotId;

    @Builder.Default
    private List<ModuleOutcome> moduleOutcomes = new ArrayList<>();

    @Builder.Default
    private List<String> changedNodeIds = new ArrayList<>();

    private DiffSummary diffSummary;
    private ValidationReport report;
    private String errorMessage;
    private long durationMs;

    public boolean isValid() {
        return status == Status.PASSED;
    }

    public boolean isNeedsFixes() {
        return status != Status.PASSED;
    }

    public long getFailedModuleCount() {
        return moduleOutcomes.stream().filter(outcome -> !outcome.isApplied()).count();
    }
}
