package com.architecture.memory.codegraph.dto.workflow;

import com.architecture.memory.codegraph.dto.extraction.BuildResult;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * What happened to one module's extraction during a workflow run.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ModuleOutcome {

    private String moduleId;
    private boolean applied;

    // Set when applied
    private BuildResult buildResult;

    // Set when the extraction was rejected
    private String error;
    @Builder.Default
    private List<String> problems = new ArrayList<>();
}
