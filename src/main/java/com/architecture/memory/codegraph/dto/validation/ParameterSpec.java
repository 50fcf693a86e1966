package com.architecture.memory.codegraph.dto.validation;

import com.architecture.memory.codegraph.model.graph.ParameterKind;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A parameter as seen by signature checks, either read from the graph or proposed by an edit.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ParameterSpec {
    private String name;
    @Builder.Default
    private ParameterKind kind = ParameterKind.POSITIONAL;
    private boolean hasDefault;
    private String typeAnnotation;
}
