package com.architecture.memory.codegraph.dto.extraction;

import com.architecture.memory.codegraph.model.graph.ParameterKind;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * One program entity as emitted by the external extractor.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RawEntity {

    private RawEntityKind kind;
    private String name;
    private String qualifiedName;
    private SourceLocation location;
    private String typeAnnotation;     // parameters and variables
    private String visibility;         // public | private
    @Builder.Default
    private List<String> decorators = new ArrayList<>();

    // Qualified name of the enclosing entity; null for modules
    private String parent;

    // Parameters only
    private Integer position;
    private ParameterKind parameterKind;
    private Boolean hasDefault;

    // Functions only
    private String returnType;

    // Modules only
    private String path;
}
