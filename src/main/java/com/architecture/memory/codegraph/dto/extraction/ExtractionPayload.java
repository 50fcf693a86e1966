package com.architecture.memory.codegraph.dto.extraction;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Everything the extractor produced for one module.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExtractionPayload {

    private String moduleId;
    @Builder.Default
    private List<RawEntity> entities = new ArrayList<>();
    @Builder.Default
    private List<RawRelationship> relationships = new ArrayList<>();
}
