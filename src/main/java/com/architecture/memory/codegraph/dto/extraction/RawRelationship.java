package com.architecture.memory.codegraph.dto.extraction;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * One relationship as emitted by the external extractor. Endpoints are qualified names, except for
 * CALLS where {@code to} is the callee expression text.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RawRelationship {

    private RawRelationshipKind kind;
    private String from;
    private String to;

    // CALLS
    private Integer argCount;
    @Builder.Default
    private List<String> keywordNames = new ArrayList<>();
    @Builder.Default
    private List<String> argTypes = new ArrayList<>();

    // IMPORTS
    private String alias;

    // REFERENCES / ASSIGNS_TO / READS_FROM
    private String accessKind;
    private String observedType;

    private SourceLocation location;
}
