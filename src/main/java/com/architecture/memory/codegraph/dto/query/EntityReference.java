package com.architecture.memory.codegraph.dto.query;

import com.architecture.memory.codegraph.model.graph.EdgeKind;
import com.architecture.memory.codegraph.model.graph.GraphNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EntityReference {
    private GraphNode source;
    private EdgeKind kind;
    private String location;
}
