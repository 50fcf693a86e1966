package com.architecture.memory.codegraph.dto.query;

import com.architecture.memory.codegraph.model.graph.GraphNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Direct base classes and direct subclasses of one class.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ClassHierarchy {
    private String classId;
    private List<GraphNode> bases;
    private List<GraphNode> derived;
}
