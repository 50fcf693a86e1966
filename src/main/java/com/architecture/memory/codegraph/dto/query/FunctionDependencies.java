package com.architecture.memory.codegraph.dto.query;

import com.architecture.memory.codegraph.model.graph.GraphNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Functions reachable over resolved calls within a hop limit, in both directions.
 * Each function appears once, at its shortest distance.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FunctionDependencies {

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Dependency {
        private GraphNode function;
        private int distance;
    }

    private String functionId;
    private int depth;
    private List<Dependency> outbound;  // what the function calls
    private List<Dependency> inbound;   // what calls the function
}
