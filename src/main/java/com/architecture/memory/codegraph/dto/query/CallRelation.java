package com.architecture.memory.codegraph.dto.query;

import com.architecture.memory.codegraph.model.graph.GraphNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One call between two functions, seen from either end.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CallRelation {
    private GraphNode function;     // the caller for findCallers, the callee for findCallees
    private String callSiteId;
    private int argCount;
    private String location;
}
