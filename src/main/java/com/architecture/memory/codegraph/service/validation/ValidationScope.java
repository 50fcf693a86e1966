package com.architecture.memory.codegraph.service.validation;

import com.architecture.memory.codegraph.dto.validation.ValidationMode;
import com.architecture.memory.codegraph.model.graph.GraphEdge;
import com.architecture.memory.codegraph.model.graph.GraphNode;
import com.architecture.memory.codegraph.model.graph.GraphState;

import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * The set of anchor nodes a validation run evaluates. Checks always read the whole graph; the
 * scope only decides which nodes they are anchored on.
 */
public final class ValidationScope {

    private final ValidationMode mode;
    private final Set<String> nodeIds;   // null means every node

    private ValidationScope(ValidationMode mode, Set<String> nodeIds) {
        this.mode = mode;
        this.nodeIds = nodeIds;
    }

    public static ValidationScope full() {
        return new ValidationScope(ValidationMode.FULL, null);
    }

    public static ValidationScope of(Collection<String> nodeIds) {
        return new ValidationScope(ValidationMode.INCREMENTAL, Set.copyOf(nodeIds));
    }

    /**
     * Changed nodes plus every node within {@code hops} undirected hops of one.
     */
    public static ValidationScope incremental(GraphState view, int hops) {
        Set<String> scope = new HashSet<>();
        List<String> frontier = view.changedNodes().stream().map(GraphNode::getId).toList();
        scope.addAll(frontier);
        for (int hop = 0; hop < hops && !frontier.isEmpty(); hop++) {
            Set<String> next = new HashSet<>();
            for (String id : frontier) {
                for (GraphEdge edge : view.outgoing(id)) {
                    if (view.hasNode(edge.getTargetId()) && !scope.contains(edge.getTargetId())) {
                        next.add(edge.getTargetId());
                    }
                }
                for (GraphEdge edge : view.incoming(id)) {
                    if (view.hasNode(edge.getSourceId()) && !scope.contains(edge.getSourceId())) {
                        next.add(edge.getSourceId());
                    }
                }
            }
            scope.addAll(next);
            frontier = List.copyOf(next);
        }
        return new ValidationScope(ValidationMode.INCREMENTAL, scope);
    }

    public ValidationMode getMode() {
        return mode;
    }

    public boolean contains(String nodeId) {
        return nodeIds == null || nodeIds.contains(nodeId);
    }

    public boolean isFull() {
        return nodeIds == null;
    }

    public int size(GraphState view) {
        return nodeIds == null ? view.nodeCount() : nodeIds.size();
    }
}
