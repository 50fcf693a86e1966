package com.architecture.memory.codegraph.model.graph;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * An ordered batch of graph writes that a {@code GraphStore} commits all-or-nothing.
 */
public class GraphMutation {

    public enum OperationType {
        UPSERT_NODE,
        DELETE_NODE,
        UPSERT_EDGE,
        DELETE_EDGE,
        MARK_CHANGED,
        CLEAR_CHANGED,
        CLEAR_ALL_CHANGED,
        REPLACE_ALL
    }

    @Value
    @AllArgsConstructor(access = AccessLevel.PRIVATE)
    public static class Operation {
        OperationType type;
        GraphNode node;
        String nodeId;
        GraphEdge edge;
        EdgeKey edgeKey;
        Set<String> nodeIds;
        List<GraphNode> nodes;
        List<GraphEdge> edges;
    }

    private final List<Operation> operations = new ArrayList<>();

    public static GraphMutation empty() {
        return new GraphMutation();
    }

    public GraphMutation createOrUpdateNode(GraphNode node) {
        operations.add(new Operation(OperationType.UPSERT_NODE, node, node.getId(), null, null, null, null, null));
        return this;
    }

    public GraphMutation createOrUpdateNode(NodeKind kind, String id, String moduleId, Map<String, ?> properties) {
        return createOrUpdateNode(GraphNode.of(id, kind, moduleId, properties, true));
    }

    public GraphMutation deleteNode(String id) {
        operations.add(new Operation(OperationType.DELETE_NODE, null, id, null, null, null, null, null));
        return this;
    }

    public GraphMutation createOrUpdateEdge(GraphEdge edge) {
        operations.add(new Operation(OperationType.UPSERT_EDGE, null, null, edge, edge.key(), null, null, null));
        return this;
    }

    public GraphMutation createOrUpdateEdge(EdgeKind kind, String fromId, String toId, Map<String, ?> properties) {
        return createOrUpdateEdge(GraphEdge.of(fromId, kind, toId, properties));
    }

    public GraphMutation deleteEdge(EdgeKey key) {
        operations.add(new Operation(OperationType.DELETE_EDGE, null, null, null, key, null, null, null));
        return this;
    }

    public GraphMutation markChanged(Collection<String> ids) {
        if (!ids.isEmpty()) {
            operations.add(new Operation(OperationType.MARK_CHANGED, null, null, null, null, Set.copyOf(ids), null, null));
        }
        return this;
    }

    public GraphMutation clearChanged(Collection<String> ids) {
        if (!ids.isEmpty()) {
            operations.add(new Operation(OperationType.CLEAR_CHANGED, null, null, null, null, Set.copyOf(ids), null, null));
        }
        return this;
    }

    public GraphMutation clearAllChanged() {
        operations.add(new Operation(OperationType.CLEAR_ALL_CHANGED, null, null, null, null, null, null, null));
        return this;
    }

    public GraphMutation replaceAll(Collection<GraphNode> nodes, Collection<GraphEdge> edges) {
        operations.add(new Operation(OperationType.REPLACE_ALL, null, null, null, null, null,
                List.copyOf(nodes), List.copyOf(edges)));
        return this;
    }

    public GraphMutation addAll(GraphMutation other) {
        operations.addAll(other.operations);
        return this;
    }

    public List<Operation> getOperations() {
        return Collections.unmodifiableList(operations);
    }

    public boolean isEmpty() {
        return operations.isEmpty();
    }

    public int size() {
        return operations.size();
    }

    public long count(OperationType type) {
        return operations.stream().filter(op -> op.getType() == type).count();
    }
}
