package com.architecture.memory.codegraph.service.builder;

import com.architecture.memory.codegraph.model.graph.EdgeKey;
import com.architecture.memory.codegraph.model.graph.GraphEdge;
import com.architecture.memory.codegraph.model.graph.GraphMutation;
import com.architecture.memory.codegraph.model.graph.GraphNode;
import com.architecture.memory.codegraph.model.graph.GraphState;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * The nodes owned by one module plus every edge leaving them.
 */
final class ModuleSubgraph {

    private final String moduleNodeId;
    private final Map<String, GraphNode> nodes;
    private final Map<EdgeKey, GraphEdge> edges;

    ModuleSubgraph(String moduleNodeId, Map<String, GraphNode> nodes, Map<EdgeKey, GraphEdge> edges) {
        this.moduleNodeId = moduleNodeId;
        this.nodes = Collections.unmodifiableMap(new LinkedHashMap<>(nodes));
        this.edges = Collections.unmodifiableMap(new LinkedHashMap<>(edges));
    }

    static ModuleSubgraph of(GraphState view, String moduleNodeId) {
        Map<String, GraphNode> nodes = new LinkedHashMap<>();
        Map<EdgeKey, GraphEdge> edges = new LinkedHashMap<>();
        for (GraphNode node : view.nodesInModule(moduleNodeId)) {
            nodes.put(node.getId(), node);
            for (GraphEdge edge : view.outgoing(node.getId())) {
                edges.put(edge.key(), edge);
            }
        }
        return new ModuleSubgraph(moduleNodeId, nodes, edges);
    }

    String getModuleNodeId() {
        return moduleNodeId;
    }

    Map<String, GraphNode> getNodes() {
        return nodes;
    }

    Map<EdgeKey, GraphEdge> getEdges() {
        return edges;
    }

    boolean isEmpty() {
        return nodes.isEmpty();
    }

    /**
     * Minimal mutation that turns {@code existing} into this subgraph. Added and updated nodes are
     * written with {@code changed=true}; surviving nodes whose outgoing edges changed are marked changed.
     */
    GraphMutation diffFrom(ModuleSubgraph existing) {
        GraphMutation mutation = GraphMutation.empty();
        Set<String> upserted = new LinkedHashSet<>();
        Set<String> touched = new LinkedHashSet<>();

        for (EdgeKey key : existing.edges.keySet()) {
            if (!edges.containsKey(key) && nodes.containsKey(key.getSourceId())) {
                mutation.deleteEdge(key);
                touched.add(key.getSourceId());
            }
        }
        for (String id : existing.nodes.keySet()) {
            if (!nodes.containsKey(id)) {
                mutation.deleteNode(id);
            }
        }
        for (GraphNode node : nodes.values()) {
            GraphNode previous = existing.nodes.get(node.getId());
            if (previous == null || !sameContent(previous, node)) {
                mutation.createOrUpdateNode(node.withChanged(true));
                upserted.add(node.getId());
            }
        }
        for (GraphEdge edge : edges.values()) {
            GraphEdge previous = existing.edges.get(edge.key());
            if (previous == null || !previous.getProperties().equals(edge.getProperties())) {
                mutation.createOrUpdateEdge(edge);
                touched.add(edge.getSourceId());
            }
        }
        touched.removeAll(upserted);
        touched.removeIf(id -> !existing.nodes.containsKey(id));
        mutation.markChanged(touched);
        return mutation;
    }

    static boolean sameContent(GraphNode a, GraphNode b) {
        return a.getKind() == b.getKind()
                && Objects.equals(a.getModuleId(), b.getModuleId())
                && a.getProperties().equals(b.getProperties());
    }
}
