package com.architecture.memory.codegraph.model.graph;

import com.architecture.memory.codegraph.exception.GraphStoreException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Immutable, indexed view of the whole graph at one version.
 *
 * Every read-only pass (validation, propagation, snapshots) works against a single instance,
 * so it can never observe a half-applied commit. Writes produce a new instance through
 * {@link #apply(GraphMutation)}.
 */
public final class GraphState {

    private static final GraphState EMPTY = new GraphState(0L, Map.of(), Map.of());

    private final long version;
    private final Map<String, GraphNode> nodes;
    private final Map<EdgeKey, GraphEdge> edges;
    private final Map<String, List<GraphEdge>> outgoing = new HashMap<>();
    private final Map<String, List<GraphEdge>> incoming = new HashMap<>();
    private final Map<String, List<GraphNode>> byQualifiedName = new HashMap<>();
    private final Map<String, List<GraphNode>> byModule = new HashMap<>();

    private GraphState(long version, Map<String, GraphNode> nodes, Map<EdgeKey, GraphEdge> edges) {
        this.version = version;
        this.nodes = Collections.unmodifiableMap(nodes);
        this.edges = Collections.unmodifiableMap(edges);

        for (GraphNode node : nodes.values()) {
            if (node.getQualifiedName() != null) {
                byQualifiedName.computeIfAbsent(node.getQualifiedName(), k -> new ArrayList<>()).add(node);
            }
            if (node.getModuleId() != null) {
                byModule.computeIfAbsent(node.getModuleId(), k -> new ArrayList<>()).add(node);
            }
        }
        for (GraphEdge edge : edges.values()) {
            outgoing.computeIfAbsent(edge.getSourceId(), k -> new ArrayList<>()).add(edge);
            incoming.computeIfAbsent(edge.getTargetId(), k -> new ArrayList<>()).add(edge);
        }
    }

    public static GraphState empty() {
        return EMPTY;
    }

    public static GraphState of(long version, Collection<GraphNode> nodes, Collection<GraphEdge> edges) {
        Map<String, GraphNode> nodeMap = new LinkedHashMap<>();
        for (GraphNode node : nodes) {
            nodeMap.put(node.getId(), node);
        }
        Map<EdgeKey, GraphEdge> edgeMap = new LinkedHashMap<>();
        for (GraphEdge edge : edges) {
            edgeMap.put(edge.key(), edge);
        }
        return new GraphState(version, nodeMap, edgeMap);
    }

    public long getVersion() {
        return version;
    }

    public int nodeCount() {
        return nodes.size();
    }

    public int edgeCount() {
        return edges.size();
    }

    public Collection<GraphNode> nodes() {
        return nodes.values();
    }

    public Collection<GraphEdge> edges() {
        return edges.values();
    }

    public Set<String> nodeIds() {
        return nodes.keySet();
    }

    public Optional<GraphNode> node(String id) {
        return Optional.ofNullable(nodes.get(id));
    }

    public boolean hasNode(String id) {
        return nodes.containsKey(id);
    }

    public Optional<GraphEdge> edge(EdgeKey key) {
        return Optional.ofNullable(edges.get(key));
    }

    public List<GraphNode> nodesOfKind(NodeKind kind) {
        return nodes.values().stream().filter(n -> n.getKind() == kind).collect(Collectors.toList());
    }

    public List<GraphNode> nodesInModule(String moduleId) {
        return byModule.getOrDefault(moduleId, Collections.emptyList());
    }

    public Set<String> moduleIds() {
        return byModule.keySet();
    }

    public List<GraphNode> nodesByQualifiedName(String qualifiedName) {
        return byQualifiedName.getOrDefault(qualifiedName, Collections.emptyList());
    }

    public Optional<GraphNode> nodeByQualifiedName(String qualifiedName, NodeKind kind) {
        return nodesByQualifiedName(qualifiedName).stream().filter(n -> n.getKind() == kind).findFirst();
    }

    public List<GraphEdge> outgoing(String nodeId) {
        return outgoing.getOrDefault(nodeId, Collections.emptyList());
    }

    public List<GraphEdge> outgoing(String nodeId, EdgeKind kind, EdgeKind... more) {
        Set<EdgeKind> kinds = EnumSet.of(kind, more);
        return outgoing(nodeId).stream().filter(e -> kinds.contains(e.getKind())).collect(Collectors.toList());
    }

    public List<GraphEdge> incoming(String nodeId) {
        return incoming.getOrDefault(nodeId, Collections.emptyList());
    }

    public List<GraphEdge> incoming(String nodeId, EdgeKind kind, EdgeKind... more) {
        Set<EdgeKind> kinds = EnumSet.of(kind, more);
        return incoming(nodeId).stream().filter(e -> kinds.contains(e.getKind())).collect(Collectors.toList());
    }

    /**
     * Nodes reached from {@code nodeId} over the given edge kinds, skipping dangling targets.
     */
    public List<GraphNode> targets(String nodeId, EdgeKind kind) {
        List<GraphNode> result = new ArrayList<>();
        for (GraphEdge edge : outgoing(nodeId, kind)) {
            GraphNode target = nodes.get(edge.getTargetId());
            if (target != null) {
                result.add(target);
            }
        }
        return result;
    }

    /**
     * The node that owns {@code nodeId} through a DECLARES, HAS_PARAMETER or HAS_CALLSITE edge.
     */
    public Optional<GraphNode> owner(String nodeId) {
        for (GraphEdge edge : incoming(nodeId)) {
            if (edge.getKind().isOwnership()) {
                GraphNode parent = nodes.get(edge.getSourceId());
                if (parent != null) {
                    return Optional.of(parent);
                }
            }
        }
        return Optional.empty();
    }

    public List<GraphNode> changedNodes() {
        return nodes.values().stream().filter(GraphNode::isChanged).collect(Collectors.toList());
    }

    /**
     * Returns the state produced by applying {@code mutation} on top of this one.
     * Invalid operations abort the whole mutation.
     */
    public GraphState apply(GraphMutation mutation) {
        if (mutation.isEmpty()) {
            return this;
        }
        Map<String, GraphNode> nodeMap = new LinkedHashMap<>(nodes);
        Map<EdgeKey, GraphEdge> edgeMap = new LinkedHashMap<>(edges);

        for (GraphMutation.Operation op : mutation.getOperations()) {
            switch (op.getType()) {
                case UPSERT_NODE -> {
                    GraphNode node = op.getNode();
                    GraphNode existing = nodeMap.get(node.getId());
                    if (existing != null && existing.getKind() != node.getKind()) {
                        throw new GraphStoreException("Node " + node.getId() + " already exists as "
                                + existing.getKind() + ", cannot store it as " + node.getKind());
                    }
                    nodeMap.put(node.getId(), node);
                }
                case DELETE_NODE -> {
                    nodeMap.remove(op.getNodeId());
                    edgeMap.keySet().removeIf(key -> key.getSourceId().equals(op.getNodeId()));
                }
                case UPSERT_EDGE -> {
                    GraphEdge edge = op.getEdge();
                    if (!nodeMap.containsKey(edge.getSourceId())) {
                        throw new GraphStoreException("Edge " + edge.key() + " has no source node");
                    }
                    edgeMap.put(edge.key(), edge);
                }
                case DELETE_EDGE -> edgeMap.remove(op.getEdgeKey());
                case MARK_CHANGED -> setChanged(nodeMap, op.getNodeIds(), true);
                case CLEAR_CHANGED -> setChanged(nodeMap, op.getNodeIds(), false);
                case CLEAR_ALL_CHANGED -> setChanged(nodeMap, new HashSet<>(nodeMap.keySet()), false);
                case REPLACE_ALL -> {
                    nodeMap.clear();
                    edgeMap.clear();
                    op.getNodes().forEach(n -> nodeMap.put(n.getId(), n));
                    op.getEdges().forEach(e -> edgeMap.put(e.key(), e));
                }
                default -> throw new GraphStoreException("Unsupported operation " + op.getType());
            }
        }
        return new GraphState(version + 1, nodeMap, edgeMap);
    }

    private static void setChanged(Map<String, GraphNode> nodeMap, Set<String> ids, boolean flag) {
        for (String id : ids) {
            GraphNode node = nodeMap.get(id);
            if (node != null) {
                nodeMap.put(id, node.withChanged(flag));
            }
        }
    }
}
