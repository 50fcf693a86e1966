package com.architecture.memory.codegraph.service.builder;

import com.architecture.memory.codegraph.model.graph.EdgeKey;
import com.architecture.memory.codegraph.model.graph.EdgeKind;
import com.architecture.memory.codegraph.model.graph.GraphEdge;
import com.architecture.memory.codegraph.model.graph.GraphNode;
import com.architecture.memory.codegraph.model.graph.GraphState;
import com.architecture.memory.codegraph.model.graph.NodeKind;
import com.architecture.memory.codegraph.model.graph.NodeProperties;
import com.architecture.memory.codegraph.model.graph.Resolution;
import com.architecture.memory.codegraph.service.graph.CanonicalIdGenerator;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Points a module's symbolic edges at the nodes they name and resolves its call sites.
 * Linking is a pure function of the module subgraph and the surrounding graph, so linking an
 * already linked module again changes nothing.
 */
@Component
@RequiredArgsConstructor
class ModuleLinker {

    /** Edge kinds whose target is written as a name by the extractor. */
    private static final Set<EdgeKind> NAMED_TARGETS = EnumSet.of(EdgeKind.IMPORTS, EdgeKind.INHERITS,
            EdgeKind.IS_SUBTYPE_OF, EdgeKind.REFERENCES, EdgeKind.ASSIGNS_TO, EdgeKind.READS_FROM, EdgeKind.DECORATES);

    /** Edge kinds recomputed on every link. */
    private static final Set<EdgeKind> DERIVED = EnumSet.of(EdgeKind.RESOLVES_TO, EdgeKind.HAS_DECORATOR);

    private static final List<NodeKind> IMPORT_TARGETS =
            List.of(NodeKind.MODULE, NodeKind.CLASS, NodeKind.FUNCTION, NodeKind.VARIABLE, NodeKind.TYPE);
    private static final List<NodeKind> TYPE_TARGETS = List.of(NodeKind.CLASS, NodeKind.TYPE);
    private static final List<NodeKind> DECORATOR_TARGETS = List.of(NodeKind.FUNCTION, NodeKind.CLASS);
    private static final List<NodeKind> VALUE_TARGETS = List.of(NodeKind.VARIABLE, NodeKind.PARAMETER,
            NodeKind.FUNCTION, NodeKind.CLASS, NodeKind.MODULE);

    private final CallSiteResolver callSiteResolver;
    private final CanonicalIdGenerator idGenerator;

    /**
     * @param view a graph that already contains {@code subgraph}'s nodes
     */
    ModuleSubgraph link(GraphState view, ModuleSubgraph subgraph) {
        String moduleNodeId = subgraph.getModuleNodeId();
        String moduleQn = view.node(moduleNodeId).map(GraphNode::getQualifiedName).orElse(null);
        ImportTable imports = ImportTable.of(view, moduleNodeId);

        Map<String, GraphNode> nodes = new LinkedHashMap<>(subgraph.getNodes());
        Map<EdgeKey, GraphEdge> edges = new LinkedHashMap<>();
        List<GraphEdge> decorations = new ArrayList<>();

        for (GraphEdge edge : subgraph.getEdges().values()) {
            if (DERIVED.contains(edge.getKind())) {
                continue;
            }
            String targetName = edge.stringProperty(NodeProperties.TARGET_QUALIFIED_NAME);
            if (NAMED_TARGETS.contains(edge.getKind()) && targetName != null) {
                String targetId = resolveTarget(view, imports, moduleQn, edge.getKind(), targetName);
                edge = GraphEdge.of(edge.getSourceId(), edge.getKind(), targetId, edge.getProperties());
                if (edge.getKind() == EdgeKind.DECORATES) {
                    decorations.add(edge);
                }
            }
            edges.put(edge.key(), edge);
        }

        for (GraphEdge decorates : decorations) {
            if (nodes.containsKey(decorates.getTargetId())) {
                GraphEdge hasDecorator = GraphEdge.of(decorates.getTargetId(), EdgeKind.HAS_DECORATOR, decorates.getSourceId());
                edges.put(hasDecorator.key(), hasDecorator);
            }
        }

        // Call sites resolve against the re-targeted edges, so inherited methods are found in one pass
        GraphState retargeted = view.apply(new ModuleSubgraph(moduleNodeId, nodes, edges)
                .diffFrom(ModuleSubgraph.of(view, moduleNodeId)));

        for (GraphNode node : subgraph.getNodes().values()) {
            if (!node.is(NodeKind.CALL_SITE)) {
                continue;
            }
            Resolution resolution = callSiteResolver.resolve(retargeted, node, imports);
            GraphNode linked = node
                    .withProperty(NodeProperties.RESOLUTION_STATUS, resolution.getStatus().name())
                    .withProperty(NodeProperties.CANDIDATES, resolution instanceof Resolution.Ambiguous ambiguous
                            ? ambiguous.getCandidateIds()
                            : null);
            nodes.put(linked.getId(), linked);
            if (resolution instanceof Resolution.Resolved resolved) {
                GraphEdge resolvesTo = GraphEdge.of(node.getId(), EdgeKind.RESOLVES_TO, resolved.getTargetId());
                edges.put(resolvesTo.key(), resolvesTo);
            }
        }
        return new ModuleSubgraph(moduleNodeId, nodes, edges);
    }

    private String resolveTarget(GraphState view, ImportTable imports, String moduleQn, EdgeKind kind, String name) {
        List<String> candidates = new ArrayList<>();
        if (kind != EdgeKind.IMPORTS) {
            imports.expand(name).ifPresent(candidates::add);
        }
        candidates.add(name);
        if (kind != EdgeKind.IMPORTS && moduleQn != null) {
            candidates.add(moduleQn + "." + name);
        }
        List<NodeKind> preferred = switch (kind) {
            case IMPORTS -> IMPORT_TARGETS;
            case INHERITS, IS_SUBTYPE_OF -> TYPE_TARGETS;
            case DECORATES -> DECORATOR_TARGETS;
            default -> VALUE_TARGETS;
        };
        for (String qualifiedName : candidates) {
            for (NodeKind nodeKind : preferred) {
                Optional<GraphNode> target = view.nodeByQualifiedName(qualifiedName, nodeKind);
                if (target.isPresent()) {
                    return target.get().getId();
                }
            }
        }
        return idGenerator.placeholderId(name);
    }
}
