package com.architecture.memory.codegraph.service.builder;

import com.architecture.memory.codegraph.dto.extraction.BuildResult;
import com.architecture.memory.codegraph.dto.extraction.ExtractionPayload;
import com.architecture.memory.codegraph.dto.extraction.RawEntity;
import com.architecture.memory.codegraph.dto.extraction.RawEntityKind;
import com.architecture.memory.codegraph.dto.extraction.RawRelationship;
import com.architecture.memory.codegraph.exception.MalformedExtractionException;
import com.architecture.memory.codegraph.model.graph.EdgeKind;
import com.architecture.memory.codegraph.model.graph.GraphEdge;
import com.architecture.memory.codegraph.model.graph.GraphMutation;
import com.architecture.memory.codegraph.model.graph.GraphNode;
import com.architecture.memory.codegraph.model.graph.GraphState;
import com.architecture.memory.codegraph.model.graph.NodeKind;
import com.architecture.memory.codegraph.model.graph.NodeProperties;
import com.architecture.memory.codegraph.model.graph.Resolution;
import com.architecture.memory.codegraph.model.snapshot.GraphSnapshot;
import com.architecture.memory.codegraph.repository.graph.GraphStore;
import com.architecture.memory.codegraph.service.graph.CanonicalIdGenerator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

/**
 * Sole writer of the code graph. Turns extractor output into minimal, atomic mutations of one
 * module's subgraph and keeps call-site resolution in the rest of the graph up to date.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class GraphBuilder {

    private final GraphStore graphStore;
    private final ExtractionValidator extractionValidator;
    private final ModuleSubgraphAssembler assembler;
    private final ModuleLinker linker;
    private final CanonicalIdGenerator idGenerator;

    // ========== EXTRACTION ==========

    public BuildResult applyExtraction(ExtractionPayload payload) {
        String moduleId = payload.getModuleId();
        if (moduleId == null && payload.getEntities() != null) {
            moduleId = payload.getEntities().stream()
                    .filter(e -> e != null && e.getKind() == RawEntityKind.MODULE)
                    .map(RawEntity::getQualifiedName)
                    .findFirst()
                    .orElse(null);
        }
        return applyExtraction(moduleId, payload.getEntities(), payload.getRelationships());
    }

    /**
     * Replaces the subgraph of {@code moduleId} with the one described by the extraction.
     * Re-applying an identical extraction commits nothing.
     *
     * @throws MalformedExtractionException if the payload is inconsistent; the graph is left untouched
     */
    public BuildResult applyExtraction(String moduleId, List<RawEntity> entities, List<RawRelationship> relationships) {
        List<RawEntity> safeEntities = entities != null ? entities : List.of();
        List<RawRelationship> safeRelationships = relationships != null ? relationships : List.of();
        extractionValidator.validate(moduleId, safeEntities, safeRelationships);

        ModuleSubgraph desired = assembler.assemble(moduleId, safeEntities, safeRelationships);
        String moduleNodeId = desired.getModuleNodeId();

        AtomicReference<ModuleSubgraph> before = new AtomicReference<>();
        AtomicReference<ModuleSubgraph> after = new AtomicReference<>();
        AtomicReference<GraphMutation> committed = new AtomicReference<>();

        graphStore.commit(state -> {
            checkOwnership(state, moduleId, desired);
            ModuleSubgraph existing = ModuleSubgraph.of(state, moduleNodeId);
            GraphState overlay = state.apply(desired.diffFrom(existing));
            ModuleSubgraph linked = linker.link(overlay, desired);

            GraphMutation mutation = linked.diffFrom(existing);
            mutation.addAll(relinkOrphanedCallSites(state.apply(mutation), existing, linked));

            before.set(existing);
            after.set(linked);
            committed.set(mutation);
            return mutation;
        });

        BuildResult result = summarize(moduleId, before.get(), after.get(), committed.get());
        if (!result.isUnchanged()) {
            result.setRefreshedModules(refreshDependents(Set.of(moduleNodeId)));
        }
        log.info("[builder] applied module={} nodes +{} ~{} -{} edges +{} ~{} -{} mutations={} refreshed={}",
                moduleId, result.getNodesAdded(), result.getNodesUpdated(), result.getNodesRemoved(),
                result.getEdgesAdded(), result.getEdgesUpdated(), result.getEdgesRemoved(),
                result.getMutationCount(), result.getRefreshedModules().size());
        return result;
    }

    /**
     * Removes a module's whole subgraph. Call sites elsewhere that resolved into it become unresolved.
     */
    public BuildResult deleteModule(String moduleId) {
        String moduleNodeId = idGenerator.moduleId(moduleId);
        ModuleSubgraph nothing = new ModuleSubgraph(moduleNodeId, Map.of(), Map.of());

        AtomicReference<ModuleSubgraph> before = new AtomicReference<>();
        AtomicReference<GraphMutation> committed = new AtomicReference<>();
        graphStore.commit(state -> {
            ModuleSubgraph existing = ModuleSubgraph.of(state, moduleNodeId);
            GraphMutation mutation = nothing.diffFrom(existing);
            mutation.addAll(relinkOrphanedCallSites(state.apply(mutation), existing, nothing));
            before.set(existing);
            committed.set(mutation);
            return mutation;
        });

        BuildResult result = summarize(moduleId, before.get(), nothing, committed.get());
        if (!result.isUnchanged()) {
            result.setRefreshedModules(refreshDependents(Set.of(moduleNodeId)));
        }
        log.info("[builder] deleted module={} nodesRemoved={}", moduleId, result.getNodesRemoved());
        return result;
    }

    /**
     * Rewrites the whole graph to the state captured by {@code snapshot} in one commit.
     * Nodes whose content differs from the current graph come back flagged as changed.
     */
    public GraphState restoreSnapshot(GraphSnapshot snapshot) {
        GraphState restored = graphStore.commit(state -> {
            List<GraphNode> nodes = new ArrayList<>();
            for (GraphNode node : snapshot.getNodes()) {
                boolean differs = state.node(node.getId())
                        .map(current -> !ModuleSubgraph.sameContent(current, node))
                        .orElse(true);
                nodes.add(node.withChanged(differs));
            }
            return GraphMutation.empty().replaceAll(nodes, snapshot.getEdges());
        });
        log.info("[builder] restored snapshot={} version={} nodes={} edges={}",
                snapshot.getId(), restored.getVersion(), restored.nodeCount(), restored.edgeCount());
        return restored;
    }

    // ========== DEPENDENTS ==========

    /**
     * Re-links modules that may resolve differently now that {@code moduleNodeIds} changed:
     * importers of those modules, modules with unresolved or ambiguous call sites, and modules with
     * references to names that did not exist. Each module is committed on its own.
     *
     * @return ids of modules whose subgraph changed
     */
    public List<String> refreshDependents(Set<String> moduleNodeIds) {
        GraphState view = graphStore.readView();
        Set<String> prefixes = moduleNodeIds.stream()
                .map(view::node)
                .flatMap(Optional::stream)
                .map(GraphNode::getQualifiedName)
                .filter(Objects::nonNull)
                .collect(Collectors.toSet());

        Set<String> candidates = new TreeSet<>();
        for (String moduleNodeId : view.moduleIds()) {
            if (!moduleNodeIds.contains(moduleNodeId) && needsRefresh(view, moduleNodeId, moduleNodeIds, prefixes)) {
                candidates.add(moduleNodeId);
            }
        }

        List<String> refreshed = new ArrayList<>();
        for (String moduleNodeId : candidates) {
            AtomicReference<GraphMutation> committed = new AtomicReference<>(GraphMutation.empty());
            graphStore.commit(state -> {
                GraphMutation mutation = relink(state, moduleNodeId);
                committed.set(mutation);
                return mutation;
            });
            if (!committed.get().isEmpty()) {
                refreshed.add(moduleNodeId);
                log.debug("[builder] re-linked module={} operations={}", moduleNodeId, committed.get().size());
            }
        }
        return refreshed;
    }

    private boolean needsRefresh(GraphState view, String moduleNodeId, Set<String> changedModules, Set<String> changedQns) {
        for (GraphNode node : view.nodesInModule(moduleNodeId)) {
            if (node.is(NodeKind.CALL_SITE)
                    && !Resolution.Status.RESOLVED.name().equals(node.stringProperty(NodeProperties.RESOLUTION_STATUS))) {
                return true;
            }
            for (GraphEdge edge : view.outgoing(node.getId())) {
                if (edge.getKind().isOwnership()) {
                    continue;
                }
                if (!view.hasNode(edge.getTargetId()) && edge.stringProperty(NodeProperties.TARGET_QUALIFIED_NAME) != null) {
                    return true;
                }
                if (edge.getKind() == EdgeKind.IMPORTS && importsFrom(view, edge, changedModules, changedQns)) {
                    return true;
                }
            }
        }
        return false;
    }

    private static boolean importsFrom(GraphState view, GraphEdge imports, Set<String> changedModules, Set<String> changedQns) {
        boolean targetInChanged = view.node(imports.getTargetId())
                .map(target -> changedModules.contains(target.getModuleId()))
                .orElse(false);
        if (targetInChanged) {
            return true;
        }
        String name = imports.stringProperty(NodeProperties.TARGET_QUALIFIED_NAME);
        return name != null && changedQns.stream().anyMatch(qn -> name.equals(qn) || name.startsWith(qn + "."));
    }

    /**
     * Mutation that re-links an existing module against {@code view}.
     */
    GraphMutation relink(GraphState view, String moduleNodeId) {
        ModuleSubgraph existing = ModuleSubgraph.of(view, moduleNodeId);
        if (existing.isEmpty()) {
            return GraphMutation.empty();
        }
        return linker.link(view, existing).diffFrom(existing);
    }

    /**
     * Call sites of other modules whose RESOLVES_TO target was removed are re-resolved in the same commit,
     * so no RESOLVES_TO edge ever points at a deleted function.
     */
    private GraphMutation relinkOrphanedCallSites(GraphState view, ModuleSubgraph before, ModuleSubgraph after) {
        Set<String> affectedModules = new LinkedHashSet<>();
        for (GraphNode removed : before.getNodes().values()) {
            if (!removed.is(NodeKind.FUNCTION) || after.getNodes().containsKey(removed.getId())) {
                continue;
            }
            for (GraphEdge edge : view.incoming(removed.getId(), EdgeKind.RESOLVES_TO)) {
                view.node(edge.getSourceId())
                        .map(GraphNode::getModuleId)
                        .filter(module -> !module.equals(before.getModuleNodeId()))
                        .ifPresent(affectedModules::add);
            }
        }
        GraphMutation mutation = GraphMutation.empty();
        GraphState current = view;
        for (String moduleNodeId : affectedModules) {
            GraphMutation relinked = relink(current, moduleNodeId);
            current = current.apply(relinked);
            mutation.addAll(relinked);
        }
        return mutation;
    }

    // ========== HELPERS ==========

    private void checkOwnership(GraphState state, String moduleId, ModuleSubgraph desired) {
        List<String> problems = new ArrayList<>();
        for (GraphNode node : desired.getNodes().values()) {
            state.node(node.getId())
                    .filter(existing -> !desired.getModuleNodeId().equals(existing.getModuleId()))
                    .ifPresent(existing -> problems.add("node " + node.getId() + " is already owned by " + existing.getModuleId()));
        }
        if (!problems.isEmpty()) {
            throw new MalformedExtractionException(moduleId, problems);
        }
    }

    private static BuildResult summarize(String moduleId, ModuleSubgraph before, ModuleSubgraph after, GraphMutation mutation) {
        int nodesAdded = 0;
        int nodesUpdated = 0;
        for (GraphNode node : after.getNodes().values()) {
            GraphNode previous = before.getNodes().get(node.getId());
            if (previous == null) {
                nodesAdded++;
            } else if (!ModuleSubgraph.sameContent(previous, node)) {
                nodesUpdated++;
            }
        }
        int nodesRemoved = (int) before.getNodes().keySet().stream().filter(id -> !after.getNodes().containsKey(id)).count();

        int edgesAdded = 0;
        int edgesUpdated = 0;
        for (GraphEdge edge : after.getEdges().values()) {
            GraphEdge previous = before.getEdges().get(edge.key());
            if (previous == null) {
                edgesAdded++;
            } else if (!previous.getProperties().equals(edge.getProperties())) {
                edgesUpdated++;
            }
        }
        int edgesRemoved = (int) before.getEdges().keySet().stream().filter(key -> !after.getEdges().containsKey(key)).count();

        Set<String> changed = new TreeSet<>();
        for (GraphMutation.Operation op : mutation.getOperations()) {
            if (op.getType() == GraphMutation.OperationType.UPSERT_NODE) {
                changed.add(op.getNode().getId());
            } else if (op.getType() == GraphMutation.OperationType.MARK_CHANGED) {
                changed.addAll(op.getNodeIds());
            }
        }

        return BuildResult.builder()
                .moduleId(moduleId)
                .nodesAdded(nodesAdded)
                .nodesUpdated(nodesUpdated)
                .nodesRemoved(nodesRemoved)
                .edgesAdded(edgesAdded)
                .edgesUpdated(edgesUpdated)
                .edgesRemoved(edgesRemoved)
                .mutationCount(mutation.size())
                .changedNodeIds(new ArrayList<>(changed))
                .build();
    }
}
