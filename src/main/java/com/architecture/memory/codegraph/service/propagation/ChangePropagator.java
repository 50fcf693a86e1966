package com.architecture.memory.codegraph.service.propagation;

import com.architecture.memory.codegraph.model.graph.GraphEdge;
import com.architecture.memory.codegraph.model.graph.GraphMutation;
import com.architecture.memory.codegraph.model.graph.GraphNode;
import com.architecture.memory.codegraph.model.graph.GraphState;
import com.architecture.memory.codegraph.model.graph.NodeKind;
import com.architecture.memory.codegraph.model.graph.NodeProperties;
import com.architecture.memory.codegraph.repository.graph.GraphStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.HashSet;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Maps changed files to graph nodes and spreads the {@code changed} flag to everything that
 * depends on them: callers (via RESOLVES_TO), importers (via IMPORTS) and subclasses (via INHERITS).
 *
 * Flags only ever get set here, never cleared, so replaying a propagation is harmless.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ChangePropagator {

    private final GraphStore graphStore;

    /**
     * Flags every node of the modules whose path, id or qualified name is listed.
     *
     * @return ids flagged by this call, sorted
     */
    public Set<String> markChanged(Collection<String> filePaths) {
        Set<String> files = new HashSet<>(filePaths);
        AtomicReference<Set<String>> marked = new AtomicReference<>(Set.of());
        graphStore.commit(state -> {
            Set<String> ids = new TreeSet<>();
            for (GraphNode module : state.nodesOfKind(NodeKind.MODULE)) {
                if (files.contains(module.stringProperty(NodeProperties.PATH))
                        || files.contains(module.getId())
                        || files.contains(module.getQualifiedName())) {
                    ids.add(module.getId());
                    state.nodesInModule(module.getId()).forEach(node -> ids.add(node.getId()));
                }
            }
            marked.set(ids);
            return GraphMutation.empty().markChanged(ids);
        });
        log.info("[propagator] marked files={} nodes={}", filePaths.size(), marked.get().size());
        return marked.get();
    }

    /**
     * Expands the stored changed set to its fixpoint and writes the new flags back.
     *
     * @return the complete changed set after propagation
     */
    public Set<String> propagate() {
        AtomicReference<Set<String>> result = new AtomicReference<>(Set.of());
        graphStore.commit(state -> {
            Set<String> seed = state.changedNodes().stream().map(GraphNode::getId).collect(Collectors.toSet());
            Set<String> expanded = expand(state, seed);
            result.set(expanded);
            Set<String> added = new TreeSet<>(expanded);
            added.removeAll(seed);
            log.info("[propagator] propagated seed={} added={} total={}", seed.size(), added.size(), expanded.size());
            return GraphMutation.empty().markChanged(added);
        });
        return result.get();
    }

    /**
     * Dependents of {@code seed} reached one frontier at a time until nothing new appears.
     * Call-graph cycles are legal; the visited set stops them.
     */
    public Set<String> expand(GraphState view, Set<String> seed) {
        Set<String> visited = new TreeSet<>();
        seed.stream().filter(view::hasNode).forEach(visited::add);
        Set<String> frontier = new HashSet<>(visited);
        int rounds = 0;

        while (!frontier.isEmpty()) {
            if (Thread.currentThread().isInterrupted()) {
                throw new CancellationException("Propagation cancelled after " + rounds + " rounds");
            }
            Set<String> next = frontier.parallelStream()
                    .flatMap(id -> dependents(view, id))
                    .filter(id -> !visited.contains(id))
                    .collect(Collectors.toSet());
            visited.addAll(next);
            frontier = next;
            rounds++;
        }
        log.debug("[propagator] fixpoint reached rounds={} size={}", rounds, visited.size());
        return visited;
    }

    private static Stream<String> dependents(GraphState view, String nodeId) {
        Stream.Builder<String> result = Stream.builder();
        for (GraphEdge edge : view.incoming(nodeId)) {
            if (!view.hasNode(edge.getSourceId())) {
                continue;
            }
            switch (edge.getKind()) {
                case RESOLVES_TO -> {
                    result.add(edge.getSourceId());
                    view.owner(edge.getSourceId()).ifPresent(caller -> result.add(caller.getId()));
                }
                case IMPORTS, INHERITS -> result.add(edge.getSourceId());
                default -> {
                }
            }
        }
        return result.build();
    }

    public void clearChanged() {
        graphStore.commit(state -> GraphMutation.empty().clearAllChanged());
        log.info("[propagator] cleared changed flags");
    }

    public Set<String> changedNodeIds() {
        return graphStore.readView().changedNodes().stream()
                .map(GraphNode::getId)
                .collect(Collectors.toCollection(TreeSet::new));
    }
}
