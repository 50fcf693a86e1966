package com.architecture.memory.codegraph.repository.graph;

import com.architecture.memory.codegraph.model.graph.EdgeQuery;
import com.architecture.memory.codegraph.model.graph.GraphEdge;
import com.architecture.memory.codegraph.model.graph.GraphMutation;
import com.architecture.memory.codegraph.model.graph.GraphNode;
import com.architecture.memory.codegraph.model.graph.GraphState;
import com.architecture.memory.codegraph.model.graph.NodeQuery;

import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Contract for the property-graph backend holding the code graph.
 *
 * Implementations must commit every {@link GraphMutation} atomically and must hand out read views
 * that never mix two versions of the graph. Failures are reported as
 * {@link com.architecture.memory.codegraph.exception.GraphStoreException}.
 */
public interface GraphStore {

    /**
     * A consistent view of the whole graph.
     */
    GraphState readView();

    /**
     * Atomically plans and applies a mutation against the current state.
     * The planner runs while concurrent writers are excluded.
     *
     * @return the state after the commit
     */
    GraphState commit(Function<GraphState, GraphMutation> planner);

    default GraphState apply(GraphMutation mutation) {
        return commit(state -> mutation);
    }

    default Optional<GraphNode> findNode(String id) {
        return readView().node(id);
    }

    default List<GraphNode> queryNodes(NodeQuery query) {
        return readView().nodes().stream().filter(query::matches).toList();
    }

    default List<GraphEdge> queryEdges(EdgeQuery query) {
        return readView().edges().stream().filter(query::matches).toList();
    }
}
