package com.architecture.memory.codegraph.repository.graph;

import com.architecture.memory.codegraph.exception.GraphStoreException;
import com.architecture.memory.codegraph.model.graph.EdgeKind;
import com.architecture.memory.codegraph.model.graph.EdgeQuery;
import com.architecture.memory.codegraph.model.graph.GraphEdge;
import com.architecture.memory.codegraph.model.graph.GraphMutation;
import com.architecture.memory.codegraph.model.graph.GraphNode;
import com.architecture.memory.codegraph.model.graph.GraphState;
import com.architecture.memory.codegraph.model.graph.NodeKind;
import com.architecture.memory.codegraph.model.graph.NodeProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemoryGraphStoreTest {

    private InMemoryGraphStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryGraphStore();
        store.apply(GraphMutation.empty()
                .createOrUpdateNode(NodeKind.MODULE, "module:app", "module:app", Map.of(NodeProperties.QUALIFIED_NAME, "app"))
                .createOrUpdateNode(NodeKind.FUNCTION, "function:app.main", "module:app", Map.of(NodeProperties.NAME, "main"))
                .createOrUpdateEdge(EdgeKind.DECLARES, "module:app", "function:app.main", Map.of()));
    }

    @Test
    void commit_bumpsVersionAndKeepsOldViewsIntact() {
        GraphState before = store.readView();

        GraphState after = store.apply(GraphMutation.empty()
                .createOrUpdateNode(NodeKind.FUNCTION, "function:app.helper", "module:app", Map.of()));

        assertThat(after.getVersion()).isEqualTo(before.getVersion() + 1);
        assertThat(after.hasNode("function:app.helper")).isTrue();
        assertThat(before.hasNode("function:app.helper")).isFalse();
    }

    @Test
    void emptyMutation_isNotACommit() {
        long version = store.readView().getVersion();

        store.apply(GraphMutation.empty().markChanged(Set.of()));

        assertThat(store.readView().getVersion()).isEqualTo(version);
    }

    @Test
    void edgeWithoutSourceNode_abortsWholeCommit() {
        GraphState before = store.readView();

        assertThatThrownBy(() -> store.apply(GraphMutation.empty()
                .createOrUpdateNode(NodeKind.FUNCTION, "function:app.helper", "module:app", Map.of())
                .createOrUpdateEdge(EdgeKind.HAS_CALLSITE, "function:app.ghost", "callsite:app.ghost#0", Map.of())))
                .isInstanceOf(GraphStoreException.class)
                .hasMessageContaining("has no source node");

        assertThat(store.readView()).isSameAs(before);
    }

    @Test
    void changingNodeKind_isRejected() {
        assertThatThrownBy(() -> store.apply(GraphMutation.empty()
                .createOrUpdateNode(NodeKind.CLASS, "function:app.main", "module:app", Map.of())))
                .isInstanceOf(GraphStoreException.class)
                .hasMessageContaining("already exists as FUNCTION");
    }

    @Test
    void plannerFailure_propagatesAndLeavesStateUntouched() {
        GraphState before = store.readView();

        assertThatThrownBy(() -> store.commit(state -> {
            throw new IllegalStateException("planner failed");
        })).isInstanceOf(IllegalStateException.class).hasMessage("planner failed");

        assertThat(store.readView()).isSameAs(before);
    }

    @Test
    void deletingNode_dropsItsOutgoingEdges() {
        store.apply(GraphMutation.empty().deleteNode("module:app"));

        GraphState view = store.readView();
        assertThat(view.hasNode("module:app")).isFalse();
        assertThat(view.incoming("function:app.main")).isEmpty();
    }

    @Test
    void changedFlags_canBeSetAndCleared() {
        store.apply(GraphMutation.empty().markChanged(List.of("function:app.main")));
        assertThat(store.readView().changedNodes()).extracting(GraphNode::getId).containsExactly("function:app.main");

        store.apply(GraphMutation.empty().clearAllChanged());
        assertThat(store.readView().changedNodes()).isEmpty();
    }

    @Test
    void queryEdges_filtersByKind() {
        assertThat(store.queryEdges(EdgeQuery.builder().kinds(Set.of(EdgeKind.DECLARES)).build()))
                .extracting(GraphEdge::getTargetId)
                .containsExactly("function:app.main");
    }
}
