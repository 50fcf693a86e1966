package com.architecture.memory.codegraph.service.snapshot;

import com.architecture.memory.codegraph.config.CodeGraphProperties;
import com.architecture.memory.codegraph.dto.diff.GraphDiff;
import com.architecture.memory.codegraph.dto.diff.NodeChange;
import com.architecture.memory.codegraph.exception.SnapshotNotFoundException;
import com.architecture.memory.codegraph.model.graph.GraphState;
import com.architecture.memory.codegraph.model.snapshot.GraphSnapshot;
import com.architecture.memory.codegraph.repository.graph.InMemoryGraphStore;
import com.architecture.memory.codegraph.repository.snapshot.InMemorySnapshotStore;
import com.architecture.memory.codegraph.service.builder.GraphBuilder;
import com.architecture.memory.codegraph.service.builder.GraphFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

import static com.architecture.memory.codegraph.service.builder.GraphFixtures.function;
import static com.architecture.memory.codegraph.service.builder.GraphFixtures.module;
import static com.architecture.memory.codegraph.service.builder.GraphFixtures.payload;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SnapshotServiceTest {

    private CodeGraphProperties properties;
    private InMemoryGraphStore graphStore;
    private InMemorySnapshotStore snapshotStore;
    private GraphBuilder graphBuilder;
    private SnapshotService snapshotService;

    @BeforeEach
    void setUp() {
        properties = new CodeGraphProperties();
        graphStore = new InMemoryGraphStore();
        snapshotStore = new InMemorySnapshotStore();
        graphBuilder = GraphFixtures.graphBuilder(graphStore, properties);
        snapshotService = new SnapshotService(graphStore, snapshotStore, new GraphDiffService(), graphBuilder, properties);

        graphBuilder.applyExtraction(payload("app",
                List.of(module("app", "app.py"), function("app.main", "app")),
                List.of()));
    }

    private void addHelper() {
        graphBuilder.applyExtraction(payload("app",
                List.of(module("app", "app.py"), function("app.main", "app"), function("app.helper", "app")),
                List.of()));
    }

    @Test
    void createSnapshot_capturesCurrentGraph() {
        GraphState view = graphStore.readView();

        GraphSnapshot snapshot = snapshotService.createSnapshot("baseline");

        assertThat(UUID.fromString(snapshot.getId()).toString()).isEqualTo(snapshot.getId());
        assertThat(snapshot.getLabel()).isEqualTo("baseline");
        assertThat(snapshot.getGraphVersion()).isEqualTo(view.getVersion());
        assertThat(snapshot.nodeCount()).isEqualTo(view.nodeCount());
        assertThat(snapshot.edgeCount()).isEqualTo(view.edgeCount());
        assertThat(snapshot.getExpiresAt()).isNull();
        assertThat(snapshotService.getSnapshot(snapshot.getId())).isSameAs(snapshot);
    }

    @Test
    void laterCommits_doNotAlterExistingSnapshot() {
        GraphSnapshot snapshot = snapshotService.createSnapshot("baseline");
        int nodes = snapshot.nodeCount();

        addHelper();

        assertThat(snapshotService.getSnapshot(snapshot.getId()).nodeCount()).isEqualTo(nodes);
        assertThat(graphStore.readView().nodeCount()).isEqualTo(nodes + 1);
    }

    @Test
    void diffBetweenSnapshots_reportsAddedFunction() {
        GraphSnapshot before = snapshotService.createSnapshot("before");
        addHelper();
        GraphSnapshot after = snapshotService.createSnapshot("after");

        GraphDiff diff = snapshotService.diff(before.getId(), after.getId());

        assertThat(diff.getAddedNodes()).extracting(NodeChange::getNodeId).containsExactly("function:app.helper");
        assertThat(diff.getOldSnapshotId()).isEqualTo(before.getId());
    }

    @Test
    void diffWithCurrent_comparesAgainstLiveGraph() {
        GraphSnapshot before = snapshotService.createSnapshot("before");
        addHelper();

        GraphDiff diff = snapshotService.diffWithCurrent(before.getId());

        assertThat(diff.getAddedNodes()).extracting(NodeChange::getNodeId).containsExactly("function:app.helper");
        assertThat(diff.getNewSnapshotId()).isNull();
    }

    @Test
    void listSnapshots_returnsEverySnapshot() {
        GraphSnapshot first = snapshotService.createSnapshot("first");
        GraphSnapshot second = snapshotService.createSnapshot("second");

        assertThat(snapshotService.listSnapshots()).extracting(GraphSnapshot::getId)
                .containsExactlyInAnyOrder(first.getId(), second.getId());
    }

    @Test
    void manySnapshots_neverShareAnId() {
        Set<String> ids = new HashSet<>();
        for (int i = 0; i < 200; i++) {
            ids.add(snapshotService.createSnapshot("s" + i).getId());
        }

        assertThat(ids).hasSize(200);
        assertThat(snapshotService.listSnapshots()).hasSize(200);
    }

    @Test
    void unknownSnapshot_isNotFound() {
        assertThatThrownBy(() -> snapshotService.getSnapshot("nope"))
                .isInstanceOf(SnapshotNotFoundException.class);
        assertThatThrownBy(() -> snapshotService.diff("nope", "nope"))
                .isInstanceOf(SnapshotNotFoundException.class);
        assertThatThrownBy(() -> snapshotService.deleteSnapshot("nope"))
                .isInstanceOf(SnapshotNotFoundException.class);
    }

    @Test
    void deleteSnapshot_removesIt() {
        GraphSnapshot snapshot = snapshotService.createSnapshot("temp");

        snapshotService.deleteSnapshot(snapshot.getId());

        assertThat(snapshotService.listSnapshots()).isEmpty();
    }

    @Test
    void cleanup_removesOnlyExpiredSnapshots() {
        properties.getSnapshot().setTtlHours(1);
        GraphSnapshot expiring = snapshotService.createSnapshot("expiring");
        properties.getSnapshot().setTtlHours(0);
        GraphSnapshot kept = snapshotService.createSnapshot("kept");

        assertThat(snapshotService.cleanupExpiredSnapshots(Instant.now())).isZero();
        int removed = snapshotService.cleanupExpiredSnapshots(Instant.now().plus(Duration.ofHours(2)));

        assertThat(removed).isEqualTo(1);
        assertThat(snapshotService.listSnapshots()).extracting(GraphSnapshot::getId).containsExactly(kept.getId());
        assertThat(snapshotStore.findById(expiring.getId())).isEmpty();
    }

    @Test
    void restoreSnapshot_rewritesLiveGraph() {
        GraphSnapshot before = snapshotService.createSnapshot("before");
        addHelper();

        GraphState restored = snapshotService.restoreSnapshot(before.getId());

        assertThat(restored.nodeIds()).doesNotContain("function:app.helper");
        assertThat(restored.nodeIds()).containsExactlyInAnyOrderElementsOf(
                before.getNodes().stream().map(n -> n.getId()).toList());
        assertThat(snapshotService.diffWithCurrent(before.getId()).isEmpty()).isTrue();
    }
}
