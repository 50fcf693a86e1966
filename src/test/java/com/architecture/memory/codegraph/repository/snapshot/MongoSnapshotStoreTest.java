package com.architecture.memory.codegraph.repository.snapshot;

import com.architecture.memory.codegraph.model.graph.EdgeKind;
import com.architecture.memory.codegraph.model.graph.GraphEdge;
import com.architecture.memory.codegraph.model.graph.GraphNode;
import com.architecture.memory.codegraph.model.graph.NodeKind;
import com.architecture.memory.codegraph.model.graph.NodeProperties;
import com.architecture.memory.codegraph.model.snapshot.GraphSnapshot;
import com.architecture.memory.codegraph.model.snapshot.GraphSnapshotDocument;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class MongoSnapshotStoreTest {

    @Mock
    private GraphSnapshotRepository graphSnapshotRepository;

    @InjectMocks
    private MongoSnapshotStore mongoSnapshotStore;

    private static GraphSnapshot snapshot(String id, Instant expiresAt) {
        GraphNode module = GraphNode.of("module:app", NodeKind.MODULE, "module:app",
                Map.of(NodeProperties.NAME, "app", NodeProperties.QUALIFIED_NAME, "app"));
        GraphNode main = GraphNode.of("function:app.main", NodeKind.FUNCTION, "module:app",
                Map.of(NodeProperties.NAME, "main", NodeProperties.PARAMETERS, List.of("argv")), true);
        return GraphSnapshot.builder()
                .id(id)
                .label("before")
                .createdAt(Instant.parse("2026-01-01T10:00:00Z"))
                .expiresAt(expiresAt)
                .graphVersion(7)
                .nodes(List.of(module, main))
                .edges(List.of(GraphEdge.of(module.getId(), EdgeKind.DECLARES, main.getId())))
                .build();
    }

    @Test
    void save_writesDocumentWithEveryNodeAndEdge() {
        GraphSnapshot snapshot = snapshot("s1", null);

        mongoSnapshotStore.save(snapshot);

        ArgumentCaptor<GraphSnapshotDocument> captor = ArgumentCaptor.forClass(GraphSnapshotDocument.class);
        verify(graphSnapshotRepository).save(captor.capture());
        GraphSnapshotDocument document = captor.getValue();
        assertThat(document.getId()).isEqualTo("s1");
        assertThat(document.getGraphVersion()).isEqualTo(7);
        assertThat(document.getNodes()).extracting(GraphSnapshotDocument.NodeRecord::getKind)
                .containsExactly("MODULE", "FUNCTION");
        assertThat(document.getNodes().get(1).isChanged()).isTrue();
        assertThat(document.getEdges()).extracting(GraphSnapshotDocument.EdgeRecord::getKind)
                .containsExactly("DECLARES");
    }

    @Test
    void findById_restoresEqualSnapshot() {
        GraphSnapshot snapshot = snapshot("s1", Instant.parse("2026-01-02T10:00:00Z"));
        when(graphSnapshotRepository.findById("s1")).thenReturn(Optional.of(GraphSnapshotDocument.from(snapshot)));

        Optional<GraphSnapshot> loaded = mongoSnapshotStore.findById("s1");

        assertThat(loaded).contains(snapshot);
        assertThat(loaded.get().toState().node("function:app.main").orElseThrow().isChanged()).isTrue();
    }

    @Test
    void deleteById_reportsMissingSnapshot() {
        when(graphSnapshotRepository.existsById("gone")).thenReturn(false);

        assertThat(mongoSnapshotStore.deleteById("gone")).isFalse();
        verify(graphSnapshotRepository, never()).deleteById(any());
    }

    @Test
    void deleteExpired_removesDocumentsPastExpiry() {
        Instant now = Instant.parse("2026-01-03T00:00:00Z");
        GraphSnapshotDocument expired = GraphSnapshotDocument.from(snapshot("old", Instant.parse("2026-01-02T00:00:00Z")));
        when(graphSnapshotRepository.findByExpiresAtBefore(now)).thenReturn(List.of(expired));

        int removed = mongoSnapshotStore.deleteExpired(now);

        assertThat(removed).isEqualTo(1);
        verify(graphSnapshotRepository).deleteAll(List.of(expired));
    }

    @Test
    void findAll_keepsRepositoryOrder() {
        when(graphSnapshotRepository.findAllByOrderByCreatedAtDesc()).thenReturn(List.of(
                GraphSnapshotDocument.from(snapshot("newer", null)),
                GraphSnapshotDocument.from(snapshot("older", null))));

        assertThat(mongoSnapshotStore.findAll()).extracting(GraphSnapshot::getId).containsExactly("newer", "older");
    }
}
