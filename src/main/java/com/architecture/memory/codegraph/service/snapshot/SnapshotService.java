package com.architecture.memory.codegraph.service.snapshot;

import com.architecture.memory.codegraph.config.CodeGraphProperties;
import com.architecture.memory.codegraph.dto.diff.GraphDiff;
import com.architecture.memory.codegraph.exception.SnapshotNotFoundException;
import com.architecture.memory.codegraph.model.graph.GraphState;
import com.architecture.memory.codegraph.model.snapshot.GraphSnapshot;
import com.architecture.memory.codegraph.repository.graph.GraphStore;
import com.architecture.memory.codegraph.repository.snapshot.SnapshotStore;
import com.architecture.memory.codegraph.service.builder.GraphBuilder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Creates, lists, diffs and expires graph snapshots.
 *
 * A snapshot is taken from one {@link GraphState}, which is never mutated, so concurrent builder
 * commits cannot tear it.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class SnapshotService {

    private final GraphStore graphStore;
    private final SnapshotStore snapshotStore;
    private final GraphDiffService graphDiffService;
    private final GraphBuilder graphBuilder;
    private final CodeGraphProperties properties;

    public GraphSnapshot createSnapshot(String label) {
        GraphState state = graphStore.readView();
        Instant now = Instant.now();
        int ttlHours = properties.getSnapshot().getTtlHours();
        Instant expiresAt = ttlHours > 0 ? now.plus(Duration.ofHours(ttlHours)) : null;
        String id = UUID.randomUUID().toString();

        GraphSnapshot snapshot = snapshotStore.save(GraphSnapshot.capture(id, label, state, now, expiresAt));
        log.info("[snapshot] created id={} label={} graphVersion={} nodes={} edges={}",
                id, label, snapshot.getGraphVersion(), snapshot.nodeCount(), snapshot.edgeCount());
        return snapshot;
    }

    public List<GraphSnapshot> listSnapshots() {
        return snapshotStore.findAll();
    }

    public GraphSnapshot getSnapshot(String snapshotId) {
        return snapshotStore.findById(snapshotId)
                .orElseThrow(() -> new SnapshotNotFoundException(snapshotId));
    }

    public void deleteSnapshot(String snapshotId) {
        if (!snapshotStore.deleteById(snapshotId)) {
            throw new SnapshotNotFoundException(snapshotId);
        }
        log.info("[snapshot] deleted id={}", snapshotId);
    }

    public GraphDiff diff(String oldSnapshotId, String newSnapshotId) {
        return graphDiffService.diff(getSnapshot(oldSnapshotId), getSnapshot(newSnapshotId));
    }

    public GraphDiff diff(GraphSnapshot oldSnapshot, GraphSnapshot newSnapshot) {
        return graphDiffService.diff(oldSnapshot, newSnapshot);
    }

    /**
     * Diff from a stored snapshot to the live graph.
     */
    public GraphDiff diffWithCurrent(String snapshotId) {
        GraphSnapshot snapshot = getSnapshot(snapshotId);
        GraphState current = graphStore.readView();
        GraphDiff diff = graphDiffService.diff(snapshot.getNodes(), snapshot.getEdges(), current.nodes(), current.edges());
        diff.setOldSnapshotId(snapshotId);
        return diff;
    }

    /**
     * Rewrites the live graph to the snapshot's content.
     */
    public GraphState restoreSnapshot(String snapshotId) {
        return graphBuilder.restoreSnapshot(getSnapshot(snapshotId));
    }

    /**
     * Remove snapshots past their TTL. Called by the scheduler.
     */
    public int cleanupExpiredSnapshots() {
        return cleanupExpiredSnapshots(Instant.now());
    }

    int cleanupExpiredSnapshots(Instant now) {
        int removed = snapshotStore.deleteExpired(now);
        if (removed > 0) {
            log.info("[snapshot] cleanup removed={}", removed);
        }
        return removed;
    }
}
