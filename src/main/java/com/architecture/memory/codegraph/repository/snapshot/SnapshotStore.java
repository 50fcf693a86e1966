package com.architecture.memory.codegraph.repository.snapshot;

import com.architecture.memory.codegraph.model.snapshot.GraphSnapshot;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persistence for graph snapshots. Snapshots are written once and never updated.
 */
public interface SnapshotStore {

    GraphSnapshot save(GraphSnapshot snapshot);

    Optional<GraphSnapshot> findById(String id);

    /**
     * All snapshots, newest first.
     */
    List<GraphSnapshot> findAll();

    boolean deleteById(String id);

    /**
     * Deletes every snapshot whose expiry lies before {@code now}.
     *
     * @return the number of snapshots removed
     */
    int deleteExpired(Instant now);
}
