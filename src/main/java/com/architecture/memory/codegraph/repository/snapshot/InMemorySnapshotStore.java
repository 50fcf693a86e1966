package com.architecture.memory.codegraph.repository.snapshot;

import com.architecture.memory.codegraph.model.snapshot.GraphSnapshot;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@Repository
@ConditionalOnProperty(prefix = "codegraph.snapshot", name = "store", havingValue = "memory", matchIfMissing = true)
public class InMemorySnapshotStore implements SnapshotStore {

    private final Map<String, GraphSnapshot> snapshots = new ConcurrentHashMap<>();

    @Override
    public GraphSnapshot save(GraphSnapshot snapshot) {
        snapshots.put(snapshot.getId(), snapshot);
        return snapshot;
    }

    @Override
    public Optional<GraphSnapshot> findById(String id) {
        return Optional.ofNullable(snapshots.get(id));
    }

    @Override
    public List<GraphSnapshot> findAll() {
        return snapshots.values().stream()
                .sorted(Comparator.comparing(GraphSnapshot::getCreatedAt).reversed()
                        .thenComparing(GraphSnapshot::getId))
                .toList();
    }

    @Override
    public boolean deleteById(String id) {
        return snapshots.remove(id) != null;
    }

    @Override
    public int deleteExpired(Instant now) {
        List<String> expired = snapshots.values().stream()
                .filter(s -> s.isExpired(now))
                .map(GraphSnapshot::getId)
                .toList();
        expired.forEach(snapshots::remove);
        return expired.size();
    }
}
