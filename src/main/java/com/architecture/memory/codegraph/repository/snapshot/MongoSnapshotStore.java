package com.architecture.memory.codegraph.repository.snapshot;

import com.architecture.memory.codegraph.model.snapshot.GraphSnapshot;
import com.architecture.memory.codegraph.model.snapshot.GraphSnapshotDocument;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
@ConditionalOnProperty(prefix = "codegraph.snapshot", name = "store", havingValue = "mongo")
@RequiredArgsConstructor
@Slf4j
public class MongoSnapshotStore implements SnapshotStore {

    private final GraphSnapshotRepository graphSnapshotRepository;

    @Override
    public GraphSnapshot save(GraphSnapshot snapshot) {
        graphSnapshotRepository.save(GraphSnapshotDocument.from(snapshot));
        return snapshot;
    }

    @Override
    public Optional<GraphSnapshot> findById(String id) {
        return graphSnapshotRepository.findById(id).map(GraphSnapshotDocument::toSnapshot);
    }

    @Override
    public List<GraphSnapshot> findAll() {
        return graphSnapshotRepository.findAllByOrderByCreatedAtDesc().stream()
                .map(GraphSnapshotDocument::toSnapshot)
                .toList();
    }

    @Override
    public boolean deleteById(String id) {
        if (!graphSnapshotRepository.existsById(id)) {
            return false;
        }
        graphSnapshotRepository.deleteById(id);
        return true;
    }

    @Override
    public int deleteExpired(Instant now) {
        List<GraphSnapshotDocument> expired = graphSnapshotRepository.findByExpiresAtBefore(now);
        if (!expired.isEmpty()) {
            graphSnapshotRepository.deleteAll(expired);
            log.debug("[snapshot] removed expired documents count={}", expired.size());
        }
        return expired.size();
    }
}
