package com.architecture.memory.codegraph.repository.snapshot;

import com.architecture.memory.codegraph.model.snapshot.GraphSnapshotDocument;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

@Repository
public interface GraphSnapshotRepository extends MongoRepository<GraphSnapshotDocument, String> {

    List<GraphSnapshotDocument> findAllByOrderByCreatedAtDesc();

    List<GraphSnapshotDocument> findByExpiresAtBefore(Instant instant);
}
