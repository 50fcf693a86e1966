package com.architecture.memory.codegraph.scheduler;

import com.architecture.memory.codegraph.service.snapshot.SnapshotService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Scheduled task to clean up expired graph snapshots.
 * Runs every hour to remove snapshots past their TTL.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class SnapshotCleanupScheduler {

    private final SnapshotService snapshotService;

    @Scheduled(fixedRateString = "${codegraph.snapshot.cleanup-interval-ms:3600000}")
    public void cleanupExpiredSnapshots() {
        log.debug("Running snapshot cleanup...");
        try {
            int cleaned = snapshotService.cleanupExpiredSnapshots();
            if (cleaned > 0) {
                log.info("Snapshot cleanup completed: {} expired snapshots removed", cleaned);
            }
        } catch (RuntimeException e) {
            log.error("Snapshot cleanup failed: {}", e.getMessage(), e);
        }
    }
}
