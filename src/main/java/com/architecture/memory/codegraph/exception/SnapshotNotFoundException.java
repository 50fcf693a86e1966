package com.architecture.memory.codegraph.exception;

public class SnapshotNotFoundException extends CodeGraphException {

    public SnapshotNotFoundException(String snapshotId) {
        super("Snapshot not found: " + snapshotId);
    }
}
