package com.qcollector.backend.executor;

import java.util.UUID;

/**
 * Who asked for a change and what the engine already did around it. {@code backupId} is set
 * when the queue snapshotted the column before calling the executor.
 */
public record SchemaContext(String formId, String requestedBy, boolean backup, UUID backupId) {
}
