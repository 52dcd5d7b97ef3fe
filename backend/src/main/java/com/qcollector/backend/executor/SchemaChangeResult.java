package com.qcollector.backend.executor;

import com.qcollector.backend.entity.ColumnState;

import java.util.UUID;

/**
 * Outcome of a successful DDL call. {@code backupId} is only filled by executors that take
 * their own snapshot; otherwise the engine's snapshot is used.
 */
public record SchemaChangeResult(ColumnState oldState, ColumnState newState, UUID backupId) {

    public static SchemaChangeResult of(ColumnState oldState, ColumnState newState) {
        return new SchemaChangeResult(oldState, newState, null);
    }
}
