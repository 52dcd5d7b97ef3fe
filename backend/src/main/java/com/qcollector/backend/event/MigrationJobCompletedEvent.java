package com.qcollector.backend.event;

import com.qcollector.backend.entity.MigrationJobType;

import java.util.UUID;

public record MigrationJobCompletedEvent(Long jobId, String formId, MigrationJobType type, String tableName,
                                         String columnName, UUID migrationId, UUID backupId, int attempts) {
}
