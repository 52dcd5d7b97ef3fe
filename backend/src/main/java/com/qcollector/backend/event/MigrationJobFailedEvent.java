package com.qcollector.backend.event;

import com.qcollector.backend.entity.MigrationJobType;

/**
 * Published once per job, after the last attempt failed.
 */
public record MigrationJobFailedEvent(Long jobId, String formId, MigrationJobType type, String tableName,
                                      String columnName, int attempts, String errorMessage) {
}
