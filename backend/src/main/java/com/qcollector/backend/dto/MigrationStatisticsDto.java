package com.qcollector.backend.dto;

import com.qcollector.backend.entity.MigrationType;

import java.util.Map;

/**
 * Per-form migration counts. {@code byType} only holds types that occurred at least once.
 */
public record MigrationStatisticsDto(long total, long successful, long failed,
                                     Map<MigrationType, Outcomes> byType) {

    public record Outcomes(long success, long failed) {
    }
}
