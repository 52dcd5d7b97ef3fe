package com.qcollector.backend.dto;

import com.qcollector.backend.entity.MigrationType;
import java.time.LocalDateTime;
import java.util.UUID;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class MigrationSummaryDto {
    UUID id;
    MigrationType type;
    String tableName;
    String columnName;
    boolean success;
    String executedBy;
    LocalDateTime executedAt;
    boolean canRollback;
    boolean hasBackup;
    boolean recent;
    String description;
}
