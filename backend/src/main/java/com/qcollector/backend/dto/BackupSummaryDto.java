package com.qcollector.backend.dto;

import java.time.LocalDateTime;
import java.util.UUID;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class BackupSummaryDto {
    UUID id;
    String formId;
    String fieldId;
    String tableName;
    String columnName;
    int recordCount;
    String backupType;
    String createdBy;
    LocalDateTime createdAt;
    LocalDateTime retentionUntil;
    Integer daysUntilExpiration;
    boolean expired;
}
