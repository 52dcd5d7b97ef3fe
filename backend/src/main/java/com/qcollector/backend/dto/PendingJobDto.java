package com.qcollector.backend.dto;

import com.qcollector.backend.entity.MigrationJob;
import com.qcollector.backend.entity.MigrationJobStatus;
import com.qcollector.backend.entity.MigrationJobType;
import java.time.LocalDateTime;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class PendingJobDto {
    Long id;
    MigrationJobType type;
    String tableName;
    String columnName;
    MigrationJobStatus status;
    int attempts;
    int progress;
    LocalDateTime availableAt;
    LocalDateTime createdAt;

    public static PendingJobDto fromEntity(MigrationJob job) {
        return PendingJobDto.builder()
                .id(job.getId())
                .type(job.getType())
                .tableName(job.getPayload().tableName())
                .columnName(job.getPayload().targetColumn())
                .status(job.getStatus())
                .attempts(job.getAttemptsMade())
                .progress(job.getProgress())
                .availableAt(job.getAvailableAt())
                .createdAt(job.getCreatedAt())
                .build();
    }
}
