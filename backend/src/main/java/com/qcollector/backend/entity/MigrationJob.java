package com.qcollector.backend.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Durable queue entry. The identity column doubles as the enqueue sequence, so
 * "priority, then id" is the dequeue order.
 */
@Entity
@Table(name = "migration_jobs", indexes = {
        @Index(name = "idx_migration_jobs_dequeue", columnList = "status, priority, id"),
        @Index(name = "idx_migration_jobs_form", columnList = "form_id")
})
@Getter
@Setter
@NoArgsConstructor
public class MigrationJob {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "form_id", nullable = false, length = 64)
    private String formId;

    @Column(name = "field_id", length = 64)
    private String fieldId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32)
    private MigrationJobType type;

    @Column(nullable = false)
    private int priority;

    @Convert(converter = MigrationChangeConverter.class)
    @Column(nullable = false, columnDefinition = "TEXT")
    private MigrationChange payload;

    @Column(name = "requested_by", length = 64)
    private String requestedBy;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private MigrationJobStatus status;

    @Column(name = "attempts_made", nullable = false)
    private int attemptsMade;

    @Column(name = "max_attempts", nullable = false)
    private int maxAttempts;

    @Column(name = "available_at", nullable = false)
    private LocalDateTime availableAt;

    @Column(nullable = false)
    private int progress;

    @Column(name = "last_error", columnDefinition = "TEXT")
    private String lastError;

    @Column(name = "backup_id")
    private UUID backupId;

    @Column(name = "migration_id")
    private UUID migrationId;

    /** Set once the executor has returned; later claims only finish the bookkeeping. */
    @Column(name = "schema_applied", nullable = false)
    private boolean schemaApplied;

    @Convert(converter = ColumnStateConverter.class)
    @Column(name = "applied_old_state", columnDefinition = "TEXT")
    private ColumnState appliedOldState;

    @Convert(converter = ColumnStateConverter.class)
    @Column(name = "applied_new_state", columnDefinition = "TEXT")
    private ColumnState appliedNewState;

    /** Final error of a job whose failure could not be written yet. */
    @Column(name = "terminal_error", columnDefinition = "TEXT")
    private String terminalError;

    @Column(name = "worker_id", length = 64)
    private String workerId;

    @Column(name = "lease_until")
    private LocalDateTime leaseUntil;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Column(name = "started_at")
    private LocalDateTime startedAt;

    @Column(name = "finished_at")
    private LocalDateTime finishedAt;

    @Version
    private long version;

    public MigrationJob(MigrationChange payload, String requestedBy, int maxAttempts, LocalDateTime now) {
        this.formId = payload.formId();
        this.fieldId = payload.fieldId();
        this.type = payload.jobType();
        this.priority = payload.jobType().getPriority();
        this.payload = payload;
        this.requestedBy = requestedBy;
        this.status = MigrationJobStatus.WAITING;
        this.maxAttempts = maxAttempts;
        this.availableAt = now;
        this.createdAt = now;
    }

    public boolean hasAttemptsLeft() {
        return attemptsMade < maxAttempts;
    }

    /**
     * True when the outcome is already decided and only the ledger entry and final status are
     * missing. Such claims never call the executor and do not use up an attempt.
     */
    public boolean isFinishing() {
        return schemaApplied || terminalError != null;
    }

    public void releaseLease() {
        this.workerId = null;
        this.leaseUntil = null;
    }

    @PrePersist
    public void onPersist() {
        if (createdAt == null) {
            createdAt = LocalDateTime.now();
        }
        if (availableAt == null) {
            availableAt = createdAt;
        }
    }
}
