package com.qcollector.backend.service.queue;

import com.qcollector.backend.config.MigrationProperties;
import com.qcollector.backend.entity.BackupTypes;
import com.qcollector.backend.entity.ColumnState;
import com.qcollector.backend.entity.FieldDataBackup;
import com.qcollector.backend.entity.FieldMigration;
import com.qcollector.backend.entity.MigrationChange;
import com.qcollector.backend.entity.MigrationJob;
import com.qcollector.backend.event.MigrationJobCompletedEvent;
import com.qcollector.backend.event.MigrationJobFailedEvent;
import com.qcollector.backend.event.MigrationJobProgressEvent;
import com.qcollector.backend.exception.SchemaExecutorException;
import com.qcollector.backend.executor.SchemaChangeResult;
import com.qcollector.backend.executor.SchemaContext;
import com.qcollector.backend.executor.SchemaExecutor;
import com.qcollector.backend.service.BackupService;
import com.qcollector.backend.service.MigrationLedgerService;
import com.qcollector.backend.util.RollbackStatements;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Runs one attempt of a claimed job: optional snapshot, the DDL call, then the ledger entry.
 * Once the executor has returned, the result is stored on the job and the DDL is never sent
 * again; a failed ledger write only repeats the bookkeeping. Failures never escape.
 */
@Component
@Slf4j
public class MigrationJobProcessor {

    private final SchemaExecutor schemaExecutor;
    private final BackupService backupService;
    private final MigrationLedgerService ledgerService;
    private final MigrationJobStore jobStore;
    private final ApplicationEventPublisher eventPublisher;
    private final MigrationProperties properties;
    private final Clock clock;
    private final TransactionTemplate txTemplate;

    public MigrationJobProcessor(SchemaExecutor schemaExecutor,
                                 BackupService backupService,
                                 MigrationLedgerService ledgerService,
                                 MigrationJobStore jobStore,
                                 ApplicationEventPublisher eventPublisher,
                                 MigrationProperties properties,
                                 Clock clock,
                                 PlatformTransactionManager transactionManager) {
        this.schemaExecutor = schemaExecutor;
        this.backupService = backupService;
        this.ledgerService = ledgerService;
        this.jobStore = jobStore;
        this.eventPublisher = eventPublisher;
        this.properties = properties;
        this.clock = clock;
        this.txTemplate = new TransactionTemplate(transactionManager);
    }

    public void process(MigrationJob job) {
        MigrationChange change = job.getPayload();
        log.info("[MIGRATION_QUEUE] job {} attempt {}/{}: {} on table {}", job.getId(), job.getAttemptsMade(),
                job.getMaxAttempts(), job.getType(), change.tableName());
        publishProgress(job, 10);

        if (job.getTerminalError() != null) {
            fail(job, change, job.getTerminalError(), job.getBackupId());
            return;
        }

        UUID backupId = job.getBackupId();
        SchemaChangeResult applied;
        if (job.isSchemaApplied()) {
            log.info("[MIGRATION_QUEUE] job {} schema change already applied, finishing the ledger entry", job.getId());
            applied = new SchemaChangeResult(job.getAppliedOldState(), job.getAppliedNewState(), backupId);
        } else {
            SchemaChangeResult result;
            try {
                backupId = prepareBackup(job, change, backupId);
                SchemaContext context = new SchemaContext(change.formId(), job.getRequestedBy(), backupId != null, backupId);
                result = execute(change, context);
            } catch (RuntimeException ex) {
                handleFailure(job, change, ex, backupId);
                return;
            }
            if (backupId == null && result != null) {
                backupId = result.backupId();
            }
            applied = new SchemaChangeResult(
                    merge(result == null ? null : result.oldState(), priorState(change)),
                    merge(result == null ? null : result.newState(), nextState(change)),
                    backupId);
            try {
                jobStore.recordApplied(job.getId(), applied.oldState(), applied.newState(), backupId);
            } catch (RuntimeException ex) {
                log.error("[MIGRATION_QUEUE] job {} schema change applied but not saved on the job: {}",
                        job.getId(), ex.getMessage());
            }
            publishProgress(job, 90);
        }

        try {
            complete(job, change, applied);
        } catch (RuntimeException ex) {
            deferCompletion(job, applied, ex);
        }
    }

    /**
     * Snapshots the column once per job. A retry reuses the backup taken by an earlier attempt.
     */
    private UUID prepareBackup(MigrationJob job, MigrationChange change, UUID existing) {
        if (existing != null) {
            return existing;
        }
        String backupType = switch (change.jobType()) {
            case DELETE_FIELD -> ((MigrationChange.DeleteField) change).backup() ? BackupTypes.AUTO_DELETE : null;
            case CHANGE_TYPE -> BackupTypes.AUTO_TYPE_CHANGE;
            case RENAME_FIELD, ADD_FIELD -> null;
        };
        if (backupType == null) {
            return null;
        }
        FieldDataBackup backup = backupService.snapshotColumn(change.fieldId(), change.formId(), change.tableName(),
                change.targetColumn(), backupType, job.getRequestedBy());
        jobStore.rememberBackup(job.getId(), backup.getId());
        job.setBackupId(backup.getId());
        publishProgress(job, 40);
        return backup.getId();
    }

    private SchemaChangeResult execute(MigrationChange change, SchemaContext context) {
        return switch (change.jobType()) {
            case ADD_FIELD -> {
                MigrationChange.AddField add = (MigrationChange.AddField) change;
                yield schemaExecutor.addColumn(add.tableName(), add.fieldId(), add.columnName(), add.dataType(), context);
            }
            case DELETE_FIELD -> {
                MigrationChange.DeleteField delete = (MigrationChange.DeleteField) change;
                yield schemaExecutor.dropColumn(delete.tableName(), delete.fieldId(), delete.columnName(), context);
            }
            case RENAME_FIELD -> {
                MigrationChange.RenameField rename = (MigrationChange.RenameField) change;
                yield schemaExecutor.renameColumn(rename.tableName(), rename.fieldId(), rename.oldColumnName(),
                        rename.newColumnName(), context);
            }
            case CHANGE_TYPE -> {
                MigrationChange.ChangeType retype = (MigrationChange.ChangeType) change;
                yield schemaExecutor.changeColumnType(retype.tableName(), retype.fieldId(), retype.columnName(),
                        retype.oldType(), retype.newType(), context);
            }
        };
    }

    private void complete(MigrationJob job, MigrationChange change, SchemaChangeResult applied) {
        ColumnState before = applied.oldState();
        ColumnState after = applied.newState();
        UUID backupId = applied.backupId();
        String columnName = columnAfter(change);
        String rollback = RollbackStatements.derive(change.jobType().getMigrationType(), change.tableName(),
                columnName, before, after);

        FieldMigration migration = txTemplate.execute(status -> {
            FieldMigration saved = ledgerService.recordSuccess(draft(job, change, columnName)
                    .oldValue(before)
                    .newValue(after)
                    .backupId(backupId), rollback);
            jobStore.markCompleted(job.getId(), saved.getId(), backupId, LocalDateTime.now(clock));
            return saved;
        });

        publishProgress(job, 100);
        eventPublisher.publishEvent(new MigrationJobCompletedEvent(job.getId(), change.formId(), job.getType(),
                change.tableName(), columnName, migration.getId(), backupId, job.getAttemptsMade()));
    }

    /**
     * The DDL went through but the ledger entry did not. Only the bookkeeping is retried.
     */
    private void deferCompletion(MigrationJob job, SchemaChangeResult applied, RuntimeException ex) {
        String error = messageOf(ex);
        LocalDateTime retryAt = LocalDateTime.now(clock).plus(backoffFor(1));
        log.warn("[MIGRATION_QUEUE] job {} applied but could not be completed, finishing again at {}: {}",
                job.getId(), retryAt, error);
        try {
            jobStore.scheduleCompletion(job.getId(), applied.oldState(), applied.newState(), applied.backupId(),
                    error, retryAt);
        } catch (RuntimeException persistError) {
            log.error("[MIGRATION_QUEUE] job {} left ACTIVE until its lease expires: {}", job.getId(),
                    persistError.getMessage());
        }
    }

    private void handleFailure(MigrationJob job, MigrationChange change, RuntimeException ex, UUID backupId) {
        String error = messageOf(ex);
        boolean permanent = ex instanceof SchemaExecutorException executorError && !executorError.isTransient();

        if (!permanent && job.hasAttemptsLeft()) {
            Duration delay = backoffFor(job.getAttemptsMade());
            log.warn("[MIGRATION_QUEUE] job {} attempt {}/{} failed, retrying in {} ms: {}", job.getId(),
                    job.getAttemptsMade(), job.getMaxAttempts(), delay.toMillis(), error);
            try {
                jobStore.scheduleRetry(job.getId(), error, LocalDateTime.now(clock).plus(delay));
            } catch (RuntimeException persistError) {
                log.error("[MIGRATION_QUEUE] job {} could not be rescheduled, left ACTIVE until its lease expires: {}",
                        job.getId(), persistError.getMessage());
            }
            return;
        }

        log.error("[MIGRATION_QUEUE] job {} failed after {} attempt(s): {}", job.getId(), job.getAttemptsMade(), error, ex);
        fail(job, change, error, backupId);
    }

    /**
     * Writes the failed ledger entry and the FAILED status together. If that transaction does not
     * commit, the job waits for another claim that only repeats this step.
     */
    private void fail(MigrationJob job, MigrationChange change, String error, UUID backupId) {
        LocalDateTime now = LocalDateTime.now(clock);
        String columnName = change.targetColumn();
        try {
            txTemplate.executeWithoutResult(status -> {
                FieldMigration failed = ledgerService.recordFailure(draft(job, change, columnName)
                        .oldValue(priorState(change))
                        .newValue(nextState(change))
                        .backupId(backupId), error);
                jobStore.markFailed(job.getId(), error, failed.getId(), now);
            });
        } catch (RuntimeException persistError) {
            LocalDateTime retryAt = now.plus(backoffFor(1));
            log.warn("[MIGRATION_QUEUE] job {} failure could not be recorded, recording again at {}: {}",
                    job.getId(), retryAt, persistError.getMessage());
            try {
                jobStore.deferFailure(job.getId(), error, retryAt);
            } catch (RuntimeException deferError) {
                log.error("[MIGRATION_QUEUE] job {} left ACTIVE until its lease expires: {}", job.getId(),
                        deferError.getMessage());
            }
            return;
        }
        eventPublisher.publishEvent(new MigrationJobFailedEvent(job.getId(), change.formId(), job.getType(),
                change.tableName(), columnName, job.getAttemptsMade(), error));
    }

    Duration backoffFor(int attempt) {
        Duration initial = properties.getQueue().getInitialBackoff();
        return initial.multipliedBy(1L << Math.max(0, attempt - 1));
    }

    private FieldMigration.FieldMigrationBuilder draft(MigrationJob job, MigrationChange change, String columnName) {
        return FieldMigration.builder()
                .fieldId(change.fieldId())
                .formId(change.formId())
                .migrationType(change.jobType().getMigrationType())
                .tableName(change.tableName())
                .columnName(columnName)
                .executedBy(job.getRequestedBy());
    }

    private static String columnAfter(MigrationChange change) {
        if (change instanceof MigrationChange.RenameField rename) {
            return rename.newColumnName();
        }
        return change.targetColumn();
    }

    private static String messageOf(RuntimeException ex) {
        return ex.getMessage() == null ? ex.getClass().getSimpleName() : ex.getMessage();
    }

    /**
     * Fills the parts of an executor-reported state that it left out from the state implied by
     * the change itself.
     */
    static ColumnState merge(ColumnState reported, ColumnState implied) {
        if (reported == null) {
            return implied;
        }
        if (implied == null) {
            return reported;
        }
        return new ColumnState(
                reported.columnName() != null ? reported.columnName() : implied.columnName(),
                reported.hasDataType() ? reported.dataType() : implied.dataType(),
                reported.nullable() != null ? reported.nullable() : implied.nullable(),
                reported.defaultValue() != null ? reported.defaultValue() : implied.defaultValue());
    }

    private static ColumnState priorState(MigrationChange change) {
        return switch (change.jobType()) {
            case ADD_FIELD -> null;
            case DELETE_FIELD, RENAME_FIELD -> ColumnState.named(change.targetColumn());
            case CHANGE_TYPE -> ColumnState.typed(change.targetColumn(), ((MigrationChange.ChangeType) change).oldType());
        };
    }

    private static ColumnState nextState(MigrationChange change) {
        return switch (change.jobType()) {
            case ADD_FIELD -> {
                MigrationChange.AddField add = (MigrationChange.AddField) change;
                yield ColumnState.typed(add.columnName(), add.dataType());
            }
            case DELETE_FIELD -> null;
            case RENAME_FIELD -> ColumnState.named(((MigrationChange.RenameField) change).newColumnName());
            case CHANGE_TYPE -> ColumnState.typed(change.targetColumn(), ((MigrationChange.ChangeType) change).newType());
        };
    }

    private void publishProgress(MigrationJob job, int progress) {
        job.setProgress(progress);
        eventPublisher.publishEvent(new MigrationJobProgressEvent(job.getId(), job.getFormId(), progress));
    }
}
