package com.qcollector.backend.service;

import com.qcollector.backend.dto.MigrationStatisticsDto;
import com.qcollector.backend.dto.MigrationSummaryDto;
import com.qcollector.backend.entity.ColumnState;
import com.qcollector.backend.entity.FieldMigration;
import com.qcollector.backend.entity.MigrationType;
import com.qcollector.backend.repository.FieldMigrationRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Append-only audit trail of schema changes, plus the rollback and reporting queries built on it.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MigrationLedgerService {

    static final Duration RECENT_WINDOW = Duration.ofHours(24);

    private final FieldMigrationRepository fieldMigrationRepository;
    private final Clock clock;

    /**
     * Persists a fully built entry after checking the outcome invariants.
     */
    @Transactional
    public FieldMigration record(FieldMigration migration) {
        if (migration.getMigrationType() == null) {
            throw new IllegalArgumentException("migrationType is required");
        }
        if (migration.getFormId() == null || migration.getTableName() == null) {
            throw new IllegalArgumentException("formId and tableName are required");
        }
        if (!migration.isSuccess() && migration.getRollbackStatement() != null) {
            throw new IllegalArgumentException("A failed migration cannot carry a rollback statement");
        }
        if (!migration.isSuccess() && migration.getErrorMessage() == null) {
            throw new IllegalArgumentException("A failed migration needs an error message");
        }
        if (migration.isSuccess() && migration.getErrorMessage() != null) {
            throw new IllegalArgumentException("A successful migration cannot carry an error message");
        }
        FieldMigration saved = fieldMigrationRepository.save(migration);
        log.info("[LEDGER] {} ({})", describe(saved), saved.getId());
        return saved;
    }

    @Transactional
    public FieldMigration recordSuccess(FieldMigration.FieldMigrationBuilder draft, String rollbackStatement) {
        return record(draft
                .success(true)
                .errorMessage(null)
                .rollbackStatement(rollbackStatement)
                .executedAt(LocalDateTime.now(clock))
                .build());
    }

    @Transactional
    public FieldMigration recordFailure(FieldMigration.FieldMigrationBuilder draft, String errorMessage) {
        return record(draft
                .success(false)
                .errorMessage(errorMessage == null ? "Unknown error" : errorMessage)
                .rollbackStatement(null)
                .executedAt(LocalDateTime.now(clock))
                .build());
    }

    /**
     * An ADD_COLUMN whose field still exists stays put: dropping the column would leave the
     * form definition pointing at nothing.
     */
    public boolean canRollback(FieldMigration migration) {
        if (!migration.isSuccess() || migration.getRollbackStatement() == null) {
            return false;
        }
        return migration.getMigrationType() != MigrationType.ADD_COLUMN || migration.getFieldId() == null;
    }

    public String rollbackStatement(FieldMigration migration) {
        return canRollback(migration) ? migration.getRollbackStatement() : null;
    }

    public String describe(FieldMigration migration) {
        String column = migration.getColumnName() == null ? "" : " " + migration.getColumnName();
        String table = migration.getTableName();
        String text = switch (migration.getMigrationType()) {
            case ADD_COLUMN -> "Added column" + column + " to table " + table;
            case DROP_COLUMN -> "Removed column" + column + " from table " + table;
            case MODIFY_COLUMN -> "Modified column" + column + " in table " + table;
            case RENAME_COLUMN -> describeRename(migration, table);
        };
        return migration.isSuccess() ? text : text + " (FAILED)";
    }

    private String describeRename(FieldMigration migration, String table) {
        ColumnState before = migration.getOldValue();
        String current = migration.getColumnName();
        if (before != null && before.columnName() != null && current != null
                && !current.equals(before.columnName())) {
            return "Renamed column " + before.columnName() + " to " + current + " in table " + table;
        }
        return "Renamed column" + (current == null ? "" : " " + current) + " in table " + table;
    }

    public boolean isRecent(FieldMigration migration, LocalDateTime now) {
        LocalDateTime executedAt = migration.getExecutedAt();
        return executedAt != null && Duration.between(executedAt, now).compareTo(RECENT_WINDOW) < 0;
    }

    public MigrationSummaryDto summarize(FieldMigration migration, LocalDateTime now) {
        return MigrationSummaryDto.builder()
                .id(migration.getId())
                .type(migration.getMigrationType())
                .tableName(migration.getTableName())
                .columnName(migration.getColumnName())
                .success(migration.isSuccess())
                .executedBy(migration.getExecutedBy())
                .executedAt(migration.getExecutedAt())
                .canRollback(canRollback(migration))
                .hasBackup(migration.getBackupId() != null)
                .recent(isRecent(migration, now))
                .description(describe(migration))
                .build();
    }

    @Transactional(readOnly = true)
    public List<FieldMigration> findByForm(String formId) {
        return fieldMigrationRepository.findByFormIdOrderByExecutedAtDesc(formId);
    }

    @Transactional(readOnly = true)
    public List<FieldMigration> findRecent(LocalDateTime now) {
        return fieldMigrationRepository.findByExecutedAtGreaterThanEqualOrderByExecutedAtDesc(now.minus(RECENT_WINDOW));
    }

    @Transactional(readOnly = true)
    public List<FieldMigration> findByBackup(UUID backupId) {
        return fieldMigrationRepository.findByBackupId(backupId);
    }

    @Transactional(readOnly = true)
    public List<FieldMigration> findRollbackable(String formId) {
        return fieldMigrationRepository
                .findByFormIdAndSuccessTrueAndRollbackStatementIsNotNullOrderByExecutedAtDesc(formId)
                .stream()
                .filter(this::canRollback)
                .toList();
    }

    @Transactional(readOnly = true)
    public MigrationStatisticsDto statistics(String formId) {
        Map<MigrationType, long[]> tallies = new EnumMap<>(MigrationType.class);
        long successful = 0;
        long failed = 0;
        for (FieldMigrationRepository.OutcomeCount row : fieldMigrationRepository.countOutcomesForForm(formId)) {
            long[] tally = tallies.computeIfAbsent(row.getMigrationType(), type -> new long[2]);
            if (Boolean.TRUE.equals(row.getSuccess())) {
                tally[0] += row.getTotal();
                successful += row.getTotal();
            } else {
                tally[1] += row.getTotal();
                failed += row.getTotal();
            }
        }
        Map<MigrationType, MigrationStatisticsDto.Outcomes> byType = new LinkedHashMap<>();
        tallies.forEach((type, tally) -> byType.put(type, new MigrationStatisticsDto.Outcomes(tally[0], tally[1])));
        return new MigrationStatisticsDto(successful + failed, successful, failed, byType);
    }
}
