package com.qcollector.backend.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.qcollector.backend.config.MigrationProperties;
import com.qcollector.backend.dto.BackupStatisticsDto;
import com.qcollector.backend.dto.BackupSummaryDto;
import com.qcollector.backend.dto.RestoreResult;
import com.qcollector.backend.entity.BackupTypes;
import com.qcollector.backend.entity.ColumnState;
import com.qcollector.backend.entity.FieldDataBackup;
import com.qcollector.backend.entity.FieldMigration;
import com.qcollector.backend.entity.MigrationType;
import com.qcollector.backend.entity.SnapshotEntry;
import com.qcollector.backend.exception.SnapshotValidationException;
import com.qcollector.backend.repository.ColumnRestoreWriter;
import com.qcollector.backend.repository.ColumnSnapshotReader;
import com.qcollector.backend.repository.FieldDataBackupRepository;
import jakarta.persistence.EntityNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.UUID;

/**
 * Point-in-time copies of a column's values, taken before a change that could lose them.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BackupService {

    private static final long MILLIS_PER_DAY = Duration.ofDays(1).toMillis();

    private final FieldDataBackupRepository backupRepository;
    private final ColumnSnapshotReader snapshotReader;
    private final ColumnRestoreWriter restoreWriter;
    private final MigrationLedgerService ledgerService;
    private final MigrationProperties properties;
    private final Clock clock;

    /**
     * Entry point for snapshots that arrive as raw JSON. The node must be an array of objects,
     * each with a non-null {@code rowId} and a {@code value} key (the value itself may be null).
     */
    @Transactional
    public FieldDataBackup createBackup(String fieldId, String formId, String tableName, String columnName,
                                        JsonNode snapshot, String backupType, String createdBy,
                                        LocalDateTime retentionUntil) {
        return createBackup(fieldId, formId, tableName, columnName, parseSnapshot(snapshot),
                backupType, createdBy, retentionUntil);
    }

    @Transactional
    public FieldDataBackup createBackup(String fieldId, String formId, String tableName, String columnName,
                                        List<SnapshotEntry> snapshot, String backupType, String createdBy,
                                        LocalDateTime retentionUntil) {
        if (!StringUtils.hasText(formId) || !StringUtils.hasText(tableName) || !StringUtils.hasText(columnName)) {
            throw new IllegalArgumentException("formId, tableName and columnName are required");
        }
        validateSnapshot(snapshot);

        LocalDateTime now = LocalDateTime.now(clock);
        FieldDataBackup backup = new FieldDataBackup();
        backup.setFieldId(fieldId);
        backup.setFormId(formId);
        backup.setTableName(tableName);
        backup.setColumnName(columnName);
        backup.setDataSnapshot(new ArrayList<>(snapshot));
        backup.setBackupType(StringUtils.hasText(backupType) ? backupType : BackupTypes.MANUAL);
        backup.setCreatedBy(createdBy);
        backup.setCreatedAt(now);
        backup.setRetentionUntil(resolveRetention(retentionUntil, now));

        FieldDataBackup saved = backupRepository.save(backup);
        log.info("[BACKUP] created {} for {}.{} ({} rows, type={}, expires {})", saved.getId(), tableName,
                columnName, snapshot.size(), saved.getBackupType(), saved.getRetentionUntil());
        return saved;
    }

    /**
     * Reads the live column and stores it as a backup.
     */
    @Transactional
    public FieldDataBackup snapshotColumn(String fieldId, String formId, String tableName, String columnName,
                                          String backupType, String createdBy) {
        List<SnapshotEntry> rows = snapshotReader.readColumn(tableName, columnName);
        return createBackup(fieldId, formId, tableName, columnName, rows, backupType, createdBy, null);
    }

    public LocalDateTime resolveRetention(LocalDateTime requested, LocalDateTime now) {
        if (requested != null) {
            return requested;
        }
        return now.plusDays(properties.getBackup().getRetentionDays());
    }

    public boolean isExpired(FieldDataBackup backup, LocalDateTime now) {
        return backup.getRetentionUntil() != null && backup.getRetentionUntil().isBefore(now);
    }

    public Integer daysUntilExpiration(FieldDataBackup backup, LocalDateTime now) {
        if (backup.getRetentionUntil() == null) {
            return null;
        }
        long millis = Duration.between(now, backup.getRetentionUntil()).toMillis();
        return (int) Math.ceil((double) millis / MILLIS_PER_DAY);
    }

    public int recordCount(FieldDataBackup backup) {
        List<SnapshotEntry> snapshot = backup.getDataSnapshot();
        return snapshot == null ? 0 : snapshot.size();
    }

    /**
     * Writes the snapshot back through {@code writer}. Never throws: every failure is folded
     * into the returned result with a zero count.
     */
    public RestoreResult restore(FieldDataBackup backup, ColumnRestoreWriter writer) {
        List<SnapshotEntry> snapshot = backup.getDataSnapshot();
        if (snapshot == null || snapshot.isEmpty()) {
            return RestoreResult.failed("No data to restore");
        }
        try {
            int restored = writer.restoreColumn(backup.getTableName(), backup.getColumnName(), snapshot);
            log.info("[BACKUP] restored {} rows from {} into {}.{}", restored, backup.getId(),
                    backup.getTableName(), backup.getColumnName());
            return RestoreResult.restored(restored);
        } catch (Exception ex) {
            log.warn("[BACKUP] restore of {} failed: {}", backup.getId(), ex.getMessage());
            return RestoreResult.failed("Restore failed: " + ex.getMessage());
        }
    }

    /**
     * Restores a stored backup into its live table and records the restore in the ledger.
     * Expired backups are refused. A ledger write that fails is logged and does not change the
     * result, since the rows have been written by then.
     */
    public RestoreResult restoreBackup(UUID backupId, String restoredBy) {
        FieldDataBackup backup = backupRepository.findById(backupId)
                .orElseThrow(() -> new EntityNotFoundException("Backup not found: " + backupId));
        if (isExpired(backup, LocalDateTime.now(clock))) {
            return RestoreResult.failed("Backup " + backupId + " has expired");
        }

        RestoreResult result = restore(backup, restoreWriter);
        if (result.success()) {
            try {
                ledgerService.recordSuccess(FieldMigration.builder()
                        .fieldId(backup.getFieldId())
                        .formId(backup.getFormId())
                        .migrationType(MigrationType.MODIFY_COLUMN)
                        .tableName(backup.getTableName())
                        .columnName(backup.getColumnName())
                        .newValue(ColumnState.named(backup.getColumnName()))
                        .backupId(backupId)
                        .executedBy(restoredBy), null);
            } catch (RuntimeException ex) {
                log.warn("[BACKUP] restore of {} succeeded but could not be recorded in the ledger: {}",
                        backupId, ex.getMessage());
            }
        }
        return result;
    }

    /**
     * One conditional DELETE, so overlapping sweeps can never remove the same row twice.
     */
    @Transactional
    public int cleanupExpired(LocalDateTime now) {
        int deleted = backupRepository.deleteExpired(now);
        if (deleted > 0) {
            log.info("[BACKUP] removed {} expired backups (cutoff {})", deleted, now);
        } else {
            log.debug("[BACKUP] no expired backups at {}", now);
        }
        return deleted;
    }

    @Transactional(readOnly = true)
    public List<FieldDataBackup> findExpiringSoon() {
        return findExpiringSoon(properties.getBackup().getExpiringSoonDays());
    }

    @Transactional(readOnly = true)
    public List<FieldDataBackup> findExpiringSoon(int withinDays) {
        return findExpiringSoon(withinDays, LocalDateTime.now(clock));
    }

    @Transactional(readOnly = true)
    public List<FieldDataBackup> findExpiringSoon(int withinDays, LocalDateTime now) {
        return backupRepository.findExpiringBetween(now, now.plusDays(withinDays));
    }

    @Transactional(readOnly = true)
    public FieldDataBackup getBackup(UUID backupId) {
        return backupRepository.findById(backupId)
                .orElseThrow(() -> new EntityNotFoundException("Backup not found: " + backupId));
    }

    @Transactional(readOnly = true)
    public List<FieldDataBackup> findByForm(String formId) {
        return backupRepository.findByFormIdOrderByCreatedAtDesc(formId);
    }

    @Transactional(readOnly = true)
    public List<FieldDataBackup> findByTableColumn(String tableName, String columnName) {
        return backupRepository.findByTableNameAndColumnNameOrderByCreatedAtDesc(tableName, columnName);
    }

    @Transactional(readOnly = true)
    public BackupStatisticsDto statistics(String formId) {
        Map<String, long[]> tallies = new TreeMap<>();
        long totalRecords = 0;
        List<FieldDataBackup> backups = backupRepository.findByFormIdOrderByCreatedAtDesc(formId);
        for (FieldDataBackup backup : backups) {
            int records = recordCount(backup);
            long[] tally = tallies.computeIfAbsent(backup.getBackupType(), type -> new long[2]);
            tally[0]++;
            tally[1] += records;
            totalRecords += records;
        }
        Map<String, BackupStatisticsDto.TypeTotals> byType = new TreeMap<>();
        tallies.forEach((type, tally) -> byType.put(type, new BackupStatisticsDto.TypeTotals(tally[0], tally[1])));
        return new BackupStatisticsDto(backups.size(), totalRecords, byType);
    }

    public BackupSummaryDto summarize(FieldDataBackup backup, LocalDateTime now) {
        return BackupSummaryDto.builder()
                .id(backup.getId())
                .formId(backup.getFormId())
                .fieldId(backup.getFieldId())
                .tableName(backup.getTableName())
                .columnName(backup.getColumnName())
                .recordCount(recordCount(backup))
                .backupType(backup.getBackupType())
                .createdBy(backup.getCreatedBy())
                .createdAt(backup.getCreatedAt())
                .retentionUntil(backup.getRetentionUntil())
                .daysUntilExpiration(daysUntilExpiration(backup, now))
                .expired(isExpired(backup, now))
                .build();
    }

    private List<SnapshotEntry> parseSnapshot(JsonNode snapshot) {
        if (snapshot == null || !snapshot.isArray()) {
            throw new SnapshotValidationException("data snapshot must be an array");
        }
        List<SnapshotEntry> entries = new ArrayList<>(snapshot.size());
        int index = 0;
        for (JsonNode item : snapshot) {
            if (!item.isObject() || !item.hasNonNull("rowId") || !item.has("value")) {
                throw new SnapshotValidationException(
                        "snapshot item " + index + " must be an object with rowId and value");
            }
            entries.add(new SnapshotEntry(item.get("rowId"), item.get("value")));
            index++;
        }
        return entries;
    }

    private void validateSnapshot(List<SnapshotEntry> snapshot) {
        if (snapshot == null) {
            throw new SnapshotValidationException("data snapshot must be an array");
        }
        for (int i = 0; i < snapshot.size(); i++) {
            SnapshotEntry entry = snapshot.get(i);
            if (entry == null || entry.rowId() == null || entry.rowId().isNull()) {
                throw new SnapshotValidationException("snapshot item " + i + " must have a rowId");
            }
            if (entry.value() == null) {
                throw new SnapshotValidationException("snapshot item " + i + " must have a value");
            }
        }
    }
}
