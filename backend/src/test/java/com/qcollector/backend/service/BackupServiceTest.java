package com.qcollector.backend.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.IntNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.qcollector.backend.config.MigrationProperties;
import com.qcollector.backend.dto.BackupStatisticsDto;
import com.qcollector.backend.dto.BackupSummaryDto;
import com.qcollector.backend.dto.RestoreResult;
import com.qcollector.backend.entity.BackupTypes;
import com.qcollector.backend.entity.FieldDataBackup;
import com.qcollector.backend.entity.FieldMigration;
import com.qcollector.backend.entity.MigrationType;
import com.qcollector.backend.entity.SnapshotEntry;
import com.qcollector.backend.exception.SnapshotValidationException;
import com.qcollector.backend.repository.ColumnRestoreWriter;
import com.qcollector.backend.repository.ColumnSnapshotReader;
import com.qcollector.backend.repository.FieldDataBackupRepository;
import com.qcollector.backend.util.JsonColumns;
import jakarta.persistence.EntityNotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class BackupServiceTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2026, 3, 1, 12, 0);

    private FieldDataBackupRepository backupRepository;
    private ColumnSnapshotReader snapshotReader;
    private ColumnRestoreWriter restoreWriter;
    private MigrationLedgerService ledgerService;
    private BackupService backupService;

    @BeforeEach
    void setUp() {
        backupRepository = mock(FieldDataBackupRepository.class);
        snapshotReader = mock(ColumnSnapshotReader.class);
        restoreWriter = mock(ColumnRestoreWriter.class);
        ledgerService = mock(MigrationLedgerService.class);
        when(backupRepository.save(any(FieldDataBackup.class))).thenAnswer(invocation -> {
            FieldDataBackup backup = invocation.getArgument(0);
            backup.setId(UUID.randomUUID());
            return backup;
        });
        Clock clock = Clock.fixed(NOW.toInstant(ZoneOffset.UTC), ZoneOffset.UTC);
        backupService = new BackupService(backupRepository, snapshotReader, restoreWriter, ledgerService,
                new MigrationProperties(), clock);
    }

    private static List<SnapshotEntry> twoRows() {
        return List.of(
                new SnapshotEntry(IntNode.valueOf(1), TextNode.valueOf("Alice")),
                new SnapshotEntry(IntNode.valueOf(2), NullNode.getInstance()));
    }

    private static FieldDataBackup backupWith(List<SnapshotEntry> snapshot, LocalDateTime retentionUntil) {
        FieldDataBackup backup = new FieldDataBackup();
        backup.setId(UUID.randomUUID());
        backup.setFormId("form-1");
        backup.setFieldId("field-1");
        backup.setTableName("t");
        backup.setColumnName("c");
        backup.setBackupType(BackupTypes.MANUAL);
        backup.setDataSnapshot(snapshot);
        backup.setRetentionUntil(retentionUntil);
        return backup;
    }

    @Test
    @DisplayName("Without an explicit retention date the backup is kept for 90 days")
    void defaultRetention() {
        FieldDataBackup backup = backupService.createBackup("field-1", "form-1", "t", "c", twoRows(),
                null, "user-1", null);

        assertThat(backup.getRetentionUntil()).isEqualTo(NOW.plusDays(90));
        assertThat(backup.getBackupType()).isEqualTo(BackupTypes.MANUAL);
        assertThat(backupService.recordCount(backup)).isEqualTo(2);
    }

    @Test
    @DisplayName("An explicit retention date is kept as given")
    void explicitRetention() {
        LocalDateTime until = NOW.plusDays(3);

        FieldDataBackup backup = backupService.createBackup("field-1", "form-1", "t", "c", twoRows(),
                BackupTypes.AUTO_DELETE, "user-1", until);

        assertThat(backup.getRetentionUntil()).isEqualTo(until);
        assertThat(backup.getBackupType()).isEqualTo(BackupTypes.AUTO_DELETE);
    }

    @Test
    @DisplayName("A JSON snapshot must be an array of objects with rowId and value")
    void rejectsMalformedJsonSnapshot() {
        JsonNode notArray = JsonColumns.readTree("{\"rowId\":1,\"value\":\"x\"}");
        JsonNode missingValue = JsonColumns.readTree("[{\"rowId\":1}]");
        JsonNode missingRowId = JsonColumns.readTree("[{\"value\":\"x\"}]");

        assertThatThrownBy(() -> backupService.createBackup("f", "form-1", "t", "c", notArray, null, "u", null))
                .isInstanceOf(SnapshotValidationException.class);
        assertThatThrownBy(() -> backupService.createBackup("f", "form-1", "t", "c", missingValue, null, "u", null))
                .isInstanceOf(SnapshotValidationException.class);
        assertThatThrownBy(() -> backupService.createBackup("f", "form-1", "t", "c", missingRowId, null, "u", null))
                .isInstanceOf(SnapshotValidationException.class);
        verify(backupRepository, never()).save(any(FieldDataBackup.class));
    }

    @Test
    @DisplayName("A JSON snapshot whose values are null is still valid")
    void acceptsNullValues() {
        JsonNode snapshot = JsonColumns.readTree("[{\"rowId\":1,\"value\":null},{\"rowId\":2,\"value\":\"b\"}]");

        FieldDataBackup backup = backupService.createBackup("f", "form-1", "t", "c", snapshot, null, "u", null);

        assertThat(backupService.recordCount(backup)).isEqualTo(2);
        assertThat(backup.getDataSnapshot().get(0).value().isNull()).isTrue();
    }

    @Test
    @DisplayName("Record count is zero for a missing or empty snapshot")
    void recordCountOfEmptySnapshots() {
        assertThat(backupService.recordCount(backupWith(null, null))).isZero();
        assertThat(backupService.recordCount(backupWith(List.of(), null))).isZero();
    }

    @Test
    @DisplayName("Expiry follows the retention date and never applies without one")
    void expiry() {
        assertThat(backupService.isExpired(backupWith(twoRows(), NOW.minusSeconds(1)), NOW)).isTrue();
        assertThat(backupService.isExpired(backupWith(twoRows(), NOW.plusDays(1)), NOW)).isFalse();
        assertThat(backupService.isExpired(backupWith(twoRows(), null), NOW.plusYears(50))).isFalse();
    }

    @Test
    @DisplayName("Days until expiration round partial days up")
    void daysUntilExpiration() {
        assertThat(backupService.daysUntilExpiration(backupWith(twoRows(), NOW.plusDays(5)), NOW)).isEqualTo(5);
        assertThat(backupService.daysUntilExpiration(backupWith(twoRows(), NOW.plusHours(30)), NOW)).isEqualTo(2);
        assertThat(backupService.daysUntilExpiration(backupWith(twoRows(), null), NOW)).isNull();
    }

    @Test
    @DisplayName("Restoring through a writer that accepts everything restores every record")
    void restoreRoundTrip() {
        FieldDataBackup backup = backupService.createBackup("f", "form-1", "t", "c", twoRows(), null, "u", null);
        ColumnRestoreWriter acceptAll = (table, column, entries) -> entries.size();

        RestoreResult result = backupService.restore(backup, acceptAll);

        assertThat(result.success()).isTrue();
        assertThat(result.restoredCount()).isEqualTo(backupService.recordCount(backup));
        assertThat(result.message()).isEqualTo("Restored 2 records");
    }

    @Test
    @DisplayName("A failing writer produces a failed result instead of an exception")
    void restoreFailureIsReported() {
        ColumnRestoreWriter failing = (table, column, entries) -> {
            throw new IllegalStateException("connection reset");
        };

        RestoreResult result = backupService.restore(backupWith(twoRows(), null), failing);

        assertThat(result.success()).isFalse();
        assertThat(result.restoredCount()).isZero();
        assertThat(result.message()).isEqualTo("Restore failed: connection reset");
    }

    @Test
    @DisplayName("An empty snapshot has nothing to restore")
    void restoreEmptySnapshot() {
        RestoreResult result = backupService.restore(backupWith(List.of(), null), restoreWriter);

        assertThat(result.success()).isFalse();
        assertThat(result.message()).isEqualTo("No data to restore");
        verify(restoreWriter, never()).restoreColumn(any(), any(), anyList());
    }

    @Test
    @DisplayName("Restoring a stored backup writes the rows and records the restore in the ledger")
    void restoreStoredBackup() {
        FieldDataBackup backup = backupWith(twoRows(), NOW.plusDays(10));
        when(backupRepository.findById(backup.getId())).thenReturn(Optional.of(backup));
        when(restoreWriter.restoreColumn(eq("t"), eq("c"), anyList())).thenReturn(2);

        RestoreResult result = backupService.restoreBackup(backup.getId(), "admin");

        assertThat(result.success()).isTrue();
        assertThat(result.restoredCount()).isEqualTo(2);
        ArgumentCaptor<FieldMigration.FieldMigrationBuilder> draft =
                ArgumentCaptor.forClass(FieldMigration.FieldMigrationBuilder.class);
        verify(ledgerService).recordSuccess(draft.capture(), eq(null));
        FieldMigration recorded = draft.getValue().success(true).build();
        assertThat(recorded.getMigrationType()).isEqualTo(MigrationType.MODIFY_COLUMN);
        assertThat(recorded.getBackupId()).isEqualTo(backup.getId());
        assertThat(recorded.getExecutedBy()).isEqualTo("admin");
    }

    @Test
    @DisplayName("A restore that wrote its rows stays successful when the ledger write fails")
    void restoreSurvivesLedgerFailure() {
        FieldDataBackup backup = backupWith(twoRows(), NOW.plusDays(10));
        when(backupRepository.findById(backup.getId())).thenReturn(Optional.of(backup));
        when(restoreWriter.restoreColumn(eq("t"), eq("c"), anyList())).thenReturn(2);
        when(ledgerService.recordSuccess(any(), any())).thenThrow(new IllegalStateException("ledger unavailable"));

        RestoreResult result = backupService.restoreBackup(backup.getId(), "admin");

        assertThat(result.success()).isTrue();
        assertThat(result.restoredCount()).isEqualTo(2);
        verify(restoreWriter).restoreColumn(eq("t"), eq("c"), anyList());
    }

    @Test
    @DisplayName("Looking up an unknown backup fails with not found")
    void getBackup() {
        FieldDataBackup backup = backupWith(twoRows(), null);
        UUID unknown = UUID.randomUUID();
        when(backupRepository.findById(backup.getId())).thenReturn(Optional.of(backup));
        when(backupRepository.findById(unknown)).thenReturn(Optional.empty());

        assertThat(backupService.getBackup(backup.getId())).isSameAs(backup);
        assertThatThrownBy(() -> backupService.getBackup(unknown))
                .isInstanceOf(EntityNotFoundException.class)
                .hasMessageContaining(unknown.toString());
        assertThatThrownBy(() -> backupService.restoreBackup(unknown, "admin"))
                .isInstanceOf(EntityNotFoundException.class);
    }

    @Test
    @DisplayName("A backup summary carries the record count and the expiry view")
    void summarize() {
        FieldDataBackup backup = backupWith(twoRows(), NOW.plusHours(30));
        backup.setCreatedBy("user-1");
        backup.setCreatedAt(NOW.minusDays(1));

        BackupSummaryDto summary = backupService.summarize(backup, NOW);

        assertThat(summary.getId()).isEqualTo(backup.getId());
        assertThat(summary.getTableName()).isEqualTo("t");
        assertThat(summary.getColumnName()).isEqualTo("c");
        assertThat(summary.getRecordCount()).isEqualTo(2);
        assertThat(summary.getBackupType()).isEqualTo(BackupTypes.MANUAL);
        assertThat(summary.getCreatedBy()).isEqualTo("user-1");
        assertThat(summary.getDaysUntilExpiration()).isEqualTo(2);
        assertThat(summary.isExpired()).isFalse();

        BackupSummaryDto later = backupService.summarize(backup, NOW.plusDays(3));
        assertThat(later.isExpired()).isTrue();
    }

    @Test
    @DisplayName("Expired backups are not restored")
    void expiredBackupIsRefused() {
        FieldDataBackup backup = backupWith(twoRows(), NOW.minusDays(1));
        when(backupRepository.findById(backup.getId())).thenReturn(Optional.of(backup));

        RestoreResult result = backupService.restoreBackup(backup.getId(), "admin");

        assertThat(result.success()).isFalse();
        verify(restoreWriter, never()).restoreColumn(any(), any(), anyList());
    }

    @Test
    @DisplayName("Snapshotting a column stores whatever the reader returns")
    void snapshotColumn() {
        when(snapshotReader.readColumn("t", "c")).thenReturn(twoRows());

        FieldDataBackup backup = backupService.snapshotColumn("field-1", "form-1", "t", "c",
                BackupTypes.AUTO_DELETE, "user-1");

        assertThat(backup.getDataSnapshot()).hasSize(2);
        assertThat(backup.getBackupType()).isEqualTo(BackupTypes.AUTO_DELETE);
        assertThat(backup.getRetentionUntil()).isEqualTo(NOW.plusDays(90));
    }

    @Test
    @DisplayName("Statistics group backups and their records by type")
    void statistics() {
        FieldDataBackup manual = backupWith(twoRows(), null);
        FieldDataBackup auto = backupWith(List.of(twoRows().get(0)), null);
        auto.setBackupType(BackupTypes.AUTO_DELETE);
        when(backupRepository.findByFormIdOrderByCreatedAtDesc("form-1")).thenReturn(List.of(manual, auto));

        BackupStatisticsDto statistics = backupService.statistics("form-1");

        assertThat(statistics.totalBackups()).isEqualTo(2);
        assertThat(statistics.totalRecords()).isEqualTo(3);
        assertThat(statistics.byType().get(BackupTypes.MANUAL).records()).isEqualTo(2);
        assertThat(statistics.byType().get(BackupTypes.AUTO_DELETE).count()).isEqualTo(1);
    }

    @Test
    @DisplayName("The expiring-soon report defaults to a 7-day window from now")
    void expiringSoonDefaultWindow() {
        backupService.findExpiringSoon();

        verify(backupRepository).findExpiringBetween(NOW, NOW.plusDays(7));
    }
}
