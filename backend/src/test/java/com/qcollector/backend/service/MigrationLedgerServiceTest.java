package com.qcollector.backend.service;

import com.qcollector.backend.entity.ColumnState;
import com.qcollector.backend.entity.FieldMigration;
import com.qcollector.backend.entity.MigrationType;
import com.qcollector.backend.repository.FieldMigrationRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class MigrationLedgerServiceTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2026, 3, 1, 12, 0);

    private FieldMigrationRepository repository;
    private MigrationLedgerService ledgerService;

    @BeforeEach
    void setUp() {
        repository = mock(FieldMigrationRepository.class);
        when(repository.save(any(FieldMigration.class))).thenAnswer(invocation -> invocation.getArgument(0));
        Clock clock = Clock.fixed(NOW.toInstant(ZoneOffset.UTC), ZoneOffset.UTC);
        ledgerService = new MigrationLedgerService(repository, clock);
    }

    private static FieldMigration.FieldMigrationBuilder addColumn(String fieldId) {
        return FieldMigration.builder()
                .formId("form-1")
                .fieldId(fieldId)
                .migrationType(MigrationType.ADD_COLUMN)
                .tableName("t")
                .columnName("c")
                .executedBy("user-1");
    }

    @Test
    @DisplayName("A successful ADD_COLUMN without a field can be rolled back")
    void addColumnWithoutFieldIsRollbackable() {
        FieldMigration migration = ledgerService.recordSuccess(addColumn(null), "ALTER TABLE t DROP COLUMN c;");

        assertThat(migration.isSuccess()).isTrue();
        assertThat(migration.getExecutedAt()).isEqualTo(NOW);
        assertThat(ledgerService.canRollback(migration)).isTrue();
        assertThat(ledgerService.rollbackStatement(migration)).isEqualTo("ALTER TABLE t DROP COLUMN c;");
    }

    @Test
    @DisplayName("An ADD_COLUMN that still belongs to a field is never rollbackable")
    void addColumnWithFieldIsNotRollbackable() {
        FieldMigration migration = ledgerService.recordSuccess(addColumn("field-9"), "ALTER TABLE t DROP COLUMN c;");

        assertThat(ledgerService.canRollback(migration)).isFalse();
        assertThat(ledgerService.rollbackStatement(migration)).isNull();
    }

    @Test
    @DisplayName("A failure is recorded with its error and no rollback statement")
    void failureCarriesNoRollback() {
        FieldMigration migration = ledgerService.recordFailure(addColumn(null), "column \"c\" already exists");

        assertThat(migration.isSuccess()).isFalse();
        assertThat(migration.getErrorMessage()).isEqualTo("column \"c\" already exists");
        assertThat(migration.getRollbackStatement()).isNull();
        assertThat(ledgerService.canRollback(migration)).isFalse();
        assertThat(ledgerService.rollbackStatement(migration)).isNull();
    }

    @Test
    @DisplayName("Entries that break the outcome rules are refused before saving")
    void rejectsInconsistentEntries() {
        FieldMigration failedWithRollback = addColumn(null)
                .success(false)
                .errorMessage("boom")
                .rollbackStatement("ALTER TABLE t DROP COLUMN c;")
                .build();
        FieldMigration failedWithoutError = addColumn(null).success(false).build();
        FieldMigration successWithError = addColumn(null).success(true).errorMessage("boom").build();

        assertThatThrownBy(() -> ledgerService.record(failedWithRollback)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ledgerService.record(failedWithoutError)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ledgerService.record(successWithError)).isInstanceOf(IllegalArgumentException.class);
        verify(repository, never()).save(any(FieldMigration.class));
    }

    @Test
    @DisplayName("Descriptions read as a sentence per migration type")
    void describesMigrations() {
        FieldMigration added = addColumn(null).success(true).build();
        FieldMigration dropped = addColumn(null).migrationType(MigrationType.DROP_COLUMN).success(true).build();
        FieldMigration renamed = addColumn(null)
                .migrationType(MigrationType.RENAME_COLUMN)
                .columnName("full_name")
                .oldValue(ColumnState.named("name"))
                .success(true)
                .build();
        FieldMigration failedModify = addColumn(null)
                .migrationType(MigrationType.MODIFY_COLUMN)
                .success(false)
                .errorMessage("cannot cast")
                .build();

        assertThat(ledgerService.describe(added)).isEqualTo("Added column c to table t");
        assertThat(ledgerService.describe(dropped)).isEqualTo("Removed column c from table t");
        assertThat(ledgerService.describe(renamed)).isEqualTo("Renamed column name to full_name in table t");
        assertThat(ledgerService.describe(failedModify)).isEqualTo("Modified column c in table t (FAILED)");
    }

    @Test
    @DisplayName("Only migrations from the last 24 hours count as recent")
    void recentWindow() {
        FieldMigration fresh = addColumn(null).success(true).executedAt(NOW.minusHours(23)).build();
        FieldMigration stale = addColumn(null).success(true).executedAt(NOW.minusHours(25)).build();

        assertThat(ledgerService.isRecent(fresh, NOW)).isTrue();
        assertThat(ledgerService.isRecent(stale, NOW)).isFalse();
        assertThat(ledgerService.summarize(fresh, NOW).isRecent()).isTrue();
    }
}
