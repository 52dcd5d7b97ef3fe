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
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.Immutable;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * One attempted schema change against a form table. Rows are written once and never updated.
 */
@Entity
@Immutable
@Table(name = "field_migrations", indexes = {
        @Index(name = "idx_field_migrations_form", columnList = "form_id"),
        @Index(name = "idx_field_migrations_field", columnList = "field_id"),
        @Index(name = "idx_field_migrations_table", columnList = "table_name"),
        @Index(name = "idx_field_migrations_executed_at", columnList = "executed_at")
})
@Getter
@Builder
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class FieldMigration {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "field_id", length = 64)
    private String fieldId;

    @Column(name = "form_id", nullable = false, length = 64)
    private String formId;

    @Enumerated(EnumType.STRING)
    @Column(name = "migration_type", nullable = false, length = 32)
    private MigrationType migrationType;

    @Column(name = "table_name", nullable = false)
    private String tableName;

    @Column(name = "column_name")
    private String columnName;

    @Convert(converter = ColumnStateConverter.class)
    @Column(name = "old_value", columnDefinition = "TEXT")
    private ColumnState oldValue;

    @Convert(converter = ColumnStateConverter.class)
    @Column(name = "new_value", columnDefinition = "TEXT")
    private ColumnState newValue;

    @Column(name = "backup_id")
    private UUID backupId;

    @Column(name = "executed_by", length = 64)
    private String executedBy;

    @Column(name = "executed_at", nullable = false)
    private LocalDateTime executedAt;

    @Column(nullable = false)
    private boolean success;

    @Column(name = "error_message", columnDefinition = "TEXT")
    private String errorMessage;

    @Column(name = "rollback_sql", columnDefinition = "TEXT")
    private String rollbackStatement;

    @PrePersist
    public void onPersist() {
        if (executedAt == null) {
            executedAt = LocalDateTime.now();
        }
    }
}
