package com.qcollector.backend.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

@Entity
@Table(name = "field_data_backups", indexes = {
        @Index(name = "idx_field_data_backups_form", columnList = "form_id"),
        @Index(name = "idx_field_data_backups_table_column", columnList = "table_name, column_name"),
        @Index(name = "idx_field_data_backups_retention", columnList = "retention_until")
})
@Getter
@Setter
@NoArgsConstructor
public class FieldDataBackup {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "field_id", length = 64)
    private String fieldId;

    @Column(name = "form_id", nullable = false, length = 64)
    private String formId;

    @Column(name = "table_name", nullable = false)
    private String tableName;

    @Column(name = "column_name", nullable = false)
    private String columnName;

    @Convert(converter = SnapshotConverter.class)
    @Column(name = "data_snapshot", nullable = false, columnDefinition = "TEXT")
    private List<SnapshotEntry> dataSnapshot;

    @Column(name = "backup_type", nullable = false, length = 50)
    private String backupType;

    @Column(name = "retention_until")
    private LocalDateTime retentionUntil;

    @Column(name = "created_by", length = 64)
    private String createdBy;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @PrePersist
    public void onPersist() {
        if (createdAt == null) {
            createdAt = LocalDateTime.now();
        }
    }
}
