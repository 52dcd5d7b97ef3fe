package com.qcollector.backend.entity;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import jakarta.validation.constraints.NotBlank;

import java.util.List;

/**
 * Payload of a queued migration job. The JSON form carries a {@code type} discriminator
 * matching {@link MigrationJobType}.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = MigrationChange.AddField.class, name = "ADD_FIELD"),
        @JsonSubTypes.Type(value = MigrationChange.DeleteField.class, name = "DELETE_FIELD"),
        @JsonSubTypes.Type(value = MigrationChange.RenameField.class, name = "RENAME_FIELD"),
        @JsonSubTypes.Type(value = MigrationChange.ChangeType.class, name = "CHANGE_TYPE")
})
public sealed interface MigrationChange {

    String formId();

    String fieldId();

    String tableName();

    @JsonIgnore
    MigrationJobType jobType();

    /** Column the change is about, as it is named before the change runs. */
    @JsonIgnore
    String targetColumn();

    /** Every table and column name the change will put into DDL. */
    @JsonIgnore
    List<String> identifiers();

    /** Every column type the change will put into DDL. */
    @JsonIgnore
    default List<String> dataTypes() {
        return List.of();
    }

    record AddField(@NotBlank String formId,
                    String fieldId,
                    @NotBlank String tableName,
                    @NotBlank String columnName,
                    @NotBlank String dataType) implements MigrationChange {

        @Override
        public MigrationJobType jobType() {
            return MigrationJobType.ADD_FIELD;
        }

        @Override
        public String targetColumn() {
            return columnName;
        }

        @Override
        public List<String> identifiers() {
            return List.of(tableName, columnName);
        }

        @Override
        public List<String> dataTypes() {
            return List.of(dataType);
        }
    }

    record DeleteField(@NotBlank String formId,
                       String fieldId,
                       @NotBlank String tableName,
                       @NotBlank String columnName,
                       boolean backup) implements MigrationChange {

        @Override
        public MigrationJobType jobType() {
            return MigrationJobType.DELETE_FIELD;
        }

        @Override
        public String targetColumn() {
            return columnName;
        }

        @Override
        public List<String> identifiers() {
            return List.of(tableName, columnName);
        }
    }

    record RenameField(@NotBlank String formId,
                       String fieldId,
                       @NotBlank String tableName,
                       @NotBlank String oldColumnName,
                       @NotBlank String newColumnName) implements MigrationChange {

        @Override
        public MigrationJobType jobType() {
            return MigrationJobType.RENAME_FIELD;
        }

        @Override
        public String targetColumn() {
            return oldColumnName;
        }

        @Override
        public List<String> identifiers() {
            return List.of(tableName, oldColumnName, newColumnName);
        }
    }

    record ChangeType(@NotBlank String formId,
                      String fieldId,
                      @NotBlank String tableName,
                      @NotBlank String columnName,
                      @NotBlank String oldType,
                      @NotBlank String newType) implements MigrationChange {

        @Override
        public MigrationJobType jobType() {
            return MigrationJobType.CHANGE_TYPE;
        }

        @Override
        public String targetColumn() {
            return columnName;
        }

        @Override
        public List<String> identifiers() {
            return List.of(tableName, columnName);
        }

        @Override
        public List<String> dataTypes() {
            return List.of(oldType, newType);
        }
    }
}
