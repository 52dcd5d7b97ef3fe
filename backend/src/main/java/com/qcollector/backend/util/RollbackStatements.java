package com.qcollector.backend.util;

import com.qcollector.backend.entity.ColumnState;
import com.qcollector.backend.entity.MigrationType;

/**
 * Reversal SQL for a schema change that has just succeeded. Returns {@code null} when the
 * prior state is not known well enough to rebuild it.
 */
public final class RollbackStatements {

    private RollbackStatements() {
    }

    public static String forAddColumn(String tableName, String columnName) {
        return "ALTER TABLE " + tableName + " DROP COLUMN " + columnName + ";";
    }

    public static String forDropColumn(String tableName, String columnName, ColumnState before) {
        if (before == null || !before.hasDataType()) {
            return null;
        }
        StringBuilder sql = new StringBuilder("ALTER TABLE ")
                .append(tableName)
                .append(" ADD COLUMN ")
                .append(columnName)
                .append(' ')
                .append(before.dataType());
        if (Boolean.FALSE.equals(before.nullable()) && before.defaultValue() != null) {
            sql.append(" NOT NULL");
        }
        if (before.defaultValue() != null) {
            sql.append(" DEFAULT ").append(before.defaultValue());
        }
        return sql.append(';').toString();
    }

    public static String forRenameColumn(String tableName, String oldColumnName, String newColumnName) {
        return "ALTER TABLE " + tableName + " RENAME COLUMN " + newColumnName + " TO " + oldColumnName + ";";
    }

    public static String forTypeChange(String tableName, String columnName, String oldType) {
        if (oldType == null || oldType.isBlank()) {
            return null;
        }
        return "ALTER TABLE " + tableName + " ALTER COLUMN " + columnName
                + " TYPE " + oldType + " USING " + columnName + "::" + oldType + ";";
    }

    /**
     * Derives the reversal from the recorded before/after states.
     */
    public static String derive(MigrationType type, String tableName, String columnName,
                                ColumnState before, ColumnState after) {
        return switch (type) {
            case ADD_COLUMN -> forAddColumn(tableName, columnName);
            case DROP_COLUMN -> forDropColumn(tableName, columnName, before);
            case RENAME_COLUMN -> before == null || before.columnName() == null
                    ? null
                    : forRenameColumn(tableName, before.columnName(),
                            after != null && after.columnName() != null ? after.columnName() : columnName);
            case MODIFY_COLUMN -> forTypeChange(tableName, columnName, before == null ? null : before.dataType());
        };
    }
}
