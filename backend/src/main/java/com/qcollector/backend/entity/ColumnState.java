package com.qcollector.backend.entity;

/**
 * Column definition before or after a migration. Which parts are filled depends on the
 * migration type: a rename only knows names, a type change knows the types.
 */
public record ColumnState(String columnName, String dataType, Boolean nullable, String defaultValue) {

    public static ColumnState named(String columnName) {
        return new ColumnState(columnName, null, null, null);
    }

    public static ColumnState typed(String columnName, String dataType) {
        return new ColumnState(columnName, dataType, null, null);
    }

    public boolean hasDataType() {
        return dataType != null && !dataType.isBlank();
    }
}
