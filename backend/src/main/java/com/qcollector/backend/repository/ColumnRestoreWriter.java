package com.qcollector.backend.repository;

import com.qcollector.backend.entity.SnapshotEntry;

import java.util.List;

public interface ColumnRestoreWriter {

    /**
     * Writes the snapshot values back into the column. Implementations apply all rows or none.
     *
     * @return number of rows updated
     */
    int restoreColumn(String tableName, String columnName, List<SnapshotEntry> entries);
}
