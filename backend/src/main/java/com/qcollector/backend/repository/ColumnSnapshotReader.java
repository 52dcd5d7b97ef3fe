package com.qcollector.backend.repository;

import com.qcollector.backend.entity.SnapshotEntry;

import java.util.List;

public interface ColumnSnapshotReader {

    /**
     * Reads every row's id and the value of one column, ordered by id.
     */
    List<SnapshotEntry> readColumn(String tableName, String columnName);
}
