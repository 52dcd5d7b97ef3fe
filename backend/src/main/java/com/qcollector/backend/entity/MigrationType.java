package com.qcollector.backend.entity;

public enum MigrationType {
    ADD_COLUMN,
    DROP_COLUMN,
    MODIFY_COLUMN,
    RENAME_COLUMN
}
