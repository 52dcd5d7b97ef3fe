package com.qcollector.backend.entity;

/**
 * Kinds of queued schema change. Lower priority values run first.
 */
public enum MigrationJobType {
    DELETE_FIELD(1, MigrationType.DROP_COLUMN),
    CHANGE_TYPE(2, MigrationType.MODIFY_COLUMN),
    RENAME_FIELD(3, MigrationType.RENAME_COLUMN),
    ADD_FIELD(4, MigrationType.ADD_COLUMN);

    private final int priority;
    private final MigrationType migrationType;

    MigrationJobType(int priority, MigrationType migrationType) {
        this.priority = priority;
        this.migrationType = migrationType;
    }

    public int getPriority() {
        return priority;
    }

    public MigrationType getMigrationType() {
        return migrationType;
    }
}
