package com.qcollector.backend.entity;

/**
 * Known values for {@link FieldDataBackup#getBackupType()}. The column is free-form so
 * callers may store other tags, these are the ones the engine writes itself.
 */
public final class BackupTypes {

    public static final String MANUAL = "MANUAL";
    public static final String AUTO_DELETE = "AUTO_DELETE";
    public static final String AUTO_TYPE_CHANGE = "AUTO_TYPE_CHANGE";

    private BackupTypes() {
    }
}
