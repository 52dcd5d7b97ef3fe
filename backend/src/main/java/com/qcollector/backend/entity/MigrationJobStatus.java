package com.qcollector.backend.entity;

public enum MigrationJobStatus {
    WAITING,
    ACTIVE,
    COMPLETED,
    FAILED
}
