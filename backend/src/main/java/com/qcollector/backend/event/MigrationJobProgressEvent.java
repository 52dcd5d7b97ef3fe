package com.qcollector.backend.event;

public record MigrationJobProgressEvent(Long jobId, String formId, int progress) {
}
