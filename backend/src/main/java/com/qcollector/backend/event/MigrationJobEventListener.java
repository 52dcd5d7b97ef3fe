package com.qcollector.backend.event;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

@Component
@Slf4j
public class MigrationJobEventListener {

    @EventListener
    public void onCompleted(MigrationJobCompletedEvent event) {
        log.info("[MIGRATION_QUEUE] job {} {} on {}.{} completed after {} attempt(s) (migration={}, backup={})",
                event.jobId(), event.type(), event.tableName(), event.columnName(), event.attempts(),
                event.migrationId(), event.backupId());
    }

    @EventListener
    public void onFailed(MigrationJobFailedEvent event) {
        log.error("[MIGRATION_QUEUE] job {} {} on {}.{} for form {} failed after {} attempt(s): {}",
                event.jobId(), event.type(), event.tableName(), event.columnName(), event.formId(),
                event.attempts(), event.errorMessage());
    }

    @EventListener
    public void onProgress(MigrationJobProgressEvent event) {
        log.debug("[MIGRATION_QUEUE] job {} progress {}%", event.jobId(), event.progress());
    }
}
