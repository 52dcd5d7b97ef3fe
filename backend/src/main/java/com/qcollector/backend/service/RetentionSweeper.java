package com.qcollector.backend.service;

import com.qcollector.backend.dto.QueueCleanResult;
import com.qcollector.backend.service.queue.MigrationQueue;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * Nightly purge of expired backups and of finished queue jobs. Both passes are single
 * conditional deletes, so running them twice in a row is harmless.
 */
@Component
@RequiredArgsConstructor
@Slf4j
@ConditionalOnProperty(prefix = "migration.sweeper", name = "enabled", havingValue = "true", matchIfMissing = true)
public class RetentionSweeper {

    private final BackupService backupService;
    private final MigrationQueue migrationQueue;
    private final Clock clock;

    @Scheduled(cron = "${migration.sweeper.backup-cron:0 0 2 * * *}")
    public int sweepBackups() {
        LocalDateTime now = LocalDateTime.now(clock);
        try {
            int deleted = backupService.cleanupExpired(now);
            log.info("[BACKUP] retention sweep removed {} backup(s)", deleted);
            return deleted;
        } catch (RuntimeException ex) {
            log.error("[BACKUP] retention sweep failed", ex);
            return 0;
        }
    }

    @Scheduled(cron = "${migration.sweeper.job-cron:0 0 3 * * *}")
    public QueueCleanResult sweepJobs() {
        LocalDateTime now = LocalDateTime.now(clock);
        try {
            return migrationQueue.clean(now);
        } catch (RuntimeException ex) {
            log.error("[MIGRATION_QUEUE] job retention sweep failed", ex);
            return new QueueCleanResult(0, 0);
        }
    }
}
