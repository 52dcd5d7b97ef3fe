package com.qcollector.backend.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Tunables for the field migration engine, bound from the {@code migration.*} section.
 * Every default lives here so a test constructing {@code new MigrationProperties()} sees the
 * same values as a production context without overrides.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "migration")
public class MigrationProperties {

    private final Backup backup = new Backup();
    private final Queue queue = new Queue();
    private final Sweeper sweeper = new Sweeper();

    @Getter
    @Setter
    public static class Backup {
        /** Applied when a backup is created without an explicit retention date. */
        private int retentionDays = 90;
        /** Rows per UPDATE batch when restoring a snapshot. */
        private int restoreBatchSize = 100;
        /** Window used by the expiring-soon report. */
        private int expiringSoonDays = 7;
    }

    @Getter
    @Setter
    public static class Queue {
        private int maxAttempts = 3;
        private Duration initialBackoff = Duration.ofSeconds(2);
        private Duration pollInterval = Duration.ofSeconds(1);
        /** How long a claimed job belongs to its worker without a heartbeat. */
        private Duration leaseDuration = Duration.ofMinutes(10);
        /** When false the worker thread is not started; callers drive {@code processNext()} themselves. */
        private boolean autoStart = true;
        private Duration completedRetention = Duration.ofDays(7);
        private Duration failedRetention = Duration.ofDays(30);
    }

    @Getter
    @Setter
    public static class Sweeper {
        private boolean enabled = true;
        private String backupCron = "0 0 2 * * *";
        private String jobCron = "0 0 3 * * *";
    }
}
