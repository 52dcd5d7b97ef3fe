package com.qcollector.backend.service.queue;

import com.qcollector.backend.config.MigrationProperties;
import com.qcollector.backend.dto.PendingJobDto;
import com.qcollector.backend.dto.QueueCleanResult;
import com.qcollector.backend.dto.QueueMetricsDto;
import com.qcollector.backend.dto.QueueStatusDto;
import com.qcollector.backend.entity.MigrationChange;
import com.qcollector.backend.entity.MigrationJob;
import com.qcollector.backend.util.SqlIdentifiers;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.ConstraintViolationException;
import jakarta.validation.Validator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.OptimisticLockingFailureException;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Single-lane queue for schema changes. Exactly one job runs at a time across the whole
 * process, in priority order and then in enqueue order.
 *
 * <p>Built once by {@code MigrationQueueConfig}; the container calls {@link #start()} and
 * {@link #close()}. With auto-start off no worker thread exists and callers drive
 * {@link #processNext()} themselves.
 *
 * <p>Each claim is leased to this instance's worker id. While a job runs, a heartbeat thread keeps
 * extending the lease; only rows whose lease ran out are handed back to WAITING, so several
 * instances can share one store.
 */
@Slf4j
public class MigrationQueue implements AutoCloseable {

    private final MigrationJobStore jobStore;
    private final MigrationJobProcessor processor;
    private final Validator validator;
    private final MigrationProperties.Queue settings;
    private final Clock clock;

    private final String workerId = UUID.randomUUID().toString();
    private final ReentrantLock processingLock = new ReentrantLock();
    private volatile boolean paused;
    private volatile boolean closed;
    private volatile Long runningJobId;
    private ScheduledExecutorService worker;
    private ScheduledExecutorService heartbeat;

    public MigrationQueue(MigrationJobStore jobStore, MigrationJobProcessor processor, Validator validator,
                          MigrationProperties properties, Clock clock) {
        this.jobStore = jobStore;
        this.processor = processor;
        this.validator = validator;
        this.settings = properties.getQueue();
        this.clock = clock;
    }

    public synchronized void start() {
        if (closed) {
            throw new IllegalStateException("Migration queue is closed");
        }
        recoverExpiredLeases();
        if (heartbeat == null) {
            heartbeat = daemonScheduler("migration-queue-heartbeat");
            long beatMillis = Math.max(100, settings.getLeaseDuration().toMillis() / 3);
            heartbeat.scheduleAtFixedRate(this::renewLease, beatMillis, beatMillis, TimeUnit.MILLISECONDS);
        }
        if (!settings.isAutoStart() || worker != null) {
            log.info("[MIGRATION_QUEUE] initialized as {} (worker {})", workerId, worker == null ? "disabled" : "running");
            return;
        }
        worker = daemonScheduler("migration-queue");
        long pollMillis = settings.getPollInterval().toMillis();
        worker.scheduleWithFixedDelay(this::drain, pollMillis, pollMillis, TimeUnit.MILLISECONDS);
        log.info("[MIGRATION_QUEUE] worker started (poll every {} ms)", pollMillis);
    }

    /**
     * Validates and stores a change. Nothing runs synchronously; an invalid change is rejected
     * here and never reaches the store.
     */
    public Long enqueue(MigrationChange change, String requestedBy) {
        if (closed) {
            throw new IllegalStateException("Migration queue is closed");
        }
        validate(change);
        MigrationJob job = jobStore.enqueue(change, requestedBy, settings.getMaxAttempts(), now());
        log.info("[MIGRATION_QUEUE] job {} queued: {} on {}.{} (priority {})", job.getId(), job.getType(),
                change.tableName(), change.targetColumn(), job.getPriority());
        return job.getId();
    }

    /**
     * Claims and runs the next runnable job.
     *
     * @return false when paused, closed, or nothing was runnable
     */
    public boolean processNext() {
        if (paused || closed) {
            return false;
        }
        processingLock.lock();
        try {
            Optional<MigrationJob> claimed;
            try {
                LocalDateTime now = now();
                claimed = jobStore.claimNext(now, workerId, now.plus(settings.getLeaseDuration()));
            } catch (OptimisticLockingFailureException ex) {
                log.debug("[MIGRATION_QUEUE] lost claim race: {}", ex.getMessage());
                return false;
            }
            if (claimed.isEmpty()) {
                return false;
            }
            runningJobId = claimed.get().getId();
            try {
                processor.process(claimed.get());
            } finally {
                runningJobId = null;
            }
            return true;
        } finally {
            processingLock.unlock();
        }
    }

    /**
     * Runs jobs until none is runnable. Used by the worker thread, so it never throws.
     */
    public int drain() {
        int processed = 0;
        try {
            recoverExpiredLeases();
            while (processNext()) {
                processed++;
            }
        } catch (RuntimeException ex) {
            log.error("[MIGRATION_QUEUE] worker pass aborted after {} job(s)", processed, ex);
        }
        return processed;
    }

    public void pause() {
        paused = true;
        log.info("[MIGRATION_QUEUE] paused");
    }

    public void resume() {
        paused = false;
        log.info("[MIGRATION_QUEUE] resumed");
    }

    public boolean isPaused() {
        return paused;
    }

    public String getWorkerId() {
        return workerId;
    }

    /**
     * Returns ACTIVE jobs whose lease expired to WAITING.
     *
     * @return how many jobs were requeued
     */
    public int recoverExpiredLeases() {
        int recovered = jobStore.recoverStalled(now());
        if (recovered > 0) {
            log.warn("[MIGRATION_QUEUE] requeued {} stalled job(s)", recovered);
        }
        return recovered;
    }

    public QueueCleanResult clean(LocalDateTime now) {
        QueueCleanResult result = jobStore.clean(now, settings.getCompletedRetention(), settings.getFailedRetention());
        log.info("[MIGRATION_QUEUE] cleaned {} completed and {} failed job(s)",
                result.completedRemoved(), result.failedRemoved());
        return result;
    }

    public QueueStatusDto getStatus(String formId) {
        return jobStore.statusForForm(formId);
    }

    public List<PendingJobDto> getPendingJobs(String formId) {
        return jobStore.pendingJobs(formId).stream()
                .map(PendingJobDto::fromEntity)
                .toList();
    }

    public Optional<MigrationJob> getJob(Long jobId) {
        return jobStore.find(jobId);
    }

    public void retryJob(Long jobId) {
        jobStore.retry(jobId, now());
        log.info("[MIGRATION_QUEUE] job {} re-admitted for retry", jobId);
    }

    public QueueMetricsDto getMetrics() {
        return jobStore.metrics(now(), paused);
    }

    /**
     * Stops the worker. Safe to call more than once; teardown problems are logged, not thrown.
     */
    @Override
    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        shutdown(worker, "worker");
        shutdown(heartbeat, "heartbeat");
        log.info("[MIGRATION_QUEUE] closed");
    }

    private void renewLease() {
        Long jobId = runningJobId;
        if (jobId == null) {
            return;
        }
        try {
            if (!jobStore.extendLease(jobId, workerId, now().plus(settings.getLeaseDuration()))) {
                log.warn("[MIGRATION_QUEUE] job {} is no longer leased to {}", jobId, workerId);
            }
        } catch (RuntimeException ex) {
            log.warn("[MIGRATION_QUEUE] could not extend lease of job {}: {}", jobId, ex.getMessage());
        }
    }

    private static ScheduledExecutorService daemonScheduler(String threadName) {
        return Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, threadName);
            t.setDaemon(true);
            return t;
        });
    }

    private static void shutdown(ScheduledExecutorService executor, String name) {
        if (executor == null) {
            return;
        }
        try {
            executor.shutdown();
            if (!executor.awaitTermination(30, TimeUnit.SECONDS)) {
                log.warn("[MIGRATION_QUEUE] {} did not stop in time, interrupting", name);
                executor.shutdownNow();
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        } catch (RuntimeException ex) {
            log.warn("[MIGRATION_QUEUE] error while closing {}: {}", name, ex.getMessage());
        }
    }

    private void validate(MigrationChange change) {
        if (change == null) {
            throw new IllegalArgumentException("change is required");
        }
        Set<ConstraintViolation<MigrationChange>> violations = validator.validate(change);
        if (!violations.isEmpty()) {
            throw new ConstraintViolationException(violations);
        }
        for (String identifier : change.identifiers()) {
            SqlIdentifiers.requireValid(identifier);
        }
        for (String dataType : change.dataTypes()) {
            if (!SqlIdentifiers.isValidType(dataType)) {
                throw new IllegalArgumentException("Invalid column type: " + dataType);
            }
        }
        if (change instanceof MigrationChange.RenameField rename
                && rename.oldColumnName().equals(rename.newColumnName())) {
            throw new IllegalArgumentException("Rename needs two different column names");
        }
    }

    private LocalDateTime now() {
        return LocalDateTime.now(clock);
    }
}
