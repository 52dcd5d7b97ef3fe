package com.qcollector.backend.service.queue;

import com.qcollector.backend.dto.QueueCleanResult;
import com.qcollector.backend.dto.QueueMetricsDto;
import com.qcollector.backend.dto.QueueStatusDto;
import com.qcollector.backend.entity.ColumnState;
import com.qcollector.backend.entity.MigrationChange;
import com.qcollector.backend.entity.MigrationJob;
import com.qcollector.backend.entity.MigrationJobStatus;
import com.qcollector.backend.repository.MigrationJobRepository;
import jakarta.persistence.EntityNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Durable job rows behind {@link MigrationQueue}. Every state change is a short transaction of
 * its own so a crash between steps leaves the row in a state the queue can pick up again.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class MigrationJobStore {

    private static final EnumSet<MigrationJobStatus> PENDING =
            EnumSet.of(MigrationJobStatus.WAITING, MigrationJobStatus.ACTIVE);

    private final MigrationJobRepository jobRepository;

    @Transactional
    public MigrationJob enqueue(MigrationChange change, String requestedBy, int maxAttempts, LocalDateTime now) {
        return jobRepository.save(new MigrationJob(change, requestedBy, maxAttempts, now));
    }

    /**
     * Moves the next runnable job to ACTIVE under a lease held by {@code workerId} and counts the
     * attempt. Jobs that only need their outcome written are not charged an attempt. A concurrent
     * claim on the same row surfaces as an optimistic locking failure when the transaction commits.
     */
    @Transactional
    public Optional<MigrationJob> claimNext(LocalDateTime now, String workerId, LocalDateTime leaseUntil) {
        Optional<MigrationJob> next = jobRepository
                .findFirstByStatusAndAvailableAtLessThanEqualOrderByPriorityAscIdAsc(MigrationJobStatus.WAITING, now);
        next.ifPresent(job -> {
            job.setStatus(MigrationJobStatus.ACTIVE);
            if (!job.isFinishing()) {
                job.setAttemptsMade(job.getAttemptsMade() + 1);
            }
            job.setStartedAt(now);
            job.setProgress(10);
            job.setWorkerId(workerId);
            job.setLeaseUntil(leaseUntil);
            jobRepository.saveAndFlush(job);
        });
        return next;
    }

    /**
     * Extends the lease of a job this worker still owns.
     *
     * @return false when the job is no longer ACTIVE under {@code workerId}
     */
    @Transactional
    public boolean extendLease(Long jobId, String workerId, LocalDateTime leaseUntil) {
        Optional<MigrationJob> job = jobRepository.findById(jobId);
        if (job.isEmpty() || job.get().getStatus() != MigrationJobStatus.ACTIVE
                || !workerId.equals(job.get().getWorkerId())) {
            return false;
        }
        job.get().setLeaseUntil(leaseUntil);
        return true;
    }

    @Transactional
    public void rememberBackup(Long jobId, UUID backupId) {
        MigrationJob job = load(jobId);
        job.setBackupId(backupId);
        job.setProgress(40);
    }

    /**
     * Remembers what the executor reported. From here on the job is never sent to the executor
     * again.
     */
    @Transactional
    public void recordApplied(Long jobId, ColumnState oldState, ColumnState newState, UUID backupId) {
        MigrationJob job = load(jobId);
        applied(job, oldState, newState, backupId);
        job.setProgress(90);
    }

    /**
     * Puts an applied job back to WAITING so a later claim writes its ledger entry and completes it.
     */
    @Transactional
    public void scheduleCompletion(Long jobId, ColumnState oldState, ColumnState newState, UUID backupId,
                                   String error, LocalDateTime availableAt) {
        MigrationJob job = load(jobId);
        applied(job, oldState, newState, backupId);
        waitAgain(job, error, availableAt);
    }

    /**
     * Parks a job whose terminal failure could not be written. The next claim records the failure
     * without calling the executor.
     */
    @Transactional
    public void deferFailure(Long jobId, String error, LocalDateTime availableAt) {
        MigrationJob job = load(jobId);
        job.setTerminalError(error);
        waitAgain(job, error, availableAt);
    }

    @Transactional
    public void markCompleted(Long jobId, UUID migrationId, UUID backupId, LocalDateTime now) {
        MigrationJob job = load(jobId);
        job.setStatus(MigrationJobStatus.COMPLETED);
        job.setMigrationId(migrationId);
        job.setBackupId(backupId);
        job.setProgress(100);
        job.setLastError(null);
        job.setFinishedAt(now);
        job.releaseLease();
    }

    @Transactional
    public void scheduleRetry(Long jobId, String error, LocalDateTime availableAt) {
        waitAgain(load(jobId), error, availableAt);
    }

    @Transactional
    public void markFailed(Long jobId, String error, UUID migrationId, LocalDateTime now) {
        MigrationJob job = load(jobId);
        job.setStatus(MigrationJobStatus.FAILED);
        job.setLastError(error);
        job.setMigrationId(migrationId);
        job.setTerminalError(null);
        job.setFinishedAt(now);
        job.releaseLease();
    }

    /**
     * ACTIVE rows whose lease ran out belong to a worker that died or lost contact mid-attempt.
     * They go back to WAITING and the interrupted attempt is not counted. Rows still under a live
     * lease are left to their worker.
     */
    @Transactional
    public int recoverStalled(LocalDateTime now) {
        List<MigrationJob> stalled = jobRepository.findExpiredLeases(MigrationJobStatus.ACTIVE, now);
        for (MigrationJob job : stalled) {
            log.warn("[MIGRATION_QUEUE] job {} stalled during attempt {} (worker {}, lease until {}), requeueing",
                    job.getId(), job.getAttemptsMade(), job.getWorkerId(), job.getLeaseUntil());
            if (!job.isFinishing()) {
                job.setAttemptsMade(Math.max(0, job.getAttemptsMade() - 1));
            }
            job.setStatus(MigrationJobStatus.WAITING);
            job.setAvailableAt(now);
            job.setProgress(0);
            job.releaseLease();
        }
        return stalled.size();
    }

    /**
     * Gives a terminally failed job a fresh attempt budget.
     */
    @Transactional
    public MigrationJob retry(Long jobId, LocalDateTime now) {
        MigrationJob job = load(jobId);
        if (job.getStatus() != MigrationJobStatus.FAILED) {
            throw new IllegalStateException("Only failed jobs can be retried, job " + jobId + " is " + job.getStatus());
        }
        job.setStatus(MigrationJobStatus.WAITING);
        job.setAttemptsMade(0);
        job.setAvailableAt(now);
        job.setProgress(0);
        job.setLastError(null);
        job.setMigrationId(null);
        job.setTerminalError(null);
        job.setSchemaApplied(false);
        job.setAppliedOldState(null);
        job.setAppliedNewState(null);
        job.setStartedAt(null);
        job.setFinishedAt(null);
        return job;
    }

    @Transactional
    public QueueCleanResult clean(LocalDateTime now, Duration completedRetention, Duration failedRetention) {
        int completed = jobRepository.deleteFinishedBefore(MigrationJobStatus.COMPLETED, now.minus(completedRetention));
        int failed = jobRepository.deleteFinishedBefore(MigrationJobStatus.FAILED, now.minus(failedRetention));
        return new QueueCleanResult(completed, failed);
    }

    @Transactional(readOnly = true)
    public Optional<MigrationJob> find(Long jobId) {
        return jobRepository.findById(jobId);
    }

    @Transactional(readOnly = true)
    public QueueStatusDto statusForForm(String formId) {
        long waiting = 0;
        long active = 0;
        long completed = 0;
        long failed = 0;
        for (MigrationJobRepository.StatusCount row : jobRepository.countByStatusForForm(formId)) {
            switch (row.getStatus()) {
                case WAITING -> waiting = row.getTotal();
                case ACTIVE -> active = row.getTotal();
                case COMPLETED -> completed = row.getTotal();
                case FAILED -> failed = row.getTotal();
            }
        }
        return new QueueStatusDto(waiting, active, completed, failed);
    }

    @Transactional(readOnly = true)
    public List<MigrationJob> pendingJobs(String formId) {
        return jobRepository.findByFormIdAndStatusInOrderByPriorityAscIdAsc(formId, PENDING);
    }

    @Transactional(readOnly = true)
    public QueueMetricsDto metrics(LocalDateTime now, boolean paused) {
        return new QueueMetricsDto(
                jobRepository.countByStatus(MigrationJobStatus.WAITING),
                jobRepository.countByStatusAndAvailableAtAfter(MigrationJobStatus.WAITING, now),
                jobRepository.countByStatus(MigrationJobStatus.ACTIVE),
                jobRepository.countByStatus(MigrationJobStatus.COMPLETED),
                jobRepository.countByStatus(MigrationJobStatus.FAILED),
                paused);
    }

    private static void applied(MigrationJob job, ColumnState oldState, ColumnState newState, UUID backupId) {
        job.setSchemaApplied(true);
        job.setAppliedOldState(oldState);
        job.setAppliedNewState(newState);
        if (backupId != null) {
            job.setBackupId(backupId);
        }
    }

    private static void waitAgain(MigrationJob job, String error, LocalDateTime availableAt) {
        job.setStatus(MigrationJobStatus.WAITING);
        job.setLastError(error);
        job.setAvailableAt(availableAt);
        job.setProgress(0);
        job.releaseLease();
    }

    private MigrationJob load(Long jobId) {
        return jobRepository.findById(jobId)
                .orElseThrow(() -> new EntityNotFoundException("Migration job not found: " + jobId));
    }
}
