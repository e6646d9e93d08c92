package com.sretoolbox.jobs;

import com.sretoolbox.jobs.errors.QueueUnavailableException;
import com.sretoolbox.queue.TaskQueue;
import com.sretoolbox.store.ProgressStore;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Finalizes jobs whose worker stopped reporting, recovers queued jobs whose descriptor is gone and purges
 * terminal jobs past retention.
 * <p>
 * The failure write is a compare-and-set on the version the reaper read, so a worker that reports progress
 * in the meantime wins and the job stays running. A queued job can only be claimed or cancelled, so a stale
 * one is handed back to the queue, or cancelled when a cancellation is pending.
 */
@Slf4j
public class JobReaper {
    static final String REQUEUED_LOG = "Requeued: no pending queue entry found";

    private final ProgressStore store;
    private final TaskQueue queue;
    private final Duration deadWorkerTimeout;
    private final Duration queueStaleTimeout;
    private final Duration retention;
    private final Clock clock;

    public JobReaper(ProgressStore store, TaskQueue queue, Duration deadWorkerTimeout, Duration queueStaleTimeout,
            Duration retention, Clock clock) {
        this.store = store;
        this.queue = queue;
        this.deadWorkerTimeout = deadWorkerTimeout;
        this.queueStaleTimeout = queueStaleTimeout;
        this.retention = retention;
        this.clock = clock;
    }

    @Value
    public static class Result {
        int repaired;
        int abandoned;
        int requeued;
        int purged;
    }

    public Result reap() {
        Instant now = clock.instant();
        int repaired = store.reconcileIndex();
        return new Result(repaired, failAbandoned(now), recoverStaleQueued(now), purgeExpired(now));
    }

    int failAbandoned(Instant now) {
        Instant cutoff = now.minus(deadWorkerTimeout);
        int reaped = 0;
        for (JobRecord job : store.findByStatus(JobStatus.RUNNING)) {
            if (job.getUpdatedAt() == null || !job.getUpdatedAt().isBefore(cutoff)) {
                continue;
            }
            String error = "Worker " + (job.getWorkerId() == null ? "unknown" : job.getWorkerId())
                    + " presumed dead: no progress for " + deadWorkerTimeout.toSeconds() + "s";
            JobRecord failed = job.toBuilder()
                    .status(JobStatus.FAILED)
                    .result(null)
                    .error(error)
                    .updatedAt(now)
                    .build();
            if (store.compareAndSet(job, failed).isPresent()) {
                store.appendLog(job.getId(), "Error: " + error);
                log.warn("Reaped job {}: {}", job.getId(), error);
                reaped++;
            } else {
                log.debug("Job {} changed while reaping, skipped", job.getId());
            }
        }
        return reaped;
    }

    int recoverStaleQueued(Instant now) {
        Instant cutoff = now.minus(queueStaleTimeout);
        int recovered = 0;
        for (JobRecord job : store.findByStatus(JobStatus.QUEUED)) {
            if (job.getUpdatedAt() == null || !job.getUpdatedAt().isBefore(cutoff)) {
                continue;
            }
            if (job.isCancelRequested()) {
                JobRecord cancelled = job.toBuilder().status(JobStatus.CANCELLED).updatedAt(now).build();
                if (store.compareAndSet(job, cancelled).isPresent()) {
                    store.appendLog(job.getId(), "Job cancelled before execution");
                    log.info("Cancelled stale queued job {}", job.getId());
                    recovered++;
                }
                continue;
            }
            try {
                if (queue.isPending(job.getId())) {
                    continue;
                }
                queue.enqueue(JobDescriptor.builder()
                        .jobId(job.getId())
                        .operation(job.getOperation())
                        .toolkit(job.getToolkit())
                        .type(job.getType())
                        .payload(job.getPayload())
                        .enqueuedAt(now)
                        .build());
            } catch (QueueUnavailableException e) {
                log.warn("Queue unavailable while recovering queued jobs, retrying next pass: {}", e.getMessage());
                break;
            }
            store.appendLog(job.getId(), REQUEUED_LOG);
            log.warn("Job {} queued since {} without a queue entry, requeued", job.getId(), job.getUpdatedAt());
            recovered++;
        }
        return recovered;
    }

    int purgeExpired(Instant now) {
        Instant cutoff = now.minus(retention);
        int purged = 0;
        for (JobStatus status : JobStatus.values()) {
            if (!status.isTerminal()) {
                continue;
            }
            for (JobRecord job : store.findByStatus(status)) {
                if (job.getUpdatedAt() != null && job.getUpdatedAt().isBefore(cutoff) && store.delete(job.getId())) {
                    purged++;
                }
            }
        }
        if (purged > 0) {
            log.info("Purged {} jobs older than {}s", purged, retention.toSeconds());
        }
        return purged;
    }
}
