package com.sretoolbox.worker.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.sretoolbox.jobs.JobDescriptor;
import com.sretoolbox.jobs.JobRecord;
import com.sretoolbox.jobs.JobStatus;
import com.sretoolbox.jobs.errors.ClaimConflictException;
import com.sretoolbox.jobs.errors.JobCancelledException;
import com.sretoolbox.jobs.errors.ProgressStoreException;
import com.sretoolbox.jobs.errors.StaleWriteException;
import com.sretoolbox.store.JobTransitions;
import com.sretoolbox.store.ProgressStore;
import com.sretoolbox.support.Backoff;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Runs one delivered job to a terminal state, writing every change through the progress store.
 * <p>
 * Safe to call again with a descriptor that was already handled: terminal jobs are left alone and a job
 * claimed by another worker is reported as a claim conflict. Anything the operation throws, errors included,
 * becomes a {@code failed} record and never escapes. When the store stays unreachable after retries the job is
 * abandoned as it is; the reaper finalizes it after the dead-worker window.
 */
@Slf4j
public class ExecutionEngine {
    private final ProgressStore store;
    private final OperationRegistry operations;
    private final Backoff storeBackoff;
    private final String workerId;
    private final Clock clock;
    private final EngineMetrics metrics;

    public ExecutionEngine(ProgressStore store, OperationRegistry operations, Backoff storeBackoff, String workerId,
            Clock clock, EngineMetrics metrics) {
        this.store = store;
        this.operations = operations;
        this.storeBackoff = storeBackoff;
        this.workerId = workerId;
        this.clock = clock;
        this.metrics = metrics == null ? EngineMetrics.noop() : metrics;
    }

    public void execute(JobDescriptor descriptor) {
        Execution execution = new Execution(descriptor);
        try {
            execution.run();
        } catch (ClaimConflictException e) {
            log.debug("{}", e.getMessage());
        } catch (StaleWriteException e) {
            log.info("{}", e.getMessage());
            execution.finished("stale");
        } catch (ProgressStoreException e) {
            log.error("Abandoning job {} after {} store attempts", descriptor.getJobId(),
                    storeBackoff.getMaxAttempts(), e);
            execution.finished("abandoned");
        }
    }

    private <T> T withStore(String what, Supplier<T> action) {
        return storeBackoff.call(what, ProgressStoreException.class, action);
    }

    private static String describe(Throwable e) {
        String message = e.getMessage();
        return message == null || message.isBlank() ? e.getClass().getSimpleName() : message;
    }

    private final class Execution implements ProgressReporter, CancelSignal {
        private final JobDescriptor job;
        private final String jobId;
        private JobRecord current;
        private long startNanos;
        private boolean started = false;

        Execution(JobDescriptor job) {
            this.job = job;
            this.jobId = job.getJobId();
        }

        void run() {
            Optional<JobRecord> found = withStore("read job " + jobId, () -> store.get(jobId));
            if (found.isEmpty()) {
                log.warn("Job {} not found in progress store, dropping delivery", jobId);
                return;
            }
            current = found.get();
            if (current.isTerminal()) {
                log.info("Job {} already {}, ignoring redelivery", jobId, current.getStatus().wireName());
                return;
            }
            if (current.getStatus() != JobStatus.QUEUED) {
                throw new ClaimConflictException(jobId, current.getStatus());
            }
            if (current.isCancelRequested()) {
                cancelBeforeStart();
                return;
            }
            claim();

            Optional<ToolkitOperation> operation = operations.find(job.getOperation());
            if (operation.isEmpty()) {
                fail("No handler registered for operation " + job.getOperation());
                return;
            }
            JsonNode result;
            try {
                result = operation.get().execute(job, this, this);
            } catch (JobCancelledException e) {
                cancel();
                return;
            } catch (StaleWriteException | ProgressStoreException e) {
                throw e;
            } catch (InterruptedException e) {
                fail("Interrupted: worker shutting down");
                Thread.currentThread().interrupt();
                return;
            } catch (Exception | Error e) {
                log.warn("Job {} operation {} failed", jobId, job.getOperation(), e);
                fail(describe(e));
                return;
            }
            succeed(result);
        }

        private void claim() {
            JobRecord claimed = current.toBuilder()
                    .status(JobStatus.RUNNING)
                    .progress(0)
                    .workerId(workerId)
                    .updatedAt(clock.instant())
                    .build();
            Optional<JobRecord> applied = withStore("claim job " + jobId, () -> store.compareAndSet(current, claimed));
            if (applied.isEmpty()) {
                throw new ClaimConflictException(jobId, JobStatus.QUEUED);
            }
            current = applied.get();
            started = true;
            startNanos = System.nanoTime();
            metrics.jobStarted();
            log("Job execution started");
            log.info("Job {} ({}) claimed by {}", jobId, job.getOperation(), workerId);
        }

        private void cancelBeforeStart() {
            JobRecord cancelled = current.toBuilder().status(JobStatus.CANCELLED).updatedAt(clock.instant()).build();
            Optional<JobRecord> applied = withStore("cancel job " + jobId,
                    () -> store.compareAndSet(current, cancelled));
            if (applied.isEmpty()) {
                throw new ClaimConflictException(jobId, JobStatus.QUEUED);
            }
            current = applied.get();
            log("Job cancelled before execution");
            log.info("Job {} cancelled before execution", jobId);
        }

        private void cancel() {
            write(current.toBuilder().status(JobStatus.CANCELLED).result(null).error(null).build());
            log("Cancellation acknowledged during execution");
            log.info("Job {} cancelled at {}%", jobId, current.getProgress());
            finished(JobStatus.CANCELLED.wireName());
        }

        private void fail(String error) {
            write(current.toBuilder().status(JobStatus.FAILED).result(null).error(error).build());
            log("Error: " + error);
            log.info("Job {} failed: {}", jobId, error);
            finished(JobStatus.FAILED.wireName());
        }

        private void succeed(JsonNode result) {
            write(current.toBuilder().status(JobStatus.SUCCEEDED).progress(100).result(result).error(null).build());
            log("Job completed");
            log.info("Job {} succeeded", jobId);
            finished(JobStatus.SUCCEEDED.wireName());
        }

        private void write(JobRecord next) {
            JobRecord expected = current;
            JobRecord updated = next.toBuilder().updatedAt(clock.instant()).build();
            current = withStore("update job " + jobId, () -> store.compareAndSet(expected, updated))
                    .orElseThrow(() -> new StaleWriteException(jobId, JobTransitions.label(expected, updated)));
        }

        void finished(String outcome) {
            if (started) {
                started = false;
                metrics.jobFinished(outcome, (System.nanoTime() - startNanos) / 1_000_000_000.0);
            }
        }

        @Override
        public synchronized void report(int percent, String message) throws JobCancelledException {
            int next = Math.max(current.getProgress(), Math.min(100, Math.max(0, percent)));
            write(current.toBuilder().progress(next).build());
            if (message != null) {
                log(message);
            }
            checkpoint();
        }

        @Override
        public void log(String message) {
            withStore("append log " + jobId, () -> {
                store.appendLog(jobId, message);
                return null;
            });
        }

        @Override
        public boolean isCancelled() {
            return withStore("read cancel flag " + jobId, () -> store.isCancelRequested(jobId));
        }

        @Override
        public String jobId() {
            return jobId;
        }
    }
}
