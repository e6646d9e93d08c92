package com.sretoolbox.jobs;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.sretoolbox.jobs.errors.NotFoundException;
import com.sretoolbox.jobs.errors.ProgressStoreException;
import com.sretoolbox.jobs.errors.QueueUnavailableException;
import com.sretoolbox.queue.TaskQueue;
import com.sretoolbox.store.JobFilter;
import com.sretoolbox.store.JobPage;
import com.sretoolbox.store.ProgressStore;
import com.sretoolbox.support.Backoff;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Submission and polling boundary: submit, read, cancel and list jobs.
 * <p>
 * Cancellation only raises a flag; the owning worker observes it at its next progress checkpoint.
 */
@Slf4j
public class JobService {
    private final ProgressStore store;
    private final TaskQueue queue;
    private final Backoff enqueueBackoff;
    private final Clock clock;
    private final Supplier<String> ids;

    public JobService(ProgressStore store, TaskQueue queue, Backoff enqueueBackoff, Clock clock) {
        this(store, queue, enqueueBackoff, clock, () -> UUID.randomUUID().toString());
    }

    public JobService(ProgressStore store, TaskQueue queue, Backoff enqueueBackoff, Clock clock,
            Supplier<String> ids) {
        this.store = store;
        this.queue = queue;
        this.enqueueBackoff = enqueueBackoff;
        this.clock = clock;
        this.ids = ids;
    }

    /**
     * Creates a queued record and hands the descriptor to the task queue.
     *
     * @throws IllegalArgumentException if {@code operation} is missing
     * @throws QueueUnavailableException if the queue stays unreachable after retries; no record is left behind
     */
    public String submit(JobSubmission submission) {
        String operation = trimToNull(submission.getOperation());
        if (operation == null) {
            throw new IllegalArgumentException("operation is required");
        }
        String requestedToolkit = trimToNull(submission.getToolkit());
        String toolkit = requestedToolkit == null ? operation : requestedToolkit;
        String type = trimToNull(submission.getType());
        if (type == null) {
            type = requestedToolkit == null ? operation : requestedToolkit + "." + operation;
        }
        JsonNode payload = submission.getPayload() == null || submission.getPayload().isNull()
                ? JsonNodeFactory.instance.objectNode()
                : submission.getPayload();

        Instant now = clock.instant();
        JobDescriptor descriptor = JobDescriptor.builder()
                .jobId(ids.get())
                .operation(operation)
                .toolkit(toolkit)
                .type(type)
                .payload(payload)
                .enqueuedAt(now)
                .build();
        store.create(JobRecord.queued(descriptor, now));
        try {
            enqueueBackoff.call("enqueue job " + descriptor.getJobId(), QueueUnavailableException.class,
                    () -> queue.enqueue(descriptor));
        } catch (QueueUnavailableException e) {
            log.error("Job {} could not be enqueued, discarding record", descriptor.getJobId(), e);
            try {
                store.delete(descriptor.getJobId());
            } catch (ProgressStoreException deleteFailure) {
                // the record stays queued; the reaper requeues it once the queue is back
                log.warn("Job {} record could not be discarded: {}", descriptor.getJobId(),
                        deleteFailure.getMessage());
                e.addSuppressed(deleteFailure);
            }
            throw e;
        }
        log.info("Job {} submitted (operation={}, toolkit={}, type={})", descriptor.getJobId(), operation, toolkit,
                type);
        return descriptor.getJobId();
    }

    public JobRecord getStatus(String jobId) {
        return store.get(jobId).orElseThrow(() -> new NotFoundException("job", jobId));
    }

    /**
     * Idempotent. No-op once the job is terminal.
     *
     * @throws NotFoundException for unknown or expired ids
     */
    public void requestCancel(String jobId) {
        JobRecord current = getStatus(jobId);
        if (current.isTerminal()) {
            log.debug("Cancel for job {} ignored, already {}", jobId, current.getStatus().wireName());
            return;
        }
        if (current.isCancelRequested()) {
            return;
        }
        if (!store.requestCancel(jobId)) {
            throw new NotFoundException("job", jobId);
        }
        store.appendLog(jobId, "Cancellation requested");
        log.info("Cancellation requested for job {}", jobId);
    }

    public JobPage listJobs(JobFilter filter) {
        return store.list(filter);
    }

    private static String trimToNull(String s) {
        if (s == null) {
            return null;
        }
        String t = s.trim();
        return t.isEmpty() ? null : t;
    }
}
