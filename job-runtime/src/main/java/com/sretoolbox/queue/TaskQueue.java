package com.sretoolbox.queue;

import com.sretoolbox.jobs.JobDescriptor;

import java.util.Optional;

/**
 * Ordered, at-least-once delivery of job descriptors from submitters to workers.
 * <p>
 * A dequeued descriptor is leased to the caller; it becomes visible again if the lease lapses before
 * {@link #ack}. Consumers must therefore tolerate seeing the same descriptor more than once.
 */
public interface TaskQueue extends AutoCloseable {

    /**
     * @return the job id of the descriptor
     * @throws com.sretoolbox.jobs.errors.QueueUnavailableException if the broker cannot be reached
     */
    String enqueue(JobDescriptor descriptor);

    /**
     * Blocks until a descriptor is available. Returns empty only once the queue is closed.
     */
    Optional<Delivery> dequeue() throws InterruptedException;

    /** Removes a delivered descriptor for good. Acking an expired lease is a no-op. */
    void ack(Delivery delivery);

    /** True while a descriptor for {@code jobId} is waiting or leased. */
    boolean isPending(String jobId);

    /** Wakes blocked consumers and makes further {@link #dequeue} calls return empty. */
    @Override
    void close();
}
