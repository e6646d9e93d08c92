package com.sretoolbox.queue;

import com.sretoolbox.jobs.JobDescriptor;
import com.sretoolbox.jobs.errors.QueueUnavailableException;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.LinkedBlockingDeque;
import java.util.concurrent.TimeUnit;

/**
 * FIFO queue for a single process. Leased descriptors whose lease has lapsed go back to the head.
 */
@Slf4j
public class InMemoryTaskQueue implements TaskQueue {
    private final LinkedBlockingDeque<Pending> ready = new LinkedBlockingDeque<>();
    private final Map<String, Delivery> inFlight = new ConcurrentHashMap<>();
    private final Duration lease;
    private final Duration pollInterval;
    private final Clock clock;
    private volatile boolean closed = false;

    public InMemoryTaskQueue() {
        this(Duration.ofSeconds(60), Duration.ofMillis(50), Clock.systemUTC());
    }

    public InMemoryTaskQueue(Duration lease, Duration pollInterval, Clock clock) {
        this.lease = lease;
        this.pollInterval = pollInterval;
        this.clock = clock;
    }

    private static final class Pending {
        final JobDescriptor descriptor;
        final Instant enqueuedAt;

        Pending(JobDescriptor descriptor, Instant enqueuedAt) {
            this.descriptor = descriptor;
            this.enqueuedAt = enqueuedAt;
        }
    }

    @Override
    public String enqueue(JobDescriptor descriptor) {
        if (closed) {
            throw new QueueUnavailableException("task queue is closed", null);
        }
        ready.addLast(new Pending(descriptor, clock.instant()));
        return descriptor.getJobId();
    }

    @Override
    public Optional<Delivery> dequeue() throws InterruptedException {
        while (!closed) {
            requeueExpired();
            Pending next = ready.pollFirst(pollInterval.toMillis(), TimeUnit.MILLISECONDS);
            if (next == null) {
                continue;
            }
            Delivery delivery = new Delivery(next.descriptor, 0, next.enqueuedAt, clock.instant().plus(lease));
            inFlight.put(next.descriptor.getJobId(), delivery);
            return Optional.of(delivery);
        }
        return Optional.empty();
    }

    @Override
    public void ack(Delivery delivery) {
        inFlight.remove(delivery.getJobId(), delivery);
    }

    @Override
    public boolean isPending(String jobId) {
        if (inFlight.containsKey(jobId)) {
            return true;
        }
        return ready.stream().anyMatch(p -> p.descriptor.getJobId().equals(jobId));
    }

    public int pendingCount() {
        return ready.size();
    }

    public int inFlightCount() {
        return inFlight.size();
    }

    void requeueExpired() {
        Instant now = clock.instant();
        for (Map.Entry<String, Delivery> e : inFlight.entrySet()) {
            Delivery d = e.getValue();
            if (!d.getLeaseExpiresAt().isAfter(now) && inFlight.remove(e.getKey(), d)) {
                log.debug("Lease expired for job {}, redelivering", e.getKey());
                ready.addFirst(new Pending(d.getDescriptor(), d.getEnqueuedAt()));
            }
        }
    }

    @Override
    public void close() {
        closed = true;
    }
}
