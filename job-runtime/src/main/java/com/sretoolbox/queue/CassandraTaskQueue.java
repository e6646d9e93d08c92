package com.sretoolbox.queue;

import com.datastax.oss.driver.api.core.CqlSession;
import com.datastax.oss.driver.api.core.DefaultConsistencyLevel;
import com.datastax.oss.driver.api.core.DriverException;
import com.datastax.oss.driver.api.core.cql.PreparedStatement;
import com.datastax.oss.driver.api.core.cql.ResultSet;
import com.datastax.oss.driver.api.core.cql.Row;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sretoolbox.jobs.JobDescriptor;
import com.sretoolbox.jobs.errors.QueueUnavailableException;
import com.sretoolbox.support.Json;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Task queue sharded over {@code job_queue} partitions (one per bucket), ordered by enqueue time within a
 * bucket. Consumers scan buckets round-robin, paging through a bucket past rows under a live lease, and lease a
 * row with a lightweight transaction on {@code lease_expires_at}, so two workers never hold the same lease.
 * Acks are conditioned on the same lease, so a consumer whose lease lapsed cannot remove a redelivery.
 */
@Slf4j
public class CassandraTaskQueue implements TaskQueue {
    private static final int SCAN_PAGE_SIZE = 32;

    private final CqlSession session;
    private final ObjectMapper mapper;
    private final int buckets;
    private final Duration lease;
    private final Duration pollInterval;
    private final String consumerId;
    private final Clock clock;
    private final Object wakeup = new Object();
    private volatile boolean closed = false;
    private int bucketCursor = 0;

    private final PreparedStatement enqueueStmt;
    private final PreparedStatement selectBucketStmt;
    private final PreparedStatement leaseStmt;
    private final PreparedStatement ackStmt;
    private final PreparedStatement selectBucketIdsStmt;

    public CassandraTaskQueue(CqlSession session, ObjectMapper mapper, int buckets, Duration lease,
            Duration pollInterval, String consumerId, Clock clock) {
        this.session = session;
        this.mapper = mapper;
        this.buckets = Math.max(1, buckets);
        this.lease = lease;
        this.pollInterval = pollInterval;
        this.consumerId = consumerId;
        this.clock = clock;

        this.enqueueStmt = session.prepare(
                "INSERT INTO job_queue (bucket_id, enqueued_at, job_id, descriptor, lease_expires_at) "
                        + "VALUES (?, ?, ?, ?, ?)");
        this.selectBucketStmt = session.prepare(
                "SELECT bucket_id, enqueued_at, job_id, descriptor, lease_expires_at FROM job_queue "
                        + "WHERE bucket_id = ?");
        this.leaseStmt = session.prepare(
                "UPDATE job_queue SET lease_expires_at = ?, leased_by = ? "
                        + "WHERE bucket_id = ? AND enqueued_at = ? AND job_id = ? IF lease_expires_at = ?");
        this.ackStmt = session.prepare(
                "DELETE FROM job_queue WHERE bucket_id = ? AND enqueued_at = ? AND job_id = ? "
                        + "IF lease_expires_at = ?");
        this.selectBucketIdsStmt = session.prepare(
                "SELECT job_id FROM job_queue WHERE bucket_id = ?");
    }

    @Override
    public String enqueue(JobDescriptor descriptor) {
        int bucket = bucketOf(descriptor.getJobId());
        Instant when = descriptor.getEnqueuedAt() == null ? clock.instant() : descriptor.getEnqueuedAt();
        try {
            session.execute(enqueueStmt.bind(bucket, when, descriptor.getJobId(), Json.write(mapper, descriptor),
                    Instant.EPOCH).setConsistencyLevel(DefaultConsistencyLevel.LOCAL_QUORUM));
        } catch (DriverException e) {
            throw new QueueUnavailableException("task queue unavailable: " + e.getMessage(), e);
        }
        return descriptor.getJobId();
    }

    @Override
    public Optional<Delivery> dequeue() throws InterruptedException {
        while (!closed) {
            for (int i = 0; i < buckets && !closed; i++) {
                int bucketId = nextBucket();
                try {
                    Optional<Delivery> leased = tryLease(bucketId);
                    if (leased.isPresent()) {
                        return leased;
                    }
                } catch (DriverException e) {
                    log.warn("Queue poll error on bucket {}: {}", bucketId, e.getMessage());
                    break;
                }
            }
            synchronized (wakeup) {
                if (!closed) {
                    wakeup.wait(pollInterval.toMillis());
                }
            }
        }
        return Optional.empty();
    }

    private int bucketOf(String jobId) {
        return Math.floorMod(jobId.hashCode(), buckets);
    }

    private synchronized int nextBucket() {
        int b = bucketCursor;
        bucketCursor = (bucketCursor + 1) % buckets;
        return b;
    }

    private Optional<Delivery> tryLease(int bucketId) {
        Instant now = clock.instant();
        // iterating the result set fetches further pages on demand
        ResultSet rs = session.execute(selectBucketStmt.bind(bucketId)
                .setPageSize(SCAN_PAGE_SIZE)
                .setConsistencyLevel(DefaultConsistencyLevel.LOCAL_QUORUM));
        for (Row row : rs) {
            Instant currentLease = row.getInstant("lease_expires_at");
            if (currentLease != null && currentLease.isAfter(now)) {
                continue;
            }
            Instant enqueuedAt = row.getInstant("enqueued_at");
            String jobId = row.getString("job_id");
            Instant newLease = now.plus(lease);
            Row applied = session.execute(leaseStmt.bind(newLease, consumerId, bucketId, enqueuedAt, jobId,
                    currentLease)).one();
            if (applied == null || !applied.getBoolean("[applied]")) {
                continue;
            }
            JobDescriptor descriptor = Json.read(mapper, row.getString("descriptor"), JobDescriptor.class);
            if (currentLease != null && currentLease.isAfter(Instant.EPOCH)) {
                log.info("Redelivering job {} after lapsed lease", jobId);
            }
            return Optional.of(new Delivery(descriptor, bucketId, enqueuedAt, newLease));
        }
        return Optional.empty();
    }

    @Override
    public void ack(Delivery delivery) {
        try {
            Row row = session.execute(ackStmt.bind(delivery.getBucketId(), delivery.getEnqueuedAt(),
                    delivery.getJobId(), delivery.getLeaseExpiresAt())).one();
            if (row != null && !row.getBoolean("[applied]")) {
                log.info("Lease on job {} lapsed before ack, leaving the redelivery in place", delivery.getJobId());
            }
        } catch (DriverException e) {
            // the lease lapses and the descriptor is redelivered; consumption is idempotent
            log.warn("Failed to ack job {}: {}", delivery.getJobId(), e.getMessage());
        }
    }

    @Override
    public boolean isPending(String jobId) {
        try {
            ResultSet rs = session.execute(selectBucketIdsStmt.bind(bucketOf(jobId))
                    .setPageSize(SCAN_PAGE_SIZE * 8)
                    .setConsistencyLevel(DefaultConsistencyLevel.LOCAL_QUORUM));
            for (Row row : rs) {
                if (jobId.equals(row.getString("job_id"))) {
                    return true;
                }
            }
            return false;
        } catch (DriverException e) {
            throw new QueueUnavailableException("task queue unavailable: " + e.getMessage(), e);
        }
    }

    @Override
    public void close() {
        closed = true;
        synchronized (wakeup) {
            wakeup.notifyAll();
        }
    }
}
