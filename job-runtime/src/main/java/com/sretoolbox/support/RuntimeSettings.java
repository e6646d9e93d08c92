package com.sretoolbox.support;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Settings shared by every process that touches the progress store and task queue.
 */
@Value
@Builder
public class RuntimeSettings {
    public static final int DEFAULT_BUCKETS = 16;

    String contactPoint;
    int port;
    String keyspace;
    String localDc;
    int replicationFactor;
    int queueBuckets;
    int maxLogLines;
    Duration retention;
    Duration deadWorkerTimeout;
    Duration queueLease;
    Duration queueStaleTimeout;
    Duration queuePollInterval;
    int storeRetryAttempts;
    Duration storeRetryBase;
    Duration storeRetryMax;

    public static RuntimeSettings from(EnvConfig env) {
        return RuntimeSettings.builder()
                .contactPoint(env.get("CASSANDRA_CONTACT_POINT", "127.0.0.1"))
                .port(env.getInt("CASSANDRA_PORT", 9042))
                .keyspace(env.get("CASSANDRA_KEYSPACE", "sretoolbox"))
                .localDc(env.get("CASS_LOCAL_DC", "DC1"))
                .replicationFactor(env.getInt("CASSANDRA_REPLICATION_FACTOR", 3))
                .queueBuckets(env.getInt("QUEUE_BUCKETS", DEFAULT_BUCKETS))
                .maxLogLines(env.getInt("JOB_MAX_LOG_LINES", 200))
                .retention(env.getSeconds("JOB_RETENTION_SECONDS", 7 * 24 * 3600))
                .deadWorkerTimeout(env.getSeconds("JOB_DEAD_WORKER_SECONDS", 300))
                .queueLease(env.getSeconds("QUEUE_LEASE_SECONDS", 60))
                .queueStaleTimeout(env.getSeconds("QUEUE_STALE_SECONDS", 900))
                .queuePollInterval(env.getMillis("WORKER_POLL_INTERVAL_MS", 1000))
                .storeRetryAttempts(env.getInt("STORE_RETRY_ATTEMPTS", 5))
                .storeRetryBase(env.getMillis("STORE_RETRY_BASE_MS", 100))
                .storeRetryMax(env.getMillis("STORE_RETRY_MAX_MS", 5000))
                .build();
    }

    public Backoff storeBackoff() {
        return new Backoff(storeRetryAttempts, storeRetryBase, storeRetryMax);
    }
}
