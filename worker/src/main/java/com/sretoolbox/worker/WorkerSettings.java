package com.sretoolbox.worker;

import com.sretoolbox.support.EnvConfig;
import com.sretoolbox.support.RuntimeSettings;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.util.UUID;

@Value
@Builder
public class WorkerSettings {
    static final Duration SHUTDOWN_GRACE = Duration.ofSeconds(30);

    String workerId;
    int httpPort;
    int concurrency;
    Duration probeTimeout;
    Duration notifyTimeout;
    RuntimeSettings runtime;

    public static WorkerSettings from(EnvConfig env) {
        return WorkerSettings.builder()
                .workerId(env.get("WORKER_ID", "worker-" + UUID.randomUUID()))
                .httpPort(env.getInt("WORKER_HTTP_PORT", 8080))
                .concurrency(Math.max(1, env.getInt("WORKER_CONCURRENCY", 4)))
                .probeTimeout(env.getMillis("PROBE_TIMEOUT_MS", 10_000))
                .notifyTimeout(env.getMillis("NOTIFY_TIMEOUT_MS", 5_000))
                .runtime(RuntimeSettings.from(env))
                .build();
    }
}
