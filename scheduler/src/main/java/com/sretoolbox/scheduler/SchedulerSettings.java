package com.sretoolbox.scheduler;

import com.sretoolbox.support.EnvConfig;
import com.sretoolbox.support.RuntimeSettings;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;

@Value
@Builder
public class SchedulerSettings {
    int httpPort;
    Duration tick;
    Duration reaperInterval;
    int defaultIntervalSeconds;
    RuntimeSettings runtime;

    public static SchedulerSettings from(EnvConfig env) {
        return SchedulerSettings.builder()
                .httpPort(env.getInt("SCHEDULER_HTTP_PORT", 8082))
                .tick(env.getSeconds("SCHEDULER_TICK_SECONDS", 15))
                .reaperInterval(env.getSeconds("REAPER_INTERVAL_SECONDS", 30))
                .defaultIntervalSeconds(env.getInt("PROBE_DEFAULT_INTERVAL_SECONDS", 300))
                .runtime(RuntimeSettings.from(env))
                .build();
    }
}
