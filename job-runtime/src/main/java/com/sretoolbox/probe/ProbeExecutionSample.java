package com.sretoolbox.probe;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.Locale;

@Value
@Builder
@Jacksonized
public class ProbeExecutionSample {
    int attempt;
    Instant timestamp;
    @JsonProperty("latency_ms")
    double latencyMs;
    boolean breach;
    String message;

    public static ProbeExecutionSample measured(int attempt, Instant timestamp, double latencyMs, int slaMs) {
        boolean breach = latencyMs > slaMs;
        String message = breach
                ? String.format(Locale.ROOT, "%.2f ms (breach by %.2f ms)", latencyMs, latencyMs - slaMs)
                : String.format(Locale.ROOT, "%.2f ms (within SLA)", latencyMs);
        return new ProbeExecutionSample(attempt, timestamp, latencyMs, breach, message);
    }

    /** A request that never produced a response counts against the SLA. */
    public static ProbeExecutionSample failed(int attempt, Instant timestamp, double elapsedMs, String cause) {
        return new ProbeExecutionSample(attempt, timestamp, elapsedMs, true, "request failed: " + cause);
    }
}
