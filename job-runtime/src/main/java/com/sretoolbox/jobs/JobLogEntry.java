package com.sretoolbox.jobs;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

@Value
@Builder
@Jacksonized
public class JobLogEntry {
    Instant ts;
    String message;

    public static JobLogEntry of(Instant ts, String message) {
        return new JobLogEntry(ts, message);
    }
}
