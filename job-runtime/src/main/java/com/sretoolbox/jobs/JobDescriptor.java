package com.sretoolbox.jobs;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

/**
 * What travels through the task queue. The payload is opaque to the queue.
 */
@Value
@Builder
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class JobDescriptor {
    @JsonProperty("job_id")
    String jobId;
    String operation;
    String toolkit;
    String type;
    JsonNode payload;
    @JsonProperty("enqueued_at")
    Instant enqueuedAt;
}
