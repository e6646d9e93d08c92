package com.sretoolbox.jobs;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;

/**
 * Snapshot of one job as held by the progress store.
 * <p>
 * {@code version} increments on every compare-and-set write and is the token a writer must present to
 * mutate the record. The cancellation flag and log lines live beside the versioned fields: setting the
 * flag or appending a line never invalidates the owning worker's version.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class JobRecord {
    String id;
    JobStatus status;
    int progress;
    String operation;
    String toolkit;
    String type;
    JsonNode payload;
    JsonNode result;
    String error;
    @Builder.Default
    List<JobLogEntry> logs = List.of();
    @JsonProperty("cancel_requested")
    boolean cancelRequested;
    @JsonProperty("worker_id")
    String workerId;
    @JsonIgnore
    long version;
    @JsonProperty("created_at")
    Instant createdAt;
    @JsonProperty("updated_at")
    Instant updatedAt;

    @JsonIgnore
    public boolean isTerminal() {
        return status != null && status.isTerminal();
    }

    public static JobRecord queued(JobDescriptor descriptor, Instant now) {
        return JobRecord.builder()
                .id(descriptor.getJobId())
                .status(JobStatus.QUEUED)
                .progress(0)
                .operation(descriptor.getOperation())
                .toolkit(descriptor.getToolkit())
                .type(descriptor.getType())
                .payload(descriptor.getPayload())
                .createdAt(now)
                .updatedAt(now)
                .build();
    }
}
