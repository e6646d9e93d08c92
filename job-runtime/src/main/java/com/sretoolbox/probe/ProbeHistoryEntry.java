package com.sretoolbox.probe;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

@Value
@Builder
@Jacksonized
public class ProbeHistoryEntry {
    @JsonProperty("template_id")
    String templateId;
    @JsonProperty("job_id")
    String jobId;
    @JsonProperty("recorded_at")
    Instant recordedAt;
    ProbeExecutionSummary summary;

    @JsonIgnore
    public boolean isMetSla() {
        return summary != null && summary.isMetSla();
    }
}
