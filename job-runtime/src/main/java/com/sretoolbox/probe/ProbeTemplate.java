package com.sretoolbox.probe;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;

/**
 * Recurring synthetic check. {@code nextRunAt} belongs to the scheduler; every other field belongs to whoever
 * administers the template.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class ProbeTemplate {
    String id;
    String name;
    String description;
    String url;
    @Builder.Default
    String method = "GET";
    @JsonProperty("sla_ms")
    int slaMs;
    @JsonProperty("interval_seconds")
    int intervalSeconds;
    @Builder.Default
    @JsonProperty("notification_rules")
    List<NotificationRule> notificationRules = List.of();
    @Builder.Default
    List<String> tags = List.of();
    @JsonProperty("next_run_at")
    Instant nextRunAt;
    @JsonProperty("created_at")
    Instant createdAt;
    @JsonProperty("updated_at")
    Instant updatedAt;

    @JsonIgnore
    public boolean isDue(Instant now) {
        return nextRunAt == null || !nextRunAt.isAfter(now);
    }
}
