package com.sretoolbox.scheduler.api;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.sretoolbox.probe.NotificationRule;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Body of template create and update calls. Server-owned fields ({@code id}, {@code next_run_at},
 * timestamps) are ignored if sent.
 */
@Value
@Builder
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class ProbeTemplateRequest {
    String name;
    String description;
    String url;
    String method;
    @JsonProperty("sla_ms")
    Integer slaMs;
    @JsonProperty("interval_seconds")
    Integer intervalSeconds;
    @JsonProperty("notification_rules")
    List<NotificationRule> notificationRules;
    List<String> tags;
}
