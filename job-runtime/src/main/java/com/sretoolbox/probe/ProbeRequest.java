package com.sretoolbox.probe;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Payload of a {@code probe} job. Jobs spawned from a template carry a copy of its configuration taken at
 * enqueue time, so later template edits never reach a job already in the queue.
 */
@Value
@Builder
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class ProbeRequest {
    public static final String OPERATION = "probe";
    public static final int DEFAULT_SAMPLE_SIZE = 3;
    public static final int MAX_SAMPLE_SIZE = 20;

    String url;
    @Builder.Default
    String method = "GET";
    @JsonProperty("sla_ms")
    int slaMs;
    @Builder.Default
    @JsonProperty("sample_size")
    int sampleSize = DEFAULT_SAMPLE_SIZE;
    @JsonProperty("latency_overrides")
    List<Double> latencyOverrides;
    @JsonProperty("template_id")
    String templateId;
    @JsonProperty("template_name")
    String templateName;
    @JsonProperty("notification_rules")
    List<NotificationRule> notificationRules;

    public static boolean isValidSampleSize(int sampleSize) {
        return sampleSize >= 1 && sampleSize <= MAX_SAMPLE_SIZE;
    }

    public static String sampleSizeRule() {
        return "sample_size must be between 1 and " + MAX_SAMPLE_SIZE;
    }

    /**
     * Checks a raw probe payload before it is queued.
     *
     * @throws IllegalArgumentException if {@code sample_size} is present and not an integer in range
     */
    public static void checkSampleSize(JsonNode payload) {
        JsonNode value = payload == null ? null : payload.get("sample_size");
        if (value == null || value.isNull()) {
            return;
        }
        if (!value.canConvertToInt() || !value.isIntegralNumber() || !isValidSampleSize(value.intValue())) {
            throw new IllegalArgumentException(sampleSizeRule());
        }
    }

    public static ProbeRequest fromTemplate(ProbeTemplate template) {
        return ProbeRequest.builder()
                .url(template.getUrl())
                .method(template.getMethod())
                .slaMs(template.getSlaMs())
                .templateId(template.getId())
                .templateName(template.getName())
                .notificationRules(List.copyOf(template.getNotificationRules()))
                .build();
    }
}
