package com.sretoolbox.probe;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;

/**
 * Result payload of a probe job.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class ProbeExecutionSummary {
    @JsonProperty("template_id")
    String templateId;
    @JsonProperty("template_name")
    String templateName;
    @JsonProperty("sla_ms")
    int slaMs;
    @Builder.Default
    List<ProbeExecutionSample> samples = List.of();
    @JsonProperty("average_latency_ms")
    double averageLatencyMs;
    @JsonProperty("breach_count")
    int breachCount;
    @JsonProperty("met_sla")
    boolean metSla;
    @Builder.Default
    @JsonProperty("notified_channels")
    List<NotificationChannel> notifiedChannels = List.of();

    public static ProbeExecutionSummary from(String templateId, String templateName, int slaMs,
            List<ProbeExecutionSample> samples) {
        double avg = samples.stream().mapToDouble(ProbeExecutionSample::getLatencyMs).average().orElse(0.0);
        int breaches = (int) samples.stream().filter(ProbeExecutionSample::isBreach).count();
        return ProbeExecutionSummary.builder()
                .templateId(templateId)
                .templateName(templateName)
                .slaMs(slaMs)
                .samples(List.copyOf(samples))
                .averageLatencyMs(BigDecimal.valueOf(avg).setScale(2, RoundingMode.HALF_UP).doubleValue())
                .breachCount(breaches)
                .metSla(breaches == 0)
                .build();
    }
}
