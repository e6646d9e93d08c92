package com.sretoolbox.probe;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class NotificationRule {
    NotificationChannel channel;
    String target;
    @Builder.Default
    NotificationThreshold threshold = NotificationThreshold.BREACH;
}
