package com.sretoolbox.probe;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum NotificationChannel {
    SLACK, PAGERDUTY, EMAIL, WEBHOOK;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static NotificationChannel fromWire(String value) {
        for (NotificationChannel c : values()) {
            if (c.wireName().equalsIgnoreCase(value)) {
                return c;
            }
        }
        throw new IllegalArgumentException("unknown notification channel: " + value);
    }
}
