package com.sretoolbox.probe;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * When a rule fires: unconditionally, on any breached sample, or on the first healthy run after an unhealthy one.
 */
public enum NotificationThreshold {
    ALWAYS, BREACH, RECOVERY;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static NotificationThreshold fromWire(String value) {
        for (NotificationThreshold t : values()) {
            if (t.wireName().equalsIgnoreCase(value)) {
                return t;
            }
        }
        throw new IllegalArgumentException("unknown notification threshold: " + value);
    }
}
