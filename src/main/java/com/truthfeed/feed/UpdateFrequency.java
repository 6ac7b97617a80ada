package com.truthfeed.feed;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

public enum UpdateFrequency {
    REAL_TIME("real-time"),
    EVENT_DRIVEN("event-driven"),
    HOURLY("hourly"),
    DAILY("daily");

    private final String value;

    UpdateFrequency(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static UpdateFrequency fromValue(String raw) {
        if (raw == null) {
            return null;
        }
        return Arrays.stream(values())
            .filter(v -> v.value.equalsIgnoreCase(raw) || v.name().equalsIgnoreCase(raw))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown update frequency: " + raw));
    }
}
