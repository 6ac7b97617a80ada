package com.truthfeed.subscription;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum DeliveryMode {
    CALLBACK("callback"),
    STREAM("stream"),
    POLL("poll");

    private final String value;

    DeliveryMode(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /** Also accepts the legacy transport names {@code webhook}, {@code websocket} and {@code rss}. */
    @JsonCreator
    public static DeliveryMode fromValue(String value) {
        if (value == null) {
            return null;
        }
        switch (value) {
            case "webhook":
                return CALLBACK;
            case "websocket":
                return STREAM;
            case "rss":
                return POLL;
            default:
                break;
        }
        for (DeliveryMode mode : values()) {
            if (mode.value.equals(value) || mode.name().equals(value)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unknown delivery_mode: " + value);
    }
}
