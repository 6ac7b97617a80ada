package com.truthfeed.feed;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

public enum FeedType {
    TRUST_SCORE("trust_score"),
    COMPLIANCE_EVENTS("compliance_events"),
    REGULATORY_UPDATES("regulatory_updates"),
    EXPERT_OPINIONS("expert_opinions"),
    AUDIT_ACTIVITIES("audit_activities");

    private final String value;

    FeedType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static FeedType fromValue(String raw) {
        if (raw == null) {
            return null;
        }
        return Arrays.stream(values())
            .filter(v -> v.value.equalsIgnoreCase(raw) || v.name().equalsIgnoreCase(raw))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown feed type: " + raw));
    }
}
