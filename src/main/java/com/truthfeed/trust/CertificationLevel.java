package com.truthfeed.trust;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum CertificationLevel {
    BASIC("basic"),
    STANDARD("standard"),
    ADVANCED("advanced"),
    ENTERPRISE("enterprise");

    private final String value;

    CertificationLevel(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static CertificationLevel fromValue(String value) {
        for (CertificationLevel level : values()) {
            if (level.value.equals(value) || level.name().equals(value)) {
                return level;
            }
        }
        throw new IllegalArgumentException("Unknown certification_level: " + value);
    }
}
