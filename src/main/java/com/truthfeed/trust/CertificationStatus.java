package com.truthfeed.trust;

import com.fasterxml.jackson.annotation.JsonValue;

public enum CertificationStatus {
    ACTIVE("active"),
    EXPIRED("expired");

    private final String value;

    CertificationStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
