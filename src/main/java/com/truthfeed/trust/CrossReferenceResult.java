package com.truthfeed.trust;

import com.fasterxml.jackson.annotation.JsonValue;

public enum CrossReferenceResult {
    VERIFIED("verified"),
    DISPUTED("disputed"),
    INSUFFICIENT_DATA("insufficient_data");

    private final String value;

    CrossReferenceResult(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
