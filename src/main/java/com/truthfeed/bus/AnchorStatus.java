package com.truthfeed.bus;

import com.fasterxml.jackson.annotation.JsonValue;

public enum AnchorStatus {
    ANCHORED("anchored"),
    PENDING("pending");

    private final String value;

    AnchorStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
