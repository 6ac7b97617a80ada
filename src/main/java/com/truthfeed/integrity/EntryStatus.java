package com.truthfeed.integrity;

import com.fasterxml.jackson.annotation.JsonValue;

public enum EntryStatus {
    CONFIRMED("confirmed"),
    PENDING("pending"),
    DISPUTED("disputed");

    private final String value;

    EntryStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
