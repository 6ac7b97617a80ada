package com.truthfeed.feed;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Verification state exposed next to feed, chain and trust data so consumers
 * can decide how far to trust it.
 */
public enum VerificationStatus {
    VERIFIED("verified"),
    PENDING("pending"),
    DISPUTED("disputed");

    private final String value;

    VerificationStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
