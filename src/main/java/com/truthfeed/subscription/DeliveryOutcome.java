package com.truthfeed.subscription;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * What happened to one matched event for one subscription.
 */
public enum DeliveryOutcome {
    /** Pushed to an attached stream. */
    DELIVERED("delivered"),
    /** Handed to the outbound callback queue. */
    QUEUED("queued"),
    /** Added to the poll buffer. */
    BUFFERED("buffered"),
    /** Stream subscription with no attached connection, or a subscription deactivated meanwhile. */
    DROPPED("dropped"),
    /** Over the rate limit; released in a later window. */
    DEFERRED("deferred");

    private final String value;

    DeliveryOutcome(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
