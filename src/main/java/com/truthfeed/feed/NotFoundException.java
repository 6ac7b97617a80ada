package com.truthfeed.feed;

/**
 * Base type for lookups of unknown feeds, subjects or subscriptions.
 * Surfaced to the caller as-is; never retried.
 */
public class NotFoundException extends RuntimeException {

    public NotFoundException(String message) {
        super(message);
    }
}
