package com.truthfeed.chain;

/**
 * Thrown when a value cannot be given a single canonical JSON encoding
 * (unordered collections, non-string map keys, non-finite numbers, or
 * arbitrary objects). Callers must supply plain JSON-shaped data.
 */
public class NonCanonicalPayloadException extends RuntimeException {

    public NonCanonicalPayloadException(String message) {
        super(message);
    }
}
