package com.truthfeed.anchor;

/**
 * Transient anchoring failure. The caller keeps the record with a pending
 * anchor and retries later.
 */
public class AnchoringUnavailableException extends RuntimeException {

    public AnchoringUnavailableException(String message) {
        super(message);
    }

    public AnchoringUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
