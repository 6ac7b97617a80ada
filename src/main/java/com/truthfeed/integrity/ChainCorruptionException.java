package com.truthfeed.integrity;

/**
 * A chain link is missing or does not match. The affected chain is marked
 * disputed and stays so until it is reconciled by hand.
 */
public class ChainCorruptionException extends RuntimeException {

    private final String subjectId;

    public ChainCorruptionException(String subjectId, String message) {
        super("integrity chain for " + subjectId + " is corrupted: " + message);
        this.subjectId = subjectId;
    }

    public String getSubjectId() {
        return subjectId;
    }
}
