package com.truthfeed.subscription;

/**
 * A filter that cannot be evaluated: unknown type or operator, an operator
 * the filter type does not support, or a malformed value. Raised when the
 * subscription is created, never while matching.
 */
public class FilterEvaluationException extends RuntimeException {

    public FilterEvaluationException(String message) {
        super(message);
    }

    public FilterEvaluationException(String message, Throwable cause) {
        super(message, cause);
    }
}
