package com.truthfeed.api;

import com.truthfeed.chain.NonCanonicalPayloadException;
import com.truthfeed.feed.NotFoundException;
import com.truthfeed.integrity.ChainCorruptionException;
import com.truthfeed.subscription.FilterEvaluationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps engine exceptions to the machine-readable error body:
 * <pre>
 * {
 *   "error_code": "CHAIN_CORRUPTION",
 *   "message": "...",
 *   "timestamp": "2026-..."
 * }
 * </pre>
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(NotFoundException.class)
    @ResponseStatus(HttpStatus.NOT_FOUND)
    public Map<String, Object> handleNotFound(NotFoundException ex) {
        return errorResponse("NOT_FOUND", ex.getMessage());
    }

    @ExceptionHandler(ChainCorruptionException.class)
    @ResponseStatus(HttpStatus.CONFLICT)
    public Map<String, Object> handleChainCorruption(ChainCorruptionException ex) {
        log.warn("Chain corruption for subject={}: {}", ex.getSubjectId(), ex.getMessage());
        return errorResponse("CHAIN_CORRUPTION", ex.getMessage());
    }

    @ExceptionHandler(FilterEvaluationException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleInvalidFilter(FilterEvaluationException ex) {
        return errorResponse("INVALID_FILTER", ex.getMessage());
    }

    @ExceptionHandler(NonCanonicalPayloadException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleNonCanonical(NonCanonicalPayloadException ex) {
        return errorResponse("NON_CANONICAL_PAYLOAD", ex.getMessage());
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleUnreadable(HttpMessageNotReadableException ex) {
        for (Throwable cause = ex.getCause(); cause != null; cause = cause.getCause()) {
            if (cause instanceof FilterEvaluationException filterError) {
                return errorResponse("INVALID_FILTER", filterError.getMessage());
            }
        }
        return errorResponse("BAD_REQUEST", "request format is invalid: " + ex.getMostSpecificCause().getMessage());
    }

    @ExceptionHandler({
        MethodArgumentTypeMismatchException.class,
        MissingServletRequestParameterException.class
    })
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleParseErrors(Exception ex) {
        return errorResponse("BAD_REQUEST", "request format is invalid: " + ex.getMessage());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleIllegalArgument(IllegalArgumentException ex) {
        return errorResponse("INVALID_ARGUMENT", ex.getMessage());
    }

    @ExceptionHandler(Exception.class)
    @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
    public Map<String, Object> handleUnexpected(Exception ex) {
        log.error("Unexpected error", ex);
        return errorResponse("INTERNAL_ERROR", "an unexpected error occurred");
    }

    private Map<String, Object> errorResponse(String errorCode, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error_code", errorCode);
        body.put("message", message);
        body.put("timestamp", Instant.now().toString());
        return body;
    }
}
