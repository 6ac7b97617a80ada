package com.truthfeed.bus;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.truthfeed.feed.FeedType;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A single appended fact. Immutable: resolving a pending anchor produces a
 * new instance via {@link #withAnchor(String)}.
 *
 * {@code integrity_proof} links {@code payload_hash} to
 * {@code previous_event_hash}; the next event in the feed carries this proof
 * as its own {@code previous_event_hash}.
 */
public record FeedEvent(
    @JsonProperty("event_id") String eventId,
    @JsonProperty("feed_id") String feedId,
    @JsonProperty("feed_type") FeedType feedType,
    @JsonProperty("subject_id") String subjectId,
    @JsonProperty("event_type") String eventType,
    @JsonProperty("payload") Map<String, Object> payload,
    @JsonProperty("confidence_score") double confidenceScore,
    @JsonProperty("timestamp") Instant timestamp,
    @JsonProperty("sequence_number") long sequenceNumber,
    @JsonProperty("previous_event_hash") String previousEventHash,
    @JsonProperty("payload_hash") String payloadHash,
    @JsonProperty("integrity_proof") String integrityProof,
    @JsonProperty("anchor_reference") String anchorReference,
    @JsonProperty("anchor_status") AnchorStatus anchorStatus
) {

    public static final String PENDING_ANCHOR = "pending";

    public FeedEvent withAnchor(String reference) {
        return new FeedEvent(eventId, feedId, feedType, subjectId, eventType, payload, confidenceScore,
            timestamp, sequenceNumber, previousEventHash, payloadHash, integrityProof,
            reference, AnchorStatus.ANCHORED);
    }

    @JsonIgnore
    public boolean isAnchored() {
        return anchorStatus == AnchorStatus.ANCHORED;
    }

    /**
     * The fields covered by {@code payload_hash}. Anchor fields are excluded
     * since they are filled in after hashing.
     */
    @JsonIgnore
    public Map<String, Object> hashedBody() {
        return hashedBody(eventId, feedId, sequenceNumber, eventType, subjectId, payload,
            confidenceScore, timestamp);
    }

    static Map<String, Object> hashedBody(String eventId, String feedId, long sequenceNumber,
                                          String eventType, String subjectId, Map<String, Object> payload,
                                          double confidenceScore, Instant timestamp) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("event_id", eventId);
        body.put("feed_id", feedId);
        body.put("sequence_number", sequenceNumber);
        body.put("event_type", eventType);
        body.put("subject_id", subjectId);
        body.put("payload", payload);
        body.put("confidence_score", confidenceScore);
        body.put("timestamp", timestamp.toString());
        return body;
    }
}
