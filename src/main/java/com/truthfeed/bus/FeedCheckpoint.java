package com.truthfeed.bus;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Stand-in predecessor for the oldest active event once earlier events have
 * been archived. Carries the sequence number and proof of the last archived
 * event, so chain verification of the remaining log can start here.
 */
public record FeedCheckpoint(
    @JsonProperty("feed_id") String feedId,
    @JsonProperty("sequence_number") long sequenceNumber,
    @JsonProperty("integrity_proof") String integrityProof,
    @JsonProperty("archived_count") int archivedCount,
    @JsonProperty("checkpoint_hash") String checkpointHash,
    @JsonProperty("anchor_reference") String anchorReference,
    @JsonProperty("created_at") Instant createdAt
) {

    public FeedCheckpoint withAnchor(String reference) {
        return new FeedCheckpoint(feedId, sequenceNumber, integrityProof, archivedCount, checkpointHash,
            reference, createdAt);
    }
}
