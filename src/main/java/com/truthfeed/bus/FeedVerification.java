package com.truthfeed.bus;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.truthfeed.feed.VerificationStatus;

/**
 * Result of re-walking a feed's active log from its checkpoint (or genesis).
 * {@code first_invalid_sequence} is null when every link holds.
 */
public record FeedVerification(
    @JsonProperty("feed_id") String feedId,
    @JsonProperty("valid") boolean valid,
    @JsonProperty("events_checked") int eventsChecked,
    @JsonProperty("first_invalid_sequence") Long firstInvalidSequence,
    @JsonProperty("reason") String reason,
    @JsonProperty("checkpoint_sequence") Long checkpointSequence,
    @JsonProperty("verification_status") VerificationStatus verificationStatus
) {}
