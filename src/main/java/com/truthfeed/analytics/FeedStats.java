package com.truthfeed.analytics;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.truthfeed.feed.VerificationStatus;

import java.time.Instant;
import java.util.Map;

/**
 * Statistics over the active events of one feed within {@code [from, to]}.
 * Rates are fractions in [0, 1] and are 0 for an empty window.
 */
public record FeedStats(
    @JsonProperty("feed_id") String feedId,
    @JsonProperty("from") Instant from,
    @JsonProperty("to") Instant to,
    @JsonProperty("total_events") int totalEvents,
    @JsonProperty("events_by_type") Map<String, Long> eventsByType,
    @JsonProperty("average_confidence") double averageConfidence,
    @JsonProperty("verification_rate") double verificationRate,
    @JsonProperty("anchored_rate") double anchoredRate,
    @JsonProperty("data_integrity_score") double dataIntegrityScore,
    @JsonProperty("subscriber_count") int subscriberCount,
    @JsonProperty("archived_events") int archivedEvents,
    @JsonProperty("verification_status") VerificationStatus verificationStatus
) {}
