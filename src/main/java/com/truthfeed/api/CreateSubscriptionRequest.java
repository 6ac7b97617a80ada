package com.truthfeed.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.truthfeed.feed.FeedRef;
import com.truthfeed.subscription.DeliveryMode;
import com.truthfeed.subscription.FeedFilter;

import java.util.List;

/**
 * Body of {@code POST /v1/subscriptions}:
 * <pre>
 * {
 *   "subscriber_id": "acme-risk",
 *   "feeds": [ { "feed_type": "compliance_events" }, { "feed_type": "trust_score", "subject_id": "org-42" } ],
 *   "filters": [ { "filter_type": "compliance_framework", "operator": "contains", "value": "GDPR" } ],
 *   "delivery_mode": "callback",
 *   "endpoint": "https://hooks.acme.example/truth",
 *   "rate_limit": 500
 * }
 * </pre>
 */
public record CreateSubscriptionRequest(
    @JsonProperty("subscriber_id") String subscriberId,
    @JsonProperty("feeds") List<FeedRef> feeds,
    @JsonProperty("filters") List<FeedFilter> filters,
    @JsonProperty("delivery_mode") DeliveryMode deliveryMode,
    @JsonProperty("endpoint") String endpoint,
    @JsonProperty("rate_limit") Integer rateLimit
) {}
