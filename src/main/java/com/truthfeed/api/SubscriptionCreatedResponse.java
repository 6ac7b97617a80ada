package com.truthfeed.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.truthfeed.subscription.Subscription;

/**
 * The webhook secret is only ever returned here.
 */
public record SubscriptionCreatedResponse(
    @JsonProperty("subscription") Subscription subscription,
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonProperty("webhook_secret") String webhookSecret
) {}
