package com.truthfeed.subscription;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.truthfeed.bus.FeedEvent;
import com.truthfeed.feed.FeedRef;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * A standing request for events from a set of feeds.
 *
 * Rate window, deferred backlog and poll buffer are guarded by the
 * subscription's monitor. Unsubscribing deactivates it and discards both
 * queues; the subscription record itself is kept.
 */
public class Subscription {

    private final String subscriptionId;
    private final String subscriberId;
    private final List<FeedRef> feeds;
    private final List<FeedFilter> filters;
    private final List<CompiledFilter> compiledFilters;
    private final DeliveryMode deliveryMode;
    private final String endpoint;
    private final String webhookSecret;
    private final int rateLimit;
    private final Duration ratePeriod;
    private final Instant createdAt;
    private final FixedWindowRateLimiter rateLimiter;
    private final Deque<FeedEvent> deferred = new ArrayDeque<>();
    private final Deque<FeedEvent> pollBuffer = new ArrayDeque<>();
    private volatile boolean active = true;
    private long deliveredCount;
    private long deferredCount;

    Subscription(String subscriptionId, String subscriberId, List<FeedRef> feeds, List<FeedFilter> filters,
                 List<CompiledFilter> compiledFilters, DeliveryMode deliveryMode, String endpoint,
                 String webhookSecret, int rateLimit, Duration ratePeriod, Instant createdAt) {
        this.subscriptionId = subscriptionId;
        this.subscriberId = subscriberId;
        this.feeds = List.copyOf(feeds);
        this.filters = List.copyOf(filters);
        this.compiledFilters = List.copyOf(compiledFilters);
        this.deliveryMode = deliveryMode;
        this.endpoint = endpoint;
        this.webhookSecret = webhookSecret;
        this.rateLimit = rateLimit;
        this.ratePeriod = ratePeriod;
        this.createdAt = createdAt;
        this.rateLimiter = new FixedWindowRateLimiter(rateLimit, ratePeriod, createdAt);
    }

    @JsonProperty("subscription_id")
    public String getSubscriptionId() {
        return subscriptionId;
    }

    @JsonProperty("subscriber_id")
    public String getSubscriberId() {
        return subscriberId;
    }

    @JsonProperty("feed_ids")
    public List<String> getFeedIds() {
        return feeds.stream().map(FeedRef::feedId).toList();
    }

    @JsonIgnore
    public List<FeedRef> getFeeds() {
        return feeds;
    }

    @JsonProperty("filters")
    public List<FeedFilter> getFilters() {
        return filters;
    }

    @JsonProperty("delivery_mode")
    public DeliveryMode getDeliveryMode() {
        return deliveryMode;
    }

    @JsonProperty("endpoint")
    public String getEndpoint() {
        return endpoint;
    }

    /** Shared secret for callback signatures; only returned when the subscription is created. */
    @JsonIgnore
    public String getWebhookSecret() {
        return webhookSecret;
    }

    @JsonProperty("rate_limit")
    public int getRateLimit() {
        return rateLimit;
    }

    @JsonProperty("rate_period_seconds")
    public long getRatePeriodSeconds() {
        return ratePeriod.toSeconds();
    }

    @JsonProperty("created_at")
    public Instant getCreatedAt() {
        return createdAt;
    }

    @JsonProperty("active")
    public boolean isActive() {
        return active;
    }

    @JsonProperty("delivered_count")
    public synchronized long getDeliveredCount() {
        return deliveredCount;
    }

    @JsonProperty("deferred_count")
    public synchronized long getDeferredCount() {
        return deferredCount;
    }

    @JsonProperty("pending_deferred")
    public synchronized int getPendingDeferred() {
        return deferred.size();
    }

    @JsonProperty("buffered")
    public synchronized int getBuffered() {
        return pollBuffer.size();
    }

    /** Every filter must match; evaluation stops at the first that does not. */
    public boolean matches(FeedEvent event) {
        for (CompiledFilter filter : compiledFilters) {
            if (!filter.matches(event)) {
                return false;
            }
        }
        return true;
    }

    synchronized void deactivate() {
        active = false;
        deferred.clear();
        pollBuffer.clear();
    }

    /**
     * Takes a delivery slot in the current window. Fails while earlier
     * deferred events are still waiting so that delivery order is kept.
     */
    synchronized boolean tryAcquireSlot(Instant now) {
        if (!deferred.isEmpty()) {
            return false;
        }
        return rateLimiter.tryAcquire(now);
    }

    synchronized void defer(FeedEvent event) {
        deferred.addLast(event);
        deferredCount++;
    }

    /**
     * Removes up to as many deferred events as the current window still
     * allows, oldest first.
     */
    synchronized List<FeedEvent> releaseDeferred(Instant now) {
        List<FeedEvent> released = new ArrayList<>();
        while (!deferred.isEmpty() && hasPollRoom() && rateLimiter.tryAcquire(now)) {
            released.add(deferred.pollFirst());
        }
        return released;
    }

    synchronized boolean hasPollRoom() {
        return deliveryMode != DeliveryMode.POLL || pollBuffer.size() < rateLimit;
    }

    synchronized void buffer(FeedEvent event) {
        pollBuffer.addLast(event);
    }

    synchronized List<FeedEvent> drainBuffer(int max) {
        List<FeedEvent> drained = new ArrayList<>(Math.min(max, pollBuffer.size()));
        while (drained.size() < max && !pollBuffer.isEmpty()) {
            drained.add(pollBuffer.pollFirst());
        }
        return drained;
    }

    synchronized void recordDelivered() {
        deliveredCount++;
    }

    @JsonIgnore
    synchronized boolean hasDeferred() {
        return !deferred.isEmpty();
    }
}
