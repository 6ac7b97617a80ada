package com.truthfeed.feed;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;

/**
 * A typed, append-only feed, global or scoped to one subject.
 *
 * The append lock serializes writers so sequence numbers and hash links stay
 * unbroken. Feeds are never removed; archival only marks them dormant.
 */
public class Feed {

    private final FeedRef ref;
    private final UpdateFrequency updateFrequency;
    private final int retentionDays;
    private final Instant createdAt;
    private final AtomicInteger subscriberCount = new AtomicInteger();
    private final AtomicInteger pendingAnchors = new AtomicInteger();
    private final ReentrantLock appendLock = new ReentrantLock();
    private volatile Instant lastUpdated;
    private volatile boolean disputed;
    private volatile boolean dormant;

    public Feed(FeedRef ref, UpdateFrequency updateFrequency, int retentionDays, Instant createdAt) {
        if (retentionDays < 1) {
            throw new IllegalArgumentException("retention_days must be >= 1");
        }
        this.ref = ref;
        this.updateFrequency = updateFrequency;
        this.retentionDays = retentionDays;
        this.createdAt = createdAt;
        this.lastUpdated = createdAt;
    }

    @JsonIgnore
    public FeedRef getRef() {
        return ref;
    }

    @JsonProperty("feed_id")
    public String getFeedId() {
        return ref.feedId();
    }

    @JsonProperty("feed_type")
    public FeedType getFeedType() {
        return ref.feedType();
    }

    @JsonProperty("subject_id")
    public String getSubjectId() {
        return ref.subjectId();
    }

    @JsonProperty("update_frequency")
    public UpdateFrequency getUpdateFrequency() {
        return updateFrequency;
    }

    @JsonProperty("retention_days")
    public int getRetentionDays() {
        return retentionDays;
    }

    @JsonProperty("created_at")
    public Instant getCreatedAt() {
        return createdAt;
    }

    @JsonProperty("last_updated")
    public Instant getLastUpdated() {
        return lastUpdated;
    }

    @JsonProperty("subscriber_count")
    public int getSubscriberCount() {
        return subscriberCount.get();
    }

    @JsonProperty("dormant")
    public boolean isDormant() {
        return dormant;
    }

    @JsonProperty("verification_status")
    public VerificationStatus getVerificationStatus() {
        if (disputed) {
            return VerificationStatus.DISPUTED;
        }
        return pendingAnchors.get() > 0 ? VerificationStatus.PENDING : VerificationStatus.VERIFIED;
    }

    @JsonProperty("feed_url")
    public String getFeedUrl() {
        return ref.path() + "/events";
    }

    @JsonProperty("rss_endpoint")
    public String getRssEndpoint() {
        return ref.path() + "/rss";
    }

    @JsonProperty("stream_endpoint")
    public String getStreamEndpoint() {
        return "/v1/subscriptions/{subscription_id}/stream";
    }

    @JsonIgnore
    public ReentrantLock appendLock() {
        return appendLock;
    }

    public void markUpdated(Instant at) {
        this.lastUpdated = at;
        this.dormant = false;
    }

    public void markDormant() {
        this.dormant = true;
    }

    public void markDisputed() {
        this.disputed = true;
    }

    public void anchorPending() {
        pendingAnchors.incrementAndGet();
    }

    public void anchorResolved() {
        pendingAnchors.updateAndGet(n -> Math.max(0, n - 1));
    }

    int incrementSubscribers() {
        return subscriberCount.incrementAndGet();
    }

    int decrementSubscribers() {
        return subscriberCount.updateAndGet(n -> Math.max(0, n - 1));
    }
}
