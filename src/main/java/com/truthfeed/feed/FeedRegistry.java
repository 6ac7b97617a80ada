package com.truthfeed.feed;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Holds feed definitions keyed by {@code (type, subject)}.
 */
public class FeedRegistry {

    private static final Logger log = LoggerFactory.getLogger(FeedRegistry.class);

    private final ConcurrentHashMap<FeedRef, Feed> feeds = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Feed> feedsById = new ConcurrentHashMap<>();
    private final Clock clock;

    public FeedRegistry(Clock clock) {
        this.clock = clock;
    }

    /**
     * Registers a feed, or returns the existing one for the same
     * {@code (type, subjectId)} without modifying it.
     */
    public Feed registerFeed(FeedType type, String subjectId, UpdateFrequency frequency, int retentionDays) {
        FeedRef ref = FeedRef.of(type, subjectId);
        return feeds.computeIfAbsent(ref, r -> {
            Feed feed = new Feed(r, frequency, retentionDays, clock.instant());
            Feed clash = feedsById.putIfAbsent(feed.getFeedId(), feed);
            if (clash != null) {
                throw new IllegalStateException("feed_id " + feed.getFeedId() + " already belongs to " + clash.getRef());
            }
            log.info("Registered feed {} (frequency={}, retention_days={})",
                feed.getFeedId(), frequency.getValue(), retentionDays);
            return feed;
        });
    }

    public Feed lookupFeed(FeedType type, String subjectId) {
        return lookupFeed(FeedRef.of(type, subjectId));
    }

    public Feed lookupFeed(FeedRef ref) {
        Feed feed = feeds.get(ref);
        if (feed == null) {
            throw new FeedNotFoundException(ref);
        }
        return feed;
    }

    /**
     * Resolves the target of an append. Per-subject feeds are created on first
     * use and inherit frequency and retention from the global feed of the same
     * type; global feeds must already be registered.
     */
    public Feed resolveForAppend(FeedRef ref) {
        Feed existing = feeds.get(ref);
        if (existing != null) {
            return existing;
        }
        if (ref.isGlobal()) {
            throw new FeedNotFoundException(ref);
        }
        Feed template = lookupFeed(FeedRef.global(ref.feedType()));
        return registerFeed(ref.feedType(), ref.subjectId(),
            template.getUpdateFrequency(), template.getRetentionDays());
    }

    public Optional<Feed> findById(String feedId) {
        return Optional.ofNullable(feedsById.get(feedId));
    }

    public List<Feed> allFeeds() {
        List<Feed> all = new ArrayList<>(feeds.values());
        all.sort(Comparator.comparing(Feed::getFeedId));
        return all;
    }

    public int incrementSubscriberCount(FeedRef ref) {
        return lookupFeed(ref).incrementSubscribers();
    }

    public int decrementSubscriberCount(FeedRef ref) {
        return lookupFeed(ref).decrementSubscribers();
    }
}
