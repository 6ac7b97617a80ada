package com.truthfeed.subscription;

import com.truthfeed.bus.FeedEvent;
import com.truthfeed.config.TruthFeedProperties;
import com.truthfeed.feed.Feed;
import com.truthfeed.feed.FeedRef;
import com.truthfeed.feed.FeedRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

@Service
public class SubscriptionService {

    private static final Logger log = LoggerFactory.getLogger(SubscriptionService.class);

    static final int MAX_POLL_BATCH = 1000;

    private final FeedRegistry feedRegistry;
    private final CallbackDeliveryQueue callbackQueue;
    private final StreamRegistry streamRegistry;
    private final Clock clock;
    private final int defaultRateLimit;
    private final Duration ratePeriod;
    private final ConcurrentHashMap<String, Subscription> subscriptions = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Set<String>> subscriptionsByFeed = new ConcurrentHashMap<>();

    public SubscriptionService(FeedRegistry feedRegistry,
                               CallbackDeliveryQueue callbackQueue,
                               StreamRegistry streamRegistry,
                               Clock clock,
                               TruthFeedProperties properties) {
        this.feedRegistry = feedRegistry;
        this.callbackQueue = callbackQueue;
        this.streamRegistry = streamRegistry;
        this.clock = clock;
        this.defaultRateLimit = properties.subscription().defaultRateLimit();
        this.ratePeriod = properties.subscription().ratePeriod();
    }

    public Subscription subscribe(String subscriberId, List<FeedRef> feedRefs, List<FeedFilter> filters,
                                  DeliveryMode mode, String endpoint) {
        return subscribe(subscriberId, feedRefs, filters, mode, endpoint, null);
    }

    /**
     * Creates an active subscription. Filters are validated before anything
     * is registered.
     *
     * @throws FilterEvaluationException for a malformed filter
     * @throws IllegalArgumentException for a missing subscriber, feed set or
     *         mode, or a callback subscription without a valid endpoint
     * @throws com.truthfeed.feed.FeedNotFoundException for an unknown feed
     */
    public Subscription subscribe(String subscriberId, List<FeedRef> feedRefs, List<FeedFilter> filters,
                                  DeliveryMode mode, String endpoint, Integer rateLimit) {
        if (subscriberId == null || subscriberId.isBlank()) {
            throw new IllegalArgumentException("subscriber_id is required");
        }
        if (feedRefs == null || feedRefs.isEmpty()) {
            throw new IllegalArgumentException("at least one feed is required");
        }
        if (mode == null) {
            throw new IllegalArgumentException("delivery_mode is required");
        }
        if (mode == DeliveryMode.CALLBACK) {
            requireCallbackEndpoint(endpoint);
        }
        if (rateLimit != null && rateLimit < 1) {
            throw new IllegalArgumentException("rate_limit must be >= 1");
        }
        List<FeedFilter> submitted = filters == null ? List.of() : filters;
        List<CompiledFilter> compiled = FilterCompiler.compileAll(submitted);

        List<FeedRef> feeds = new ArrayList<>();
        for (FeedRef ref : new LinkedHashSet<>(feedRefs)) {
            Feed feed = feedRegistry.resolveForAppend(ref);
            feeds.add(feed.getRef());
        }

        Subscription subscription = new Subscription(
            "sub_" + UUID.randomUUID(),
            subscriberId,
            feeds,
            submitted,
            compiled,
            mode,
            endpoint,
            mode == DeliveryMode.CALLBACK ? WebhookSigner.newSecret() : null,
            rateLimit != null ? rateLimit : defaultRateLimit,
            ratePeriod,
            clock.instant()
        );
        subscriptions.put(subscription.getSubscriptionId(), subscription);
        for (FeedRef ref : feeds) {
            subscriptionsByFeed.computeIfAbsent(ref.feedId(), id -> ConcurrentHashMap.newKeySet())
                .add(subscription.getSubscriptionId());
            feedRegistry.incrementSubscriberCount(ref);
        }
        log.info("Subscription {} created for subscriber={} feeds={} mode={} filters={}",
            subscription.getSubscriptionId(), subscriberId, subscription.getFeedIds(),
            mode.getValue(), submitted.size());
        return subscription;
    }

    /**
     * Deactivates the subscription. Repeated calls are no-ops.
     */
    public Subscription unsubscribe(String subscriptionId) {
        Subscription subscription = get(subscriptionId);
        synchronized (subscription) {
            if (!subscription.isActive()) {
                return subscription;
            }
            subscription.deactivate();
        }
        for (FeedRef ref : subscription.getFeeds()) {
            Set<String> ids = subscriptionsByFeed.get(ref.feedId());
            if (ids != null) {
                ids.remove(subscriptionId);
            }
            feedRegistry.decrementSubscriberCount(ref);
        }
        streamRegistry.close(subscriptionId);
        log.info("Subscription {} deactivated", subscriptionId);
        return subscription;
    }

    public Subscription get(String subscriptionId) {
        Subscription subscription = subscriptions.get(subscriptionId);
        if (subscription == null) {
            throw new SubscriptionNotFoundException(subscriptionId);
        }
        return subscription;
    }

    /**
     * Delivers {@code event} to every active subscription on its feed whose
     * filters all match.
     *
     * @return outcome per matched subscription id
     */
    public Map<String, DeliveryOutcome> matchAndDeliver(FeedEvent event) {
        Map<String, DeliveryOutcome> outcomes = new LinkedHashMap<>();
        Set<String> candidates = subscriptionsByFeed.get(event.feedId());
        if (candidates == null || candidates.isEmpty()) {
            return outcomes;
        }
        Instant now = clock.instant();
        for (String subscriptionId : candidates) {
            Subscription subscription = subscriptions.get(subscriptionId);
            if (subscription == null || !subscription.isActive() || !subscription.matches(event)) {
                continue;
            }
            outcomes.put(subscriptionId, deliver(subscription, event, now));
        }
        return outcomes;
    }

    /**
     * Drains up to {@code max} buffered events from a poll subscription.
     */
    public List<FeedEvent> poll(String subscriptionId, int max) {
        Subscription subscription = get(subscriptionId);
        if (subscription.getDeliveryMode() != DeliveryMode.POLL) {
            throw new IllegalArgumentException("subscription " + subscriptionId + " is not in poll mode");
        }
        int batch = Math.max(1, Math.min(max, MAX_POLL_BATCH));
        List<FeedEvent> drained = subscription.drainBuffer(batch);
        if (!drained.isEmpty()) {
            releaseDeferred(subscription, clock.instant());
        }
        return drained;
    }

    public void attachStream(String subscriptionId, StreamSink sink) {
        Subscription subscription = get(subscriptionId);
        if (subscription.getDeliveryMode() != DeliveryMode.STREAM) {
            throw new IllegalArgumentException("subscription " + subscriptionId + " is not in stream mode");
        }
        if (!subscription.isActive()) {
            throw new IllegalArgumentException("subscription " + subscriptionId + " is inactive");
        }
        streamRegistry.attach(subscriptionId, sink);
    }

    public void detachStream(String subscriptionId, StreamSink sink) {
        streamRegistry.detach(subscriptionId, sink);
    }

    @Scheduled(fixedDelayString = "${truth-feed.subscription.release-interval:PT1M}")
    public void releaseDeferredScheduled() {
        int released = releaseDeferred();
        if (released > 0) {
            log.info("Released {} deferred deliveries", released);
        }
    }

    /**
     * Hands deferred events to their subscriptions as far as each current
     * rate window allows.
     *
     * @return number of events released
     */
    public int releaseDeferred() {
        Instant now = clock.instant();
        int released = 0;
        for (Subscription subscription : subscriptions.values()) {
            if (subscription.isActive() && subscription.hasDeferred()) {
                released += releaseDeferred(subscription, now);
            }
        }
        return released;
    }

    private int releaseDeferred(Subscription subscription, Instant now) {
        List<FeedEvent> released;
        synchronized (subscription) {
            released = subscription.releaseDeferred(now);
            for (FeedEvent event : released) {
                dispatch(subscription, event);
            }
        }
        return released.size();
    }

    private DeliveryOutcome deliver(Subscription subscription, FeedEvent event, Instant now) {
        synchronized (subscription) {
            if (!subscription.isActive()) {
                return DeliveryOutcome.DROPPED;
            }
            if (!subscription.hasPollRoom() || !subscription.tryAcquireSlot(now)) {
                subscription.defer(event);
                log.debug("Deferred event={} for subscription={}", event.eventId(), subscription.getSubscriptionId());
                return DeliveryOutcome.DEFERRED;
            }
            return dispatch(subscription, event);
        }
    }

    private DeliveryOutcome dispatch(Subscription subscription, FeedEvent event) {
        switch (subscription.getDeliveryMode()) {
            case CALLBACK:
                callbackQueue.enqueue(subscription, event);
                return DeliveryOutcome.QUEUED;
            case STREAM:
                if (streamRegistry.send(subscription.getSubscriptionId(), event)) {
                    subscription.recordDelivered();
                    return DeliveryOutcome.DELIVERED;
                }
                return DeliveryOutcome.DROPPED;
            default:
                subscription.buffer(event);
                subscription.recordDelivered();
                return DeliveryOutcome.BUFFERED;
        }
    }

    private static void requireCallbackEndpoint(String endpoint) {
        if (endpoint == null || endpoint.isBlank()) {
            throw new IllegalArgumentException("callback subscriptions require an endpoint");
        }
        try {
            URI uri = new URI(endpoint);
            if (uri.getHost() == null || !("http".equals(uri.getScheme()) || "https".equals(uri.getScheme()))) {
                throw new IllegalArgumentException("endpoint must be an absolute http(s) URL: " + endpoint);
            }
        } catch (URISyntaxException ex) {
            throw new IllegalArgumentException("endpoint is not a valid URL: " + endpoint, ex);
        }
    }
}
