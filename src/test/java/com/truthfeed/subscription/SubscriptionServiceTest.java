package com.truthfeed.subscription;

import com.truthfeed.TestEngine;
import com.truthfeed.RecordingCallbackClient;
import com.truthfeed.bus.FeedEvent;
import com.truthfeed.config.TruthFeedProperties;
import com.truthfeed.feed.FeedRef;
import com.truthfeed.feed.FeedType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class SubscriptionServiceTest {

    private static final FeedRef COMPLIANCE = FeedRef.global(FeedType.COMPLIANCE_EVENTS);
    private static final String ENDPOINT = "https://hooks.example.com/truth-feed";

    private TestEngine engine;

    @BeforeEach
    void setUp() {
        engine = new TestEngine();
    }

    private FeedEvent complianceEvent(String organization, String framework) {
        return engine.events.appendEvent(COMPLIANCE, "compliance_event",
            Map.of("organization_id", organization, "framework", framework), 0.9);
    }

    @Test
    @DisplayName("compliance_framework contains GDPR delivers only the GDPR event")
    void gdprFilter_deliversExactlyOnce() {
        Subscription subscription = engine.subscriptions.subscribe("acme-risk", List.of(COMPLIANCE),
            List.of(FeedFilter.of(FilterType.COMPLIANCE_FRAMEWORK, FilterOperator.CONTAINS, "GDPR")),
            DeliveryMode.CALLBACK, ENDPOINT);

        FeedEvent gdpr = complianceEvent("org-1", "GDPR");
        complianceEvent("org-2", "SOC2");
        assertEquals(1, engine.callbackQueue.drain());

        List<RecordingCallbackClient.Delivery> deliveries = engine.callbacks.deliveries();
        assertEquals(1, deliveries.size());
        assertEquals(gdpr.eventId(), deliveries.get(0).event().eventId());
        assertEquals(ENDPOINT, deliveries.get(0).endpoint());
        assertEquals(subscription.getWebhookSecret(), deliveries.get(0).webhookSecret());
        assertTrue(subscription.getWebhookSecret().startsWith("whsec_"));
        assertEquals(1, subscription.getDeliveredCount());
    }

    @Test
    void allFiltersMustMatch() {
        Subscription subscription = engine.subscriptions.subscribe("acme", List.of(COMPLIANCE), List.of(
                FeedFilter.of(FilterType.COMPLIANCE_FRAMEWORK, FilterOperator.EQUALS, "GDPR"),
                FeedFilter.of(FilterType.ORGANIZATION, FilterOperator.EQUALS, "org-1")),
            DeliveryMode.POLL, null);

        complianceEvent("org-1", "GDPR");
        complianceEvent("org-2", "GDPR");
        complianceEvent("org-1", "SOC2");

        List<FeedEvent> polled = engine.subscriptions.poll(subscription.getSubscriptionId(), 10);
        assertEquals(1, polled.size());
        assertEquals("org-1", polled.get(0).subjectId());
    }

    @Test
    void subscribe_updatesSubscriberCountAndCreatesSubjectFeed() {
        FeedRef subjectFeed = FeedRef.of(FeedType.TRUST_SCORE, "org-5");
        engine.subscriptions.subscribe("acme", List.of(COMPLIANCE, subjectFeed), List.of(), DeliveryMode.POLL, null);

        assertEquals(1, engine.registry.lookupFeed(COMPLIANCE).getSubscriberCount());
        assertEquals(1, engine.registry.lookupFeed(subjectFeed).getSubscriberCount());
    }

    @Test
    void unsubscribe_isIdempotentAndStopsDelivery() {
        Subscription subscription = engine.subscriptions.subscribe("acme", List.of(COMPLIANCE), List.of(),
            DeliveryMode.POLL, null);

        engine.subscriptions.unsubscribe(subscription.getSubscriptionId());
        engine.subscriptions.unsubscribe(subscription.getSubscriptionId());
        complianceEvent("org-1", "GDPR");

        assertFalse(subscription.isActive());
        assertEquals(0, subscription.getBuffered());
        assertEquals(0, engine.registry.lookupFeed(COMPLIANCE).getSubscriberCount());
    }

    @Nested
    @DisplayName("Rate limiting")
    class RateLimiting {

        @Test
        void overLimitEventsAreDeferredThenReleasedInOrder() {
            Subscription subscription = engine.subscriptions.subscribe("acme", List.of(COMPLIANCE), List.of(),
                DeliveryMode.STREAM, null, 2);
            List<FeedEvent> received = new ArrayList<>();
            engine.subscriptions.attachStream(subscription.getSubscriptionId(), received::add);

            FeedEvent first = complianceEvent("org-1", "A");
            FeedEvent second = complianceEvent("org-1", "B");
            FeedEvent third = complianceEvent("org-1", "C");
            FeedEvent fourth = complianceEvent("org-1", "D");

            assertEquals(List.of(first, second), received);
            assertEquals(2, subscription.getPendingDeferred());
            assertEquals(0, engine.subscriptions.releaseDeferred(), "window still exhausted");

            engine.clock.advance(Duration.ofHours(1));
            assertEquals(2, engine.subscriptions.releaseDeferred());
            assertEquals(List.of(first, second, third, fourth), received);
            assertEquals(4, subscription.getDeliveredCount());
            assertEquals(2, subscription.getDeferredCount());
        }

        @Test
        void pollBufferIsBoundedByRateLimit() {
            Subscription subscription = engine.subscriptions.subscribe("acme", List.of(COMPLIANCE), List.of(),
                DeliveryMode.POLL, null, 2);

            complianceEvent("org-1", "A");
            complianceEvent("org-1", "B");
            FeedEvent third = complianceEvent("org-1", "C");

            assertEquals(2, subscription.getBuffered());
            assertEquals(1, subscription.getPendingDeferred());
            assertEquals(2, engine.subscriptions.poll(subscription.getSubscriptionId(), 10).size());

            engine.clock.advance(Duration.ofHours(1));
            engine.subscriptions.releaseDeferred();
            assertEquals(List.of(third), engine.subscriptions.poll(subscription.getSubscriptionId(), 10));
        }
    }

    @Test
    @DisplayName("Racing subscribe and duplicate unsubscribe calls keep subscriber_count exact")
    void concurrentSubscribeAndUnsubscribe_keepCountExact() throws Exception {
        int threads = 8;
        int perThread = 20;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        try {
            ConcurrentLinkedQueue<String> ids = new ConcurrentLinkedQueue<>();
            List<Future<?>> tasks = new ArrayList<>();
            for (int t = 0; t < threads; t++) {
                tasks.add(pool.submit(() -> {
                    for (int i = 0; i < perThread; i++) {
                        ids.add(engine.subscriptions.subscribe("acme", List.of(COMPLIANCE), List.of(),
                            DeliveryMode.POLL, null).getSubscriptionId());
                    }
                }));
            }
            for (Future<?> task : tasks) {
                task.get(30, TimeUnit.SECONDS);
            }
            assertEquals(threads * perThread, engine.registry.lookupFeed(COMPLIANCE).getSubscriberCount());

            List<String> toCancel = new ArrayList<>(ids).subList(0, threads * perThread / 2);
            tasks.clear();
            for (int copy = 0; copy < 2; copy++) {
                for (String id : toCancel) {
                    tasks.add(pool.submit(() -> engine.subscriptions.unsubscribe(id)));
                }
            }
            for (Future<?> task : tasks) {
                task.get(30, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdown();
        }

        assertEquals(threads * perThread / 2, engine.registry.lookupFeed(COMPLIANCE).getSubscriberCount());
    }

    @Test
    void unsubscribe_discardsDeferredBacklogAndBuffer() {
        Subscription subscription = engine.subscriptions.subscribe("acme", List.of(COMPLIANCE), List.of(),
            DeliveryMode.POLL, null, 1);
        complianceEvent("org-1", "A");
        complianceEvent("org-1", "B");
        complianceEvent("org-1", "C");
        assertEquals(1, subscription.getBuffered());
        assertEquals(2, subscription.getPendingDeferred());

        engine.subscriptions.unsubscribe(subscription.getSubscriptionId());

        assertEquals(0, subscription.getPendingDeferred());
        assertEquals(0, subscription.getBuffered());
        engine.clock.advance(Duration.ofHours(1));
        assertEquals(0, engine.subscriptions.releaseDeferred());
        assertEquals(2, subscription.getDeferredCount(), "history counters survive deactivation");
    }

    @Nested
    @DisplayName("Callback delivery")
    class Callbacks {

        private Subscription subscription;

        @BeforeEach
        void subscribe() {
            subscription = engine.subscriptions.subscribe("acme", List.of(COMPLIANCE), List.of(),
                DeliveryMode.CALLBACK, ENDPOINT);
        }

        @Test
        void failedCallbackIsRetriedAfterBackoff() {
            engine.callbacks.failNext(1);
            complianceEvent("org-1", "GDPR");

            assertEquals(0, engine.callbackQueue.drain());
            assertEquals(1, engine.callbackQueue.size());
            assertEquals(0, engine.callbackQueue.drain(), "backoff not elapsed");

            engine.clock.advance(Duration.ofSeconds(1));
            assertEquals(1, engine.callbackQueue.drain());
            assertEquals(2, engine.callbacks.attempts());
            assertEquals(1, subscription.getDeliveredCount());
        }

        @Test
        void unsubscribeCancelsPendingRetries() {
            engine.callbacks.failNext(1);
            complianceEvent("org-1", "GDPR");
            engine.callbackQueue.drain();

            engine.subscriptions.unsubscribe(subscription.getSubscriptionId());
            engine.clock.advance(Duration.ofMinutes(5));

            assertEquals(0, engine.callbackQueue.drain());
            assertEquals(1, engine.callbacks.attempts());
            assertEquals(0, engine.callbackQueue.size());
        }

        @Test
        void deadLettersKeepOnlyTheNewest() {
            TruthFeedProperties properties = new TruthFeedProperties(null,
                new TruthFeedProperties.Delivery(1, null, null, null, 2), null, null, null, null);
            CallbackDeliveryQueue queue = new CallbackDeliveryQueue(engine.callbacks, engine.clock, properties);
            List<FeedEvent> events = List.of(complianceEvent("org-1", "A"), complianceEvent("org-1", "B"),
                complianceEvent("org-1", "C"));
            engine.callbacks.failNext(100);
            events.forEach(event -> queue.enqueue(subscription, event));

            assertEquals(0, queue.drain());

            assertEquals(0, queue.size());
            assertEquals(List.of(events.get(1).eventId(), events.get(2).eventId()),
                queue.deadLetters().stream().map(CallbackDeliveryQueue.FailedDelivery::eventId).toList());
        }

        @Test
        void exhaustedRetriesGoToDeadLetters() {
            engine.callbacks.failNext(100);
            FeedEvent event = complianceEvent("org-1", "GDPR");

            for (int i = 0; i < engine.properties.delivery().maxAttempts(); i++) {
                engine.callbackQueue.drain();
                engine.clock.advance(Duration.ofHours(1));
            }

            assertEquals(0, engine.callbackQueue.size());
            List<CallbackDeliveryQueue.FailedDelivery> dead = engine.callbackQueue.deadLetters();
            assertEquals(1, dead.size());
            assertEquals(event.eventId(), dead.get(0).eventId());
            assertEquals(engine.properties.delivery().maxAttempts(), dead.get(0).attempts());
        }
    }

    @Nested
    @DisplayName("Streams")
    class Streams {

        @Test
        void withoutConnectionEventsAreDropped() {
            Subscription subscription = engine.subscriptions.subscribe("acme", List.of(COMPLIANCE), List.of(),
                DeliveryMode.STREAM, null);
            FeedEvent event = complianceEvent("org-1", "GDPR");

            assertEquals(Map.of(subscription.getSubscriptionId(), DeliveryOutcome.DROPPED),
                engine.subscriptions.matchAndDeliver(event));
            assertEquals(0, subscription.getDeliveredCount());
        }

        @Test
        void brokenConnectionIsDetached() {
            Subscription subscription = engine.subscriptions.subscribe("acme", List.of(COMPLIANCE), List.of(),
                DeliveryMode.STREAM, null);
            engine.subscriptions.attachStream(subscription.getSubscriptionId(), event -> {
                throw new IOException("connection reset");
            });

            complianceEvent("org-1", "GDPR");

            assertFalse(engine.streams.isAttached(subscription.getSubscriptionId()));
        }

        @Test
        void attachToPollSubscriptionIsRejected() {
            Subscription subscription = engine.subscriptions.subscribe("acme", List.of(COMPLIANCE), List.of(),
                DeliveryMode.POLL, null);
            assertThrows(IllegalArgumentException.class,
                () -> engine.subscriptions.attachStream(subscription.getSubscriptionId(), event -> { }));
        }
    }

    @Nested
    @DisplayName("Rejected subscriptions")
    class Validation {

        @Test
        void callbackWithoutEndpoint() {
            assertThrows(IllegalArgumentException.class, () -> engine.subscriptions.subscribe("acme",
                List.of(COMPLIANCE), List.of(), DeliveryMode.CALLBACK, null));
            assertThrows(IllegalArgumentException.class, () -> engine.subscriptions.subscribe("acme",
                List.of(COMPLIANCE), List.of(), DeliveryMode.CALLBACK, "ftp://example.com/x"));
        }

        @Test
        void malformedFilterRegistersNothing() {
            assertThrows(FilterEvaluationException.class, () -> engine.subscriptions.subscribe("acme",
                List.of(COMPLIANCE), List.of(FeedFilter.of(FilterType.EVENT_TYPE, FilterOperator.REGEX, "[")),
                DeliveryMode.POLL, null));
            assertEquals(0, engine.registry.lookupFeed(COMPLIANCE).getSubscriberCount());
        }

        @Test
        void unknownSubscriptionOrEmptyFeedSet() {
            assertThrows(SubscriptionNotFoundException.class, () -> engine.subscriptions.get("sub_missing"));
            assertThrows(IllegalArgumentException.class, () -> engine.subscriptions.subscribe("acme",
                List.of(), List.of(), DeliveryMode.POLL, null));
        }

        @Test
        void pollOnCallbackSubscription() {
            Subscription subscription = engine.subscriptions.subscribe("acme", List.of(COMPLIANCE), List.of(),
                DeliveryMode.CALLBACK, ENDPOINT);
            assertThrows(IllegalArgumentException.class,
                () -> engine.subscriptions.poll(subscription.getSubscriptionId(), 10));
        }
    }
}
