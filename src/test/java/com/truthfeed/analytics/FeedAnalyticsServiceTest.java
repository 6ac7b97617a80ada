package com.truthfeed.analytics;

import com.truthfeed.TestEngine;
import com.truthfeed.feed.FeedNotFoundException;
import com.truthfeed.feed.FeedRef;
import com.truthfeed.feed.FeedType;
import com.truthfeed.feed.VerificationStatus;
import com.truthfeed.subscription.DeliveryMode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class FeedAnalyticsServiceTest {

    private static final FeedRef REGULATORY = FeedRef.global(FeedType.REGULATORY_UPDATES);

    private TestEngine engine;

    @BeforeEach
    void setUp() {
        engine = new TestEngine();
    }

    @Test
    void analytics_summarizesActiveEvents() {
        engine.subscriptions.subscribe("acme", List.of(REGULATORY), List.of(), DeliveryMode.POLL, null);
        engine.events.appendEvent(REGULATORY, "regulation_published", Map.of("framework", "GDPR"), 0.8);
        engine.anchoring.setAvailable(false);
        engine.clock.advance(Duration.ofMinutes(1));
        engine.events.appendEvent(REGULATORY, "guidance_issued", Map.of("framework", "DORA"), 0.6);

        FeedStats stats = engine.analytics.getAnalytics(REGULATORY, null, null);

        assertEquals("feed_regulatory_updates_global", stats.feedId());
        assertEquals(2, stats.totalEvents());
        assertEquals(Map.of("guidance_issued", 1L, "regulation_published", 1L), stats.eventsByType());
        assertEquals(0.7, stats.averageConfidence(), 1e-12);
        assertEquals(1.0, stats.verificationRate());
        assertEquals(0.5, stats.anchoredRate());
        assertEquals(1.0, stats.dataIntegrityScore());
        assertEquals(1, stats.subscriberCount());
        assertEquals(0, stats.archivedEvents());
        assertEquals(VerificationStatus.PENDING, stats.verificationStatus());
    }

    @Test
    void analytics_honoursTimeWindow() {
        engine.events.appendEvent(REGULATORY, "regulation_published", Map.of(), 0.9);
        engine.clock.advance(Duration.ofDays(2));
        Instant from = engine.clock.instant();
        engine.events.appendEvent(REGULATORY, "guidance_issued", Map.of(), 0.5);

        FeedStats stats = engine.analytics.getAnalytics(REGULATORY, from, null);

        assertEquals(1, stats.totalEvents());
        assertEquals(0.5, stats.averageConfidence());
        assertEquals(from, stats.from());
    }

    @Test
    void analytics_emptyWindowHasZeroRates() {
        FeedStats stats = engine.analytics.getAnalytics(REGULATORY, null, null);

        assertEquals(0, stats.totalEvents());
        assertEquals(0.0, stats.averageConfidence());
        assertEquals(0.0, stats.dataIntegrityScore());
    }

    @Test
    void analytics_rejectsInvertedWindow() {
        Instant now = engine.clock.instant();
        assertThrows(IllegalArgumentException.class,
            () -> engine.analytics.getAnalytics(REGULATORY, now, now.minusSeconds(1)));
    }

    @Test
    void analytics_unknownFeed() {
        assertThrows(FeedNotFoundException.class,
            () -> engine.analytics.getAnalytics(FeedRef.of(FeedType.REGULATORY_UPDATES, "nobody"), null, null));
    }
}
