package com.truthfeed.analytics;

import com.truthfeed.bus.EventStore;
import com.truthfeed.bus.FeedCheckpoint;
import com.truthfeed.bus.FeedEvent;
import com.truthfeed.bus.FeedVerifier;
import com.truthfeed.chain.HashChain;
import com.truthfeed.feed.Feed;
import com.truthfeed.feed.FeedRef;
import com.truthfeed.feed.FeedRegistry;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

@Service
public class FeedAnalyticsService {

    private final FeedRegistry feedRegistry;
    private final EventStore eventStore;
    private final Clock clock;

    public FeedAnalyticsService(FeedRegistry feedRegistry, EventStore eventStore, Clock clock) {
        this.feedRegistry = feedRegistry;
        this.eventStore = eventStore;
        this.clock = clock;
    }

    /**
     * @param from inclusive lower bound, or null for no bound
     * @param to   inclusive upper bound, or null for now
     */
    public FeedStats getAnalytics(FeedRef ref, Instant from, Instant to) {
        Feed feed = feedRegistry.lookupFeed(ref);
        Instant upper = to != null ? to : clock.instant();
        if (from != null && from.isAfter(upper)) {
            throw new IllegalArgumentException("from must not be after to");
        }

        Optional<FeedCheckpoint> checkpoint = eventStore.latestCheckpoint(feed.getFeedId());
        String expectedPrevious = checkpoint.map(FeedCheckpoint::integrityProof).orElse(HashChain.GENESIS);
        List<FeedEvent> events = eventStore.snapshot(feed.getFeedId());

        int total = 0;
        int withProof = 0;
        int anchored = 0;
        int linked = 0;
        double confidenceSum = 0.0;
        Map<String, Long> byType = new TreeMap<>();
        for (FeedEvent event : events) {
            boolean linkHolds = expectedPrevious.equals(event.previousEventHash())
                && FeedVerifier.verifiesInternally(event);
            expectedPrevious = event.integrityProof();
            if ((from != null && event.timestamp().isBefore(from)) || event.timestamp().isAfter(upper)) {
                continue;
            }
            total++;
            confidenceSum += event.confidenceScore();
            byType.merge(event.eventType(), 1L, Long::sum);
            if (event.integrityProof() != null && !event.integrityProof().isEmpty()) {
                withProof++;
            }
            if (event.isAnchored()) {
                anchored++;
            }
            if (linkHolds) {
                linked++;
            }
        }

        return new FeedStats(
            feed.getFeedId(),
            from,
            upper,
            total,
            byType,
            ratio(confidenceSum, total),
            ratio(withProof, total),
            ratio(anchored, total),
            ratio(linked, total),
            feed.getSubscriberCount(),
            checkpoint.map(FeedCheckpoint::archivedCount).orElse(0),
            feed.getVerificationStatus()
        );
    }

    private static double ratio(double numerator, int denominator) {
        return denominator == 0 ? 0.0 : numerator / denominator;
    }
}
