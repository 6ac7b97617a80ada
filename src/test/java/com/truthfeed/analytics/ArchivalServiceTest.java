package com.truthfeed.analytics;

import com.truthfeed.TestEngine;
import com.truthfeed.bus.FeedCheckpoint;
import com.truthfeed.bus.FeedEvent;
import com.truthfeed.bus.FeedVerification;
import com.truthfeed.feed.Feed;
import com.truthfeed.feed.FeedRef;
import com.truthfeed.feed.FeedType;
import com.truthfeed.feed.UpdateFrequency;
import com.truthfeed.feed.VerificationStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ArchivalServiceTest {

    private static final FeedRef AUDIT = FeedRef.of(FeedType.AUDIT_ACTIVITIES, "org-30");

    private TestEngine engine;
    private Feed feed;

    @BeforeEach
    void setUp() {
        engine = new TestEngine();
        feed = engine.registry.registerFeed(FeedType.AUDIT_ACTIVITIES, "org-30", UpdateFrequency.REAL_TIME, 30);
    }

    private FeedEvent audit(String activity) {
        return engine.events.appendEvent(AUDIT, "audit_activity", Map.of("activity", activity), 0.8);
    }

    @Test
    @DisplayName("Expired events move to cold storage behind a checkpoint the chain still verifies against")
    void expiredEvents_areCheckpointed() {
        audit("login-review");
        audit("access-review");
        FeedEvent lastExpired = audit("policy-review");
        engine.clock.advance(Duration.ofDays(20));
        FeedEvent retained = audit("vendor-review");
        engine.clock.advance(Duration.ofDays(11));

        ArchiveReport report = engine.archival.archive();

        assertEquals(3, report.eventsArchived());
        FeedCheckpoint checkpoint = report.checkpoints().get(0);
        assertEquals(feed.getFeedId(), checkpoint.feedId());
        assertEquals(3, checkpoint.sequenceNumber());
        assertEquals(lastExpired.integrityProof(), checkpoint.integrityProof());
        assertEquals(3, checkpoint.archivedCount());
        assertNotNull(checkpoint.anchorReference());
        assertNotEquals(FeedEvent.PENDING_ANCHOR, checkpoint.anchorReference());
        assertEquals(3, engine.coldStorage.archived(feed.getFeedId()).size());
        assertFalse(feed.isDormant());

        assertEquals(List.of(retained), engine.events.events(AUDIT, 0, 10));
        FeedVerification verification = engine.events.verifyFeed(AUDIT);
        assertTrue(verification.valid());
        assertEquals(1, verification.eventsChecked());
        assertEquals(3L, verification.checkpointSequence());

        FeedEvent next = audit("incident-review");
        assertEquals(5, next.sequenceNumber());
        assertEquals(retained.integrityProof(), next.previousEventHash());
    }

    @Test
    void fullyArchivedFeed_isDormantAndResumesFromCheckpoint() {
        audit("login-review");
        FeedEvent last = audit("access-review");
        engine.clock.advance(Duration.ofDays(31));

        ArchiveReport report = engine.archival.archive();

        assertEquals(List.of(feed.getFeedId()), report.dormantFeeds());
        assertTrue(feed.isDormant());
        assertTrue(engine.events.events(AUDIT, 0, 10).isEmpty());
        assertTrue(engine.events.verifyFeed(AUDIT).valid());

        FeedEvent resumed = audit("policy-review");
        assertEquals(3, resumed.sequenceNumber());
        assertEquals(last.integrityProof(), resumed.previousEventHash());
        assertFalse(feed.isDormant());
        assertTrue(engine.events.verifyFeed(AUDIT).valid());
    }

    @Test
    void secondArchivalAccumulatesArchivedCount() {
        audit("a");
        engine.clock.advance(Duration.ofDays(31));
        engine.archival.archive();
        audit("b");
        audit("c");
        engine.clock.advance(Duration.ofDays(31));

        ArchiveReport report = engine.archival.archive();

        assertEquals(2, report.eventsArchived());
        assertEquals(3, report.checkpoints().get(0).archivedCount());
        assertEquals(3, engine.coldStorage.archived(feed.getFeedId()).size());
    }

    @Test
    void checkpointAnchorFallsBackToPending() {
        audit("a");
        engine.clock.advance(Duration.ofDays(31));
        engine.anchoring.setAvailable(false);

        ArchiveReport report = engine.archival.archive();

        assertEquals(FeedEvent.PENDING_ANCHOR, report.checkpoints().get(0).anchorReference());
        assertTrue(engine.events.verifyFeed(AUDIT).valid());
        assertEquals(VerificationStatus.PENDING, feed.getVerificationStatus());
    }

    @Test
    @DisplayName("A checkpoint archived while anchoring is down is anchored by the retrier")
    void pendingCheckpointAnchor_isRetried() {
        audit("a");
        engine.clock.advance(Duration.ofDays(31));
        engine.anchoring.setAvailable(false);
        FeedCheckpoint pending = engine.archival.archive().checkpoints().get(0);
        assertEquals(1, engine.anchorRetrier.pendingCount());

        engine.clock.advance(Duration.ofSeconds(5));
        assertEquals(0, engine.anchorRetrier.retryDue());
        assertEquals(VerificationStatus.PENDING, feed.getVerificationStatus());

        engine.anchoring.setAvailable(true);
        engine.clock.advance(Duration.ofHours(1));
        assertEquals(1, engine.anchorRetrier.retryDue());

        FeedCheckpoint stored = engine.store.latestCheckpoint(feed.getFeedId()).orElseThrow();
        assertNotEquals(FeedEvent.PENDING_ANCHOR, stored.anchorReference());
        assertEquals(pending.checkpointHash(),
            engine.anchoring.ledger().committedHash(stored.anchorReference()).orElseThrow());
        assertEquals(0, engine.anchorRetrier.pendingCount());
        assertEquals(VerificationStatus.VERIFIED, feed.getVerificationStatus());
    }

    @Test
    void nothingExpired_isNoOp() {
        audit("a");
        engine.clock.advance(Duration.ofDays(29));

        ArchiveReport report = engine.archival.archive();

        assertEquals(0, report.eventsArchived());
        assertTrue(report.checkpoints().isEmpty());
        assertTrue(engine.store.latestCheckpoint(feed.getFeedId()).isEmpty());
    }
}
