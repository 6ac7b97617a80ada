package com.truthfeed.analytics;

import com.truthfeed.anchor.AnchoringService;
import com.truthfeed.anchor.AnchoringUnavailableException;
import com.truthfeed.bus.EventStore;
import com.truthfeed.bus.FeedCheckpoint;
import com.truthfeed.bus.FeedEvent;
import com.truthfeed.bus.PendingAnchorRetrier;
import com.truthfeed.chain.HashChain;
import com.truthfeed.feed.Feed;
import com.truthfeed.feed.FeedRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Moves events past their feed's retention window to cold storage.
 *
 * The checkpoint carrying the last archived sequence number and proof is
 * saved under the feed lock together with the removal, so the oldest
 * remaining event and the next append always have a resolvable predecessor.
 * A checkpoint that cannot be anchored keeps the feed pending until the
 * retrier anchors it.
 */
@Service
public class ArchivalService {

    private static final Logger log = LoggerFactory.getLogger(ArchivalService.class);

    private final FeedRegistry feedRegistry;
    private final EventStore eventStore;
    private final ColdStorage coldStorage;
    private final AnchoringService anchoringService;
    private final PendingAnchorRetrier anchorRetrier;
    private final Clock clock;

    public ArchivalService(FeedRegistry feedRegistry,
                           EventStore eventStore,
                           ColdStorage coldStorage,
                           AnchoringService anchoringService,
                           PendingAnchorRetrier anchorRetrier,
                           Clock clock) {
        this.feedRegistry = feedRegistry;
        this.eventStore = eventStore;
        this.coldStorage = coldStorage;
        this.anchoringService = anchoringService;
        this.anchorRetrier = anchorRetrier;
        this.clock = clock;
    }

    @Scheduled(fixedDelayString = "${truth-feed.archival.interval:PT1H}",
        initialDelayString = "${truth-feed.archival.interval:PT1H}")
    public void archiveScheduled() {
        ArchiveReport report = archive();
        if (report.eventsArchived() > 0) {
            log.info("Archival moved {} events from {} feeds", report.eventsArchived(), report.checkpoints().size());
        }
    }

    public synchronized ArchiveReport archive() {
        Instant now = clock.instant();
        int archived = 0;
        List<FeedCheckpoint> checkpoints = new ArrayList<>();
        List<String> dormant = new ArrayList<>();
        for (Feed feed : feedRegistry.allFeeds()) {
            Instant cutoff = now.minus(Duration.ofDays(feed.getRetentionDays()));
            List<FeedEvent> removed = new ArrayList<>();
            FeedCheckpoint checkpoint = archiveFeed(feed, cutoff, now, removed);
            if (checkpoint == null) {
                continue;
            }
            coldStorage.store(feed.getFeedId(), removed);
            checkpoint = anchorCheckpoint(feed, checkpoint);
            archived += removed.size();
            checkpoints.add(checkpoint);
            if (feed.isDormant()) {
                dormant.add(feed.getFeedId());
            }
            log.info("Archived {} events of feed={} through seq={}, checkpoint={}",
                removed.size(), feed.getFeedId(), checkpoint.sequenceNumber(), checkpoint.checkpointHash());
        }
        return new ArchiveReport(archived, checkpoints, dormant);
    }

    private FeedCheckpoint archiveFeed(Feed feed, Instant cutoff, Instant now, List<FeedEvent> removed) {
        feed.appendLock().lock();
        try {
            FeedEvent lastExpired = null;
            for (FeedEvent event : eventStore.snapshot(feed.getFeedId())) {
                if (!event.timestamp().isBefore(cutoff)) {
                    break;
                }
                lastExpired = event;
            }
            if (lastExpired == null) {
                return null;
            }

            int previouslyArchived = eventStore.latestCheckpoint(feed.getFeedId())
                .map(FeedCheckpoint::archivedCount).orElse(0);
            removed.addAll(eventStore.removeThrough(feed.getFeedId(), lastExpired.sequenceNumber()));
            int archivedCount = previouslyArchived + removed.size();

            Map<String, Object> body = new LinkedHashMap<>();
            body.put("feed_id", feed.getFeedId());
            body.put("sequence_number", lastExpired.sequenceNumber());
            body.put("integrity_proof", lastExpired.integrityProof());
            body.put("archived_count", archivedCount);
            FeedCheckpoint checkpoint = new FeedCheckpoint(feed.getFeedId(), lastExpired.sequenceNumber(),
                lastExpired.integrityProof(), archivedCount, HashChain.linkHash(body), null, now);
            eventStore.saveCheckpoint(checkpoint);

            if (eventStore.lastEvent(feed.getFeedId()).isEmpty()) {
                feed.markDormant();
            }
            return checkpoint;
        } finally {
            feed.appendLock().unlock();
        }
    }

    private FeedCheckpoint anchorCheckpoint(Feed feed, FeedCheckpoint checkpoint) {
        try {
            FeedCheckpoint anchored = checkpoint.withAnchor(anchoringService.anchor(checkpoint.checkpointHash()));
            eventStore.saveCheckpoint(anchored);
            return anchored;
        } catch (AnchoringUnavailableException ex) {
            log.warn("Anchoring unavailable for checkpoint of feed={} seq={}, queued for retry: {}",
                checkpoint.feedId(), checkpoint.sequenceNumber(), ex.getMessage());
        }
        FeedCheckpoint pending = checkpoint.withAnchor(FeedEvent.PENDING_ANCHOR);
        eventStore.saveCheckpoint(pending);
        feed.anchorPending();
        anchorRetrier.enqueueCheckpoint(pending);
        return pending;
    }
}
