package com.truthfeed.bus;

import com.truthfeed.anchor.AnchoringService;
import com.truthfeed.anchor.AnchoringUnavailableException;
import com.truthfeed.config.TruthFeedProperties;
import com.truthfeed.feed.FeedRegistry;
import com.truthfeed.integrity.IntegrityChainService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Re-anchors events and archival checkpoints that were written while the
 * anchoring service was unavailable. Attempts back off exponentially per
 * item and never give up.
 */
@Component
public class PendingAnchorRetrier {

    private static final Logger log = LoggerFactory.getLogger(PendingAnchorRetrier.class);

    private final AnchoringService anchoringService;
    private final EventStore eventStore;
    private final FeedRegistry feedRegistry;
    private final IntegrityChainService integrityChainService;
    private final KeyedSerialExecutor integrityDispatcher;
    private final Clock clock;
    private final Duration initialBackoff;
    private final Duration maxBackoff;
    private final ConcurrentHashMap<String, PendingAnchor> pending = new ConcurrentHashMap<>();

    public PendingAnchorRetrier(AnchoringService anchoringService,
                                EventStore eventStore,
                                FeedRegistry feedRegistry,
                                IntegrityChainService integrityChainService,
                                @Qualifier("integrityDispatcher") KeyedSerialExecutor integrityDispatcher,
                                Clock clock,
                                TruthFeedProperties properties) {
        this.anchoringService = anchoringService;
        this.eventStore = eventStore;
        this.feedRegistry = feedRegistry;
        this.integrityChainService = integrityChainService;
        this.integrityDispatcher = integrityDispatcher;
        this.clock = clock;
        this.initialBackoff = properties.anchoring().retryInitialBackoff();
        this.maxBackoff = properties.anchoring().retryMaxBackoff();
    }

    void enqueue(FeedEvent event) {
        pending.put(event.eventId(), new PendingAnchor(event.eventId(), event.eventId(), null, event.feedId(),
            event.subjectId(), event.integrityProof(), 0, clock.instant().plus(initialBackoff)));
    }

    /**
     * Queues a checkpoint whose anchoring failed. The caller has already
     * counted it as pending on the feed.
     */
    public void enqueueCheckpoint(FeedCheckpoint checkpoint) {
        String key = "checkpoint:" + checkpoint.feedId() + ":" + checkpoint.sequenceNumber();
        pending.put(key, new PendingAnchor(key, null, checkpoint.checkpointHash(), checkpoint.feedId(), null,
            checkpoint.checkpointHash(), 0, clock.instant().plus(initialBackoff)));
    }

    public int pendingCount() {
        return pending.size();
    }

    @Scheduled(fixedDelayString = "${truth-feed.anchoring.retry-interval:PT30S}",
        initialDelayString = "${truth-feed.anchoring.retry-interval:PT30S}")
    public void retryScheduled() {
        retryDue();
    }

    /**
     * Attempts every pending anchor whose backoff has elapsed.
     *
     * @return number of events and checkpoints anchored in this pass
     */
    public int retryDue() {
        Instant now = clock.instant();
        List<PendingAnchor> due = new ArrayList<>();
        for (PendingAnchor candidate : pending.values()) {
            if (!candidate.nextAttemptAt().isAfter(now)) {
                due.add(candidate);
            }
        }
        int anchored = 0;
        for (PendingAnchor candidate : due) {
            String reference;
            try {
                reference = anchoringService.anchor(candidate.hash());
            } catch (AnchoringUnavailableException ex) {
                PendingAnchor next = candidate.retryAfter(backoff(candidate.attempts() + 1), now);
                pending.put(candidate.key(), next);
                log.warn("Anchor retry {} failed for {}, next attempt at {}: {}",
                    next.attempts(), candidate.key(), next.nextAttemptAt(), ex.getMessage());
                continue;
            }
            resolve(candidate, reference);
            anchored++;
        }
        return anchored;
    }

    private void resolve(PendingAnchor candidate, String reference) {
        pending.remove(candidate.key());
        feedRegistry.findById(candidate.feedId()).ifPresent(feed -> feed.anchorResolved());
        if (candidate.checkpointHash() != null) {
            boolean latest = eventStore.updateCheckpointAnchor(candidate.feedId(), candidate.checkpointHash(),
                reference);
            log.info("Anchored pending {} as {}{}", candidate.key(), reference,
                latest ? "" : " (already superseded by a later checkpoint)");
            return;
        }
        eventStore.updateAnchor(candidate.eventId(), reference);
        if (candidate.subjectId() != null) {
            integrityDispatcher.submit(candidate.subjectId(),
                () -> integrityChainService.confirmAnchor(candidate.subjectId(), candidate.eventId(), reference));
        }
        log.info("Anchored pending event={} as {}", candidate.eventId(), reference);
    }

    private Duration backoff(int attempts) {
        Duration delay = initialBackoff;
        for (int i = 1; i < attempts && delay.compareTo(maxBackoff) < 0; i++) {
            delay = delay.multipliedBy(2);
        }
        return delay.compareTo(maxBackoff) > 0 ? maxBackoff : delay;
    }

    /** Either {@code eventId} or {@code checkpointHash} is set. */
    private record PendingAnchor(String key, String eventId, String checkpointHash, String feedId,
                                 String subjectId, String hash, int attempts, Instant nextAttemptAt) {

        PendingAnchor retryAfter(Duration delay, Instant now) {
            return new PendingAnchor(key, eventId, checkpointHash, feedId, subjectId, hash, attempts + 1,
                now.plus(delay));
        }
    }
}
