package com.truthfeed.bus;

import com.truthfeed.anchor.AnchoringService;
import com.truthfeed.anchor.AnchoringUnavailableException;
import com.truthfeed.chain.CanonicalJson;
import com.truthfeed.chain.HashChain;
import com.truthfeed.feed.Feed;
import com.truthfeed.feed.FeedRef;
import com.truthfeed.feed.FeedRegistry;
import com.truthfeed.integrity.IntegrityChainService;
import com.truthfeed.subscription.SubscriptionService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Appends events to feeds.
 *
 * Predecessor lookup, hashing, anchoring and the store append run under the
 * feed's lock. Integrity updates and subscription matching are queued on the
 * dispatchers before the lock is released, so each subject and each feed sees
 * events in sequence order. Their failures never undo an append.
 */
@Service
public class FeedEventService {

    private static final Logger log = LoggerFactory.getLogger(FeedEventService.class);

    static final String ORGANIZATION_KEY = "organization_id";

    private final FeedRegistry feedRegistry;
    private final EventStore eventStore;
    private final AnchoringService anchoringService;
    private final PendingAnchorRetrier anchorRetrier;
    private final FeedVerifier feedVerifier;
    private final IntegrityChainService integrityChainService;
    private final SubscriptionService subscriptionService;
    private final KeyedSerialExecutor integrityDispatcher;
    private final KeyedSerialExecutor deliveryDispatcher;
    private final Clock clock;

    public FeedEventService(FeedRegistry feedRegistry,
                            EventStore eventStore,
                            AnchoringService anchoringService,
                            PendingAnchorRetrier anchorRetrier,
                            FeedVerifier feedVerifier,
                            IntegrityChainService integrityChainService,
                            SubscriptionService subscriptionService,
                            @Qualifier("integrityDispatcher") KeyedSerialExecutor integrityDispatcher,
                            @Qualifier("deliveryDispatcher") KeyedSerialExecutor deliveryDispatcher,
                            Clock clock) {
        this.feedRegistry = feedRegistry;
        this.eventStore = eventStore;
        this.anchoringService = anchoringService;
        this.anchorRetrier = anchorRetrier;
        this.feedVerifier = feedVerifier;
        this.integrityChainService = integrityChainService;
        this.subscriptionService = subscriptionService;
        this.integrityDispatcher = integrityDispatcher;
        this.deliveryDispatcher = deliveryDispatcher;
        this.clock = clock;
    }

    /**
     * Appends one event and returns it with its sequence number, hashes and
     * anchor reference ({@code "pending"} if anchoring was unavailable).
     *
     * @throws IllegalArgumentException for a blank event type, a missing
     *         payload or a confidence outside [0, 1]
     * @throws com.truthfeed.feed.FeedNotFoundException if the global feed of
     *         the type is not registered
     * @throws com.truthfeed.chain.NonCanonicalPayloadException if the payload
     *         cannot be hashed deterministically
     */
    public FeedEvent appendEvent(FeedRef ref, String eventType, Map<String, Object> payload, double confidence) {
        if (eventType == null || eventType.isBlank()) {
            throw new IllegalArgumentException("event_type is required");
        }
        if (payload == null) {
            throw new IllegalArgumentException("payload must be a JSON object");
        }
        if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence must be within [0, 1], got " + confidence);
        }

        Feed feed = feedRegistry.resolveForAppend(ref);
        String subjectId = ref.isGlobal() ? organizationOf(payload) : ref.subjectId();
        Map<String, Object> frozenPayload = CanonicalJson.immutableCopy(payload);

        FeedEvent event;
        feed.appendLock().lock();
        try {
            String previousHash;
            long sequence;
            FeedEvent last = eventStore.lastEvent(feed.getFeedId()).orElse(null);
            if (last != null) {
                previousHash = last.integrityProof();
                sequence = last.sequenceNumber() + 1;
            } else {
                FeedCheckpoint checkpoint = eventStore.latestCheckpoint(feed.getFeedId()).orElse(null);
                previousHash = checkpoint != null ? checkpoint.integrityProof() : HashChain.GENESIS;
                sequence = checkpoint != null ? checkpoint.sequenceNumber() + 1 : 1L;
            }

            Instant now = clock.instant();
            String eventId = UUID.randomUUID().toString();
            String payloadHash = HashChain.linkHash(FeedEvent.hashedBody(eventId, feed.getFeedId(), sequence,
                eventType, subjectId, frozenPayload, confidence, now));
            String proof = HashChain.chainHash(payloadHash, previousHash);

            String anchorReference;
            AnchorStatus anchorStatus;
            try {
                anchorReference = anchoringService.anchor(proof);
                anchorStatus = AnchorStatus.ANCHORED;
            } catch (AnchoringUnavailableException ex) {
                log.warn("Anchoring unavailable for feed={} seq={}, appending with pending anchor: {}",
                    feed.getFeedId(), sequence, ex.getMessage());
                anchorReference = FeedEvent.PENDING_ANCHOR;
                anchorStatus = AnchorStatus.PENDING;
            }

            event = new FeedEvent(eventId, feed.getFeedId(), ref.feedType(), subjectId, eventType,
                frozenPayload, confidence, now, sequence, previousHash, payloadHash, proof,
                anchorReference, anchorStatus);
            eventStore.append(event);
            feed.markUpdated(now);
            if (!event.isAnchored()) {
                feed.anchorPending();
                anchorRetrier.enqueue(event);
            }
            log.info("Appended event={} type={} to feed={} seq={}",
                event.eventId(), eventType, event.feedId(), event.sequenceNumber());
            dispatch(event);
        } finally {
            feed.appendLock().unlock();
        }
        return event;
    }

    public List<FeedEvent> events(FeedRef ref, long sinceSequence, int limit) {
        Feed feed = feedRegistry.lookupFeed(ref);
        return eventStore.events(feed.getFeedId(), sinceSequence, limit);
    }

    public FeedVerification verifyFeed(FeedRef ref) {
        return feedVerifier.verify(feedRegistry.lookupFeed(ref));
    }

    private void dispatch(FeedEvent event) {
        if (event.subjectId() != null) {
            integrityDispatcher.submit(event.subjectId(),
                () -> integrityChainService.updateIntegrity(event.subjectId(), event));
        } else {
            log.debug("Event={} has no subject, skipping integrity chain", event.eventId());
        }
        deliveryDispatcher.submit(event.feedId(), () -> subscriptionService.matchAndDeliver(event));
    }

    private static String organizationOf(Map<String, Object> payload) {
        Object organization = payload.get(ORGANIZATION_KEY);
        return organization instanceof String id && !id.isBlank() ? id : null;
    }
}
