package com.truthfeed.bus;

import com.truthfeed.chain.HashChain;
import com.truthfeed.feed.Feed;
import com.truthfeed.feed.VerificationStatus;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Recomputes payload hashes and proofs to check a feed's hash chain.
 */
@Component
public class FeedVerifier {

    private final EventStore eventStore;

    public FeedVerifier(EventStore eventStore) {
        this.eventStore = eventStore;
    }

    public FeedVerification verify(Feed feed) {
        Optional<FeedCheckpoint> checkpoint = eventStore.latestCheckpoint(feed.getFeedId());
        String expectedPrevious = checkpoint.map(FeedCheckpoint::integrityProof).orElse(HashChain.GENESIS);
        long expectedSequence = checkpoint.map(c -> c.sequenceNumber() + 1).orElse(1L);
        Long checkpointSequence = checkpoint.map(FeedCheckpoint::sequenceNumber).orElse(null);

        List<FeedEvent> events = eventStore.snapshot(feed.getFeedId());
        int checked = 0;
        for (FeedEvent event : events) {
            checked++;
            String failure = null;
            if (event.sequenceNumber() != expectedSequence) {
                failure = "expected sequence_number " + expectedSequence;
            } else if (!expectedPrevious.equals(event.previousEventHash())) {
                failure = "previous_event_hash does not match predecessor";
            } else if (!verifiesInternally(event)) {
                failure = "integrity_proof does not match event content";
            }
            if (failure != null) {
                feed.markDisputed();
                return new FeedVerification(feed.getFeedId(), false, checked, event.sequenceNumber(),
                    failure, checkpointSequence, VerificationStatus.DISPUTED);
            }
            expectedPrevious = event.integrityProof();
            expectedSequence++;
        }
        return new FeedVerification(feed.getFeedId(), true, checked, null, null,
            checkpointSequence, feed.getVerificationStatus());
    }

    /**
     * Whether the event's own hashes match its content and stated predecessor.
     */
    public static boolean verifiesInternally(FeedEvent event) {
        if (event.integrityProof() == null || event.integrityProof().isEmpty()) {
            return false;
        }
        String payloadHash = HashChain.linkHash(event.hashedBody());
        return payloadHash.equals(event.payloadHash())
            && HashChain.chainHash(payloadHash, event.previousEventHash()).equals(event.integrityProof());
    }
}
