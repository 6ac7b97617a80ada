package com.truthfeed.integrity;

import com.truthfeed.bus.FeedEvent;
import com.truthfeed.chain.HashChain;
import com.truthfeed.feed.VerificationStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Maintains one {@link TemporalIntegrityChain} per subject. Callers serialize
 * updates per subject; the chain's own monitor guards concurrent readers.
 */
@Service
public class IntegrityChainService {

    private static final Logger log = LoggerFactory.getLogger(IntegrityChainService.class);

    private final ConcurrentHashMap<String, TemporalIntegrityChain> chains = new ConcurrentHashMap<>();
    private final Clock clock;

    public IntegrityChainService(Clock clock) {
        this.clock = clock;
    }

    /**
     * Appends an entry for {@code event} and recomputes the Merkle root and
     * integrity score.
     *
     * @throws ChainCorruptionException if the chain is already disputed or its
     *         tail no longer verifies; nothing is appended in that case
     */
    public IntegrityUpdateResult updateIntegrity(String subjectId, FeedEvent event) {
        if (subjectId == null || subjectId.isBlank()) {
            throw new IllegalArgumentException("subject_id is required for integrity updates");
        }
        Instant now = clock.instant();
        TemporalIntegrityChain chain = chains.computeIfAbsent(subjectId, id -> new TemporalIntegrityChain(id, now));
        synchronized (chain) {
            if (chain.isDisputed()) {
                throw new ChainCorruptionException(subjectId, "chain is disputed and awaits reconciliation");
            }
            Integer broken = chain.firstBrokenLink(chain.size() - 1);
            if (broken != null) {
                chain.markDisputed();
                log.warn("Integrity chain for subject={} broken at entry {}, marked disputed", subjectId, broken);
                throw new ChainCorruptionException(subjectId, "previous entry " + broken + " does not verify");
            }

            String previousHash = chain.headHash();
            ChainEntry entry = new ChainEntry(
                "entry_" + UUID.randomUUID(),
                event.eventId(),
                event.feedId(),
                event.eventType(),
                event.integrityProof(),
                previousHash,
                HashChain.chainHash(event.integrityProof(), previousHash),
                event.isAnchored() ? event.anchorReference() : null,
                event.isAnchored() ? EntryStatus.CONFIRMED : EntryStatus.PENDING,
                now
            );
            chain.append(entry, now);
            log.debug("Integrity chain for subject={} now has {} entries, root={}",
                subjectId, chain.size(), chain.getMerkleRoot());
            return new IntegrityUpdateResult(subjectId, entry, chain.getMerkleRoot(),
                chain.getIntegrityScore(), chain.size());
        }
    }

    /**
     * Marks the entry for {@code eventId} confirmed once its anchor exists.
     */
    public void confirmAnchor(String subjectId, String eventId, String anchorReference) {
        TemporalIntegrityChain chain = chains.get(subjectId);
        if (chain == null) {
            return;
        }
        if (!chain.confirm(eventId, anchorReference, clock.instant())) {
            log.debug("No integrity entry yet for event={} on subject={}", eventId, subjectId);
        }
    }

    public Optional<TemporalIntegrityChain> findChain(String subjectId) {
        return Optional.ofNullable(chains.get(subjectId));
    }

    public TemporalIntegrityChain getChain(String subjectId) {
        return findChain(subjectId).orElseThrow(() -> new SubjectNotFoundException(subjectId));
    }

    /**
     * Re-walks every link of the subject's chain. A broken chain is marked
     * disputed.
     */
    public ChainVerification verifyChain(String subjectId) {
        TemporalIntegrityChain chain = getChain(subjectId);
        synchronized (chain) {
            Integer broken = chain.firstBrokenLink(0);
            if (broken != null) {
                chain.markDisputed();
                log.warn("Integrity chain for subject={} failed verification at entry {}", subjectId, broken);
            }
            return new ChainVerification(subjectId, broken == null && !chain.isDisputed(), chain.size(), broken,
                chain.getMerkleRoot(), broken == null ? chain.getVerificationStatus() : VerificationStatus.DISPUTED);
        }
    }

    /**
     * Installs a reconciled chain, replacing whatever is held for its subject.
     */
    public void restore(TemporalIntegrityChain chain) {
        chains.put(chain.getSubjectId(), chain);
        log.info("Restored integrity chain for subject={} with {} entries", chain.getSubjectId(), chain.size());
    }
}
