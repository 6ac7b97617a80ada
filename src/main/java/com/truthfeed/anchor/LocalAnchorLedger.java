package com.truthfeed.anchor;

import com.truthfeed.chain.HashChain;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Process-local, append-only anchor log. Each commitment is chained to the
 * previous one, so the reference sequence itself is tamper-evident.
 * Used when no remote anchoring endpoint is configured.
 */
public class LocalAnchorLedger implements AnchoringService {

    private static final Logger log = LoggerFactory.getLogger(LocalAnchorLedger.class);

    private final Clock clock;
    private final List<Commitment> commitments = new ArrayList<>();

    public LocalAnchorLedger(Clock clock) {
        this.clock = clock;
    }

    @Override
    public synchronized String anchor(String payloadHash) {
        String previous = commitments.isEmpty()
            ? HashChain.GENESIS
            : commitments.get(commitments.size() - 1).link();
        String link = HashChain.chainHash(payloadHash, previous);
        String reference = "anchor_" + (commitments.size() + 1) + "_" + link.substring(0, 40);
        commitments.add(new Commitment(reference, payloadHash, link, clock.instant()));
        log.debug("Anchored hash={} as {}", payloadHash, reference);
        return reference;
    }

    public synchronized Optional<String> committedHash(String reference) {
        return commitments.stream()
            .filter(c -> c.reference().equals(reference))
            .map(Commitment::payloadHash)
            .findFirst();
    }

    public synchronized int size() {
        return commitments.size();
    }

    private record Commitment(String reference, String payloadHash, String link, Instant committedAt) {}
}
