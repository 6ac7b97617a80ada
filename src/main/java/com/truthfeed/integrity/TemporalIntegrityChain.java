package com.truthfeed.integrity;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.truthfeed.chain.HashChain;
import com.truthfeed.feed.VerificationStatus;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Hash-linked history of every event that touched one subject, across all
 * feed types.
 *
 * The Merkle root is recomputed over the full entry list on every change.
 * That is linear in the chain length and is the scaling limit of this
 * structure; an incremental Merkle accumulator would remove it.
 */
public class TemporalIntegrityChain {

    private final String subjectId;
    private final List<ChainEntry> entries = new ArrayList<>();
    private String merkleRoot = HashChain.GENESIS;
    private double integrityScore;
    private boolean disputed;
    private Instant lastUpdated;

    public TemporalIntegrityChain(String subjectId, Instant createdAt) {
        this.subjectId = subjectId;
        this.lastUpdated = createdAt;
    }

    /**
     * Rebuilds a chain from previously exported or reconciled entries. The
     * entries are taken as given; corruption surfaces on the next append or
     * verification.
     */
    public static TemporalIntegrityChain restore(String subjectId, List<ChainEntry> entries, Instant at) {
        TemporalIntegrityChain chain = new TemporalIntegrityChain(subjectId, at);
        chain.entries.addAll(entries);
        chain.recompute(at);
        return chain;
    }

    @JsonProperty("subject_id")
    public String getSubjectId() {
        return subjectId;
    }

    @JsonProperty("entries")
    public synchronized List<ChainEntry> getEntries() {
        return List.copyOf(entries);
    }

    @JsonProperty("entry_count")
    public synchronized int size() {
        return entries.size();
    }

    @JsonProperty("merkle_root")
    public synchronized String getMerkleRoot() {
        return merkleRoot;
    }

    @JsonProperty("integrity_score")
    public synchronized double getIntegrityScore() {
        return integrityScore;
    }

    @JsonProperty("last_updated")
    public synchronized Instant getLastUpdated() {
        return lastUpdated;
    }

    @JsonProperty("verification_status")
    public synchronized VerificationStatus getVerificationStatus() {
        if (disputed) {
            return VerificationStatus.DISPUTED;
        }
        boolean anyPending = entries.stream().anyMatch(e -> e.status() == EntryStatus.PENDING);
        return anyPending ? VerificationStatus.PENDING : VerificationStatus.VERIFIED;
    }

    @JsonIgnore
    public synchronized boolean isDisputed() {
        return disputed;
    }

    synchronized String headHash() {
        return entries.isEmpty() ? HashChain.GENESIS : entries.get(entries.size() - 1).entryHash();
    }

    synchronized void append(ChainEntry entry, Instant at) {
        entries.add(entry);
        recompute(at);
    }

    synchronized boolean confirm(String eventId, String anchorReference, Instant at) {
        for (int i = 0; i < entries.size(); i++) {
            ChainEntry entry = entries.get(i);
            if (entry.eventId().equals(eventId)) {
                if (entry.status() == EntryStatus.PENDING) {
                    entries.set(i, entry.confirm(anchorReference));
                    recompute(at);
                }
                return true;
            }
        }
        return false;
    }

    synchronized void markDisputed() {
        disputed = true;
    }

    /**
     * Index of the first entry whose hash does not recompute or whose link
     * does not match its predecessor, scanning from {@code fromIndex}; null
     * if every scanned entry holds.
     */
    synchronized Integer firstBrokenLink(int fromIndex) {
        for (int i = Math.max(0, fromIndex); i < entries.size(); i++) {
            ChainEntry entry = entries.get(i);
            String expectedPrevious = i == 0 ? HashChain.GENESIS : entries.get(i - 1).entryHash();
            if (entry == null || !expectedPrevious.equals(entry.previousHash()) || !entry.isSelfConsistent()) {
                return i;
            }
        }
        return null;
    }

    private void recompute(Instant at) {
        List<String> hashes = new ArrayList<>(entries.size());
        long confirmed = 0;
        for (ChainEntry entry : entries) {
            hashes.add(entry.dataHash());
            if (entry.status() == EntryStatus.CONFIRMED) {
                confirmed++;
            }
        }
        merkleRoot = HashChain.merkleRoot(hashes);
        integrityScore = entries.isEmpty() ? 0.0 : (double) confirmed / entries.size();
        lastUpdated = at;
    }
}
