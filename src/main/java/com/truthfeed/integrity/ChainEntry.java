package com.truthfeed.integrity;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.truthfeed.chain.HashChain;

import java.time.Instant;

/**
 * One event in a subject's integrity chain. {@code data_hash} is the event's
 * integrity proof; {@code entry_hash} links it to the previous entry.
 */
public record ChainEntry(
    @JsonProperty("entry_id") String entryId,
    @JsonProperty("event_id") String eventId,
    @JsonProperty("feed_id") String feedId,
    @JsonProperty("event_type") String eventType,
    @JsonProperty("data_hash") String dataHash,
    @JsonProperty("previous_hash") String previousHash,
    @JsonProperty("entry_hash") String entryHash,
    @JsonProperty("anchor_reference") String anchorReference,
    @JsonProperty("status") EntryStatus status,
    @JsonProperty("recorded_at") Instant recordedAt
) {

    public ChainEntry confirm(String reference) {
        return new ChainEntry(entryId, eventId, feedId, eventType, dataHash, previousHash, entryHash,
            reference, EntryStatus.CONFIRMED, recordedAt);
    }

    @JsonIgnore
    public boolean isSelfConsistent() {
        return HashChain.chainHash(dataHash, previousHash).equals(entryHash);
    }
}
