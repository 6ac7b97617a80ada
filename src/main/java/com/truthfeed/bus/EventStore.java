package com.truthfeed.bus;

import java.util.List;
import java.util.Optional;

public interface EventStore {

    FeedEvent append(FeedEvent event);

    Optional<FeedEvent> lastEvent(String feedId);

    /** Events with {@code sequence_number > afterSequence}, in sequence order. */
    List<FeedEvent> events(String feedId, long afterSequence, int limit);

    /** Point-in-time copy of a feed's active log. */
    List<FeedEvent> snapshot(String feedId);

    Optional<FeedEvent> findByEventId(String eventId);

    void updateAnchor(String eventId, String anchorReference);

    /** Removes and returns the active events up to and including {@code sequenceInclusive}. */
    List<FeedEvent> removeThrough(String feedId, long sequenceInclusive);

    void saveCheckpoint(FeedCheckpoint checkpoint);

    Optional<FeedCheckpoint> latestCheckpoint(String feedId);

    /**
     * Sets the anchor of the feed's latest checkpoint if its hash is
     * {@code checkpointHash}.
     *
     * @return false if that checkpoint has since been superseded
     */
    boolean updateCheckpointAnchor(String feedId, String checkpointHash, String anchorReference);
}
