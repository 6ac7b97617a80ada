package com.truthfeed.analytics;

import com.truthfeed.bus.FeedEvent;

import java.util.List;

/**
 * Destination for events moved out of the active log by archival.
 */
public interface ColdStorage {

    void store(String feedId, List<FeedEvent> events);

    List<FeedEvent> archived(String feedId);
}
