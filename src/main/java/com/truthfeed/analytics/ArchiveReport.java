package com.truthfeed.analytics;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.truthfeed.bus.FeedCheckpoint;

import java.util.List;

public record ArchiveReport(
    @JsonProperty("events_archived") int eventsArchived,
    @JsonProperty("checkpoints") List<FeedCheckpoint> checkpoints,
    @JsonProperty("dormant_feeds") List<String> dormantFeeds
) {}
