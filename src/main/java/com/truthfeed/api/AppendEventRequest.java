package com.truthfeed.api;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

public record AppendEventRequest(
    @JsonProperty("event_type") String eventType,
    @JsonProperty("payload") Map<String, Object> payload,
    @JsonProperty("confidence") Double confidence
) {}
