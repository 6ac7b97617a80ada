package com.truthfeed.trust;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One independent source consulted for a claim and whether it supports it.
 */
public record ReferenceSource(
    @JsonProperty("source") String source,
    @JsonProperty("supports") Boolean supports
) {}
