package com.truthfeed.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.truthfeed.trust.ReferenceSource;

import java.util.List;

public record CrossReferenceRequest(
    @JsonProperty("primary_claim") String primaryClaim,
    @JsonProperty("reference_sources") List<ReferenceSource> referenceSources
) {}
