package com.truthfeed.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.truthfeed.trust.AttestationType;

public record AttestationRequest(
    @JsonProperty("attestation_type") AttestationType attestationType,
    @JsonProperty("score") Double score,
    @JsonProperty("source") String source
) {}
