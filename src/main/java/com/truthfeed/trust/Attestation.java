package com.truthfeed.trust;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

public record Attestation(
    @JsonProperty("attestation_id") String attestationId,
    @JsonProperty("subject_id") String subjectId,
    @JsonProperty("attestation_type") AttestationType type,
    @JsonProperty("score") double score,
    @JsonProperty("source") String source,
    @JsonProperty("recorded_at") Instant recordedAt
) {

    @JsonProperty("weight")
    public double weight() {
        return type.getWeight();
    }
}
