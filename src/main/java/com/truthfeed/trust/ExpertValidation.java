package com.truthfeed.trust;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

/**
 * A professional assessment. {@code weight} is the expert's declared stake
 * divided by the configured stake normalization, fixed when recorded.
 */
public record ExpertValidation(
    @JsonProperty("validation_id") String validationId,
    @JsonProperty("subject_id") String subjectId,
    @JsonProperty("expert_id") String expertId,
    @JsonProperty("expert_credentials") List<String> credentials,
    @JsonProperty("confidence") double confidence,
    @JsonProperty("stake") double stake,
    @JsonProperty("weight") double weight,
    @JsonProperty("recorded_at") Instant recordedAt
) {}
