package com.truthfeed.api;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record ExpertValidationRequest(
    @JsonProperty("expert_id") String expertId,
    @JsonProperty("expert_credentials") List<String> expertCredentials,
    @JsonProperty("confidence") Double confidence,
    @JsonProperty("stake") Double stake
) {}
