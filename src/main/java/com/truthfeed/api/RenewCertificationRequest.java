package com.truthfeed.api;

import com.fasterxml.jackson.annotation.JsonProperty;

public record RenewCertificationRequest(
    @JsonProperty("validity_months") Integer validityMonths
) {}
