package com.truthfeed.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.truthfeed.trust.CertificationLevel;

import java.util.List;

public record CertificationRequest(
    @JsonProperty("compliance_framework") String complianceFramework,
    @JsonProperty("certification_level") CertificationLevel certificationLevel,
    @JsonProperty("issuing_authority") String issuingAuthority,
    @JsonProperty("evidence_links") List<String> evidenceLinks,
    @JsonProperty("validity_months") Integer validityMonths
) {}
