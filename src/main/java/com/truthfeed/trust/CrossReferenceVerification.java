package com.truthfeed.trust;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

/**
 * Outcome of checking a claim about a subject against independent sources.
 * {@code discrepancies} names the sources that contradict the claim.
 */
public record CrossReferenceVerification(
    @JsonProperty("verification_id") String verificationId,
    @JsonProperty("subject_id") String subjectId,
    @JsonProperty("primary_claim") String primaryClaim,
    @JsonProperty("reference_sources") List<ReferenceSource> referenceSources,
    @JsonProperty("verification_result") CrossReferenceResult verificationResult,
    @JsonProperty("cross_validation_score") double crossValidationScore,
    @JsonProperty("confidence_level") double confidenceLevel,
    @JsonProperty("discrepancies") List<String> discrepancies,
    @JsonProperty("verified_at") Instant verifiedAt
) {}
