package com.truthfeed.trust;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.truthfeed.feed.VerificationStatus;

import java.time.Instant;
import java.util.List;

/**
 * Aggregate trust score for one subject. {@code has_evidence=false} with a
 * score of 0 means nothing has been recorded yet, which is not the same as a
 * low score.
 */
public record TrustScoreRecord(
    @JsonProperty("subject_id") String subjectId,
    @JsonProperty("trust_score") double trustScore,
    @JsonProperty("has_evidence") boolean hasEvidence,
    @JsonProperty("attestations") List<Attestation> attestations,
    @JsonProperty("expert_validations") List<ExpertValidation> expertValidations,
    @JsonProperty("attestation_count") int attestationCount,
    @JsonProperty("expert_validation_count") int expertValidationCount,
    @JsonProperty("temporal_integrity_score") double temporalIntegrityScore,
    @JsonProperty("verification_status") VerificationStatus verificationStatus,
    @JsonProperty("computed_at") Instant computedAt
) {}
