package com.truthfeed.trust;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

/**
 * A compliance certificate issued to a subject for one framework.
 *
 * {@code certification_hash} covers the issued content and never changes;
 * renewal only moves {@code expiration_date}. {@code status} is evaluated
 * against the clock whenever the certificate is read.
 */
public record ComplianceCertification(
    @JsonProperty("certification_id") String certificationId,
    @JsonProperty("subject_id") String subjectId,
    @JsonProperty("compliance_framework") String complianceFramework,
    @JsonProperty("certification_level") CertificationLevel certificationLevel,
    @JsonProperty("issuing_authority") String issuingAuthority,
    @JsonProperty("certification_hash") String certificationHash,
    @JsonProperty("issue_date") Instant issueDate,
    @JsonProperty("expiration_date") Instant expirationDate,
    @JsonProperty("renewal_requirements") List<String> renewalRequirements,
    @JsonProperty("evidence_links") List<String> evidenceLinks,
    @JsonProperty("renewal_count") int renewalCount,
    @JsonProperty("last_renewed_at") Instant lastRenewedAt,
    @JsonProperty("status") CertificationStatus status
) {

    ComplianceCertification at(Instant now) {
        CertificationStatus current = now.isBefore(expirationDate)
            ? CertificationStatus.ACTIVE : CertificationStatus.EXPIRED;
        return current == status ? this : new ComplianceCertification(certificationId, subjectId,
            complianceFramework, certificationLevel, issuingAuthority, certificationHash, issueDate,
            expirationDate, renewalRequirements, evidenceLinks, renewalCount, lastRenewedAt, current);
    }

    ComplianceCertification renewedUntil(Instant expiration, Instant renewedAt) {
        return new ComplianceCertification(certificationId, subjectId, complianceFramework, certificationLevel,
            issuingAuthority, certificationHash, issueDate, expiration, renewalRequirements, evidenceLinks,
            renewalCount + 1, renewedAt, CertificationStatus.ACTIVE);
    }
}
