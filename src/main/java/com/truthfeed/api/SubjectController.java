package com.truthfeed.api;

import com.truthfeed.integrity.ChainVerification;
import com.truthfeed.integrity.IntegrityChainService;
import com.truthfeed.integrity.TemporalIntegrityChain;
import com.truthfeed.trust.CertificationService;
import com.truthfeed.trust.ComplianceCertification;
import com.truthfeed.trust.CrossReferenceService;
import com.truthfeed.trust.CrossReferenceVerification;
import com.truthfeed.trust.TrustScoreRecord;
import com.truthfeed.trust.TrustScoreService;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Per-subject trust score and integrity chain.
 *
 * GET  /v1/subjects/{id}/trust-score
 * POST /v1/subjects/{id}/attestations
 * POST /v1/subjects/{id}/expert-validations
 * GET  /v1/subjects/{id}/certifications
 * POST /v1/subjects/{id}/certifications
 * POST /v1/subjects/{id}/cross-references
 * GET  /v1/subjects/{id}/integrity
 * GET  /v1/subjects/{id}/integrity/verify
 */
@RestController
@RequestMapping("/v1/subjects")
public class SubjectController {

    private final TrustScoreService trustScoreService;
    private final IntegrityChainService integrityChainService;
    private final CertificationService certificationService;
    private final CrossReferenceService crossReferenceService;

    public SubjectController(TrustScoreService trustScoreService,
                             IntegrityChainService integrityChainService,
                             CertificationService certificationService,
                             CrossReferenceService crossReferenceService) {
        this.trustScoreService = trustScoreService;
        this.integrityChainService = integrityChainService;
        this.certificationService = certificationService;
        this.crossReferenceService = crossReferenceService;
    }

    @GetMapping("/{id}/trust-score")
    public TrustScoreRecord trustScore(@PathVariable String id) {
        return trustScoreService.computeTrustScore(id);
    }

    @PostMapping("/{id}/attestations")
    @ResponseStatus(HttpStatus.CREATED)
    public TrustScoreRecord recordAttestation(@PathVariable String id, @RequestBody AttestationRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("request body is required");
        }
        return trustScoreService.recordAttestation(id, request.attestationType(),
            FeedPaths.require(request.score(), "score"), request.source());
    }

    @PostMapping("/{id}/expert-validations")
    @ResponseStatus(HttpStatus.CREATED)
    public TrustScoreRecord recordExpertValidation(@PathVariable String id,
                                                   @RequestBody ExpertValidationRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("request body is required");
        }
        return trustScoreService.recordExpertValidation(id, request.expertId(), request.expertCredentials(),
            FeedPaths.require(request.confidence(), "confidence"), FeedPaths.require(request.stake(), "stake"));
    }

    @GetMapping("/{id}/certifications")
    public List<ComplianceCertification> certifications(@PathVariable String id) {
        return certificationService.certifications(id);
    }

    @PostMapping("/{id}/certifications")
    @ResponseStatus(HttpStatus.CREATED)
    public ComplianceCertification issueCertification(@PathVariable String id,
                                                      @RequestBody CertificationRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("request body is required");
        }
        return certificationService.issueCertification(id, request.complianceFramework(),
            request.certificationLevel(), request.issuingAuthority(), request.evidenceLinks(),
            request.validityMonths());
    }

    @PostMapping("/{id}/cross-references")
    @ResponseStatus(HttpStatus.CREATED)
    public CrossReferenceVerification verifyCrossReference(@PathVariable String id,
                                                           @RequestBody CrossReferenceRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("request body is required");
        }
        return crossReferenceService.verifyClaim(id, request.primaryClaim(), request.referenceSources());
    }

    @GetMapping("/{id}/integrity")
    public TemporalIntegrityChain integrity(@PathVariable String id) {
        return integrityChainService.getChain(id);
    }

    @GetMapping("/{id}/integrity/verify")
    public ChainVerification verifyIntegrity(@PathVariable String id) {
        return integrityChainService.verifyChain(id);
    }
}
