package com.truthfeed.api;

import com.truthfeed.trust.CertificationService;
import com.truthfeed.trust.ComplianceCertification;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * GET  /v1/certifications/{id}
 * POST /v1/certifications/{id}/renew
 */
@RestController
@RequestMapping("/v1/certifications")
public class CertificationController {

    private final CertificationService certificationService;

    public CertificationController(CertificationService certificationService) {
        this.certificationService = certificationService;
    }

    @GetMapping("/{id}")
    public ComplianceCertification get(@PathVariable String id) {
        return certificationService.getCertification(id);
    }

    @PostMapping("/{id}/renew")
    public ComplianceCertification renew(@PathVariable String id,
                                         @RequestBody(required = false) RenewCertificationRequest request) {
        return certificationService.renewCertification(id, request == null ? null : request.validityMonths());
    }
}
