package com.truthfeed.trust;

import com.truthfeed.bus.FeedEventService;
import com.truthfeed.chain.HashChain;
import com.truthfeed.feed.FeedRef;
import com.truthfeed.feed.FeedType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Issues and renews compliance certifications.
 *
 * Issuance and renewal are published to {@code compliance_events/{subject}},
 * which also puts them on the subject's integrity chain. A certification is
 * only stored once its event has been appended.
 */
@Service
public class CertificationService {

    private static final Logger log = LoggerFactory.getLogger(CertificationService.class);

    static final String ISSUED_EVENT = "compliance_certification";
    static final String RENEWED_EVENT = "compliance_certification_renewed";
    static final int DEFAULT_VALIDITY_MONTHS = 12;
    static final int MAX_VALIDITY_MONTHS = 120;

    /** Certificates count validity in 30-day months. */
    private static final Duration MONTH = Duration.ofDays(30);

    private static final Map<String, List<String>> RENEWAL_REQUIREMENTS = Map.of(
        "SOC2", List.of("Annual audit", "Control effectiveness review", "Risk assessment update"),
        "ISO27001", List.of("Management review", "Internal audit", "Risk treatment plan update"),
        "GDPR", List.of("Data protection impact assessment", "Privacy policy review", "Breach response test")
    );
    private static final List<String> GENERAL_REQUIREMENTS = List.of("General compliance review");

    private final FeedEventService feedEventService;
    private final Clock clock;
    private final ConcurrentHashMap<String, ComplianceCertification> certifications = new ConcurrentHashMap<>();
    private final Object renewalLock = new Object();

    public CertificationService(FeedEventService feedEventService, Clock clock) {
        this.feedEventService = feedEventService;
        this.clock = clock;
    }

    /**
     * @param validityMonths months of 30 days; {@code null} means 12
     */
    public ComplianceCertification issueCertification(String subjectId, String complianceFramework,
                                                      CertificationLevel level, String issuingAuthority,
                                                      List<String> evidenceLinks, Integer validityMonths) {
        FeedRef feed = FeedRef.of(FeedType.COMPLIANCE_EVENTS, requireText(subjectId, "subject_id"));
        requireText(complianceFramework, "compliance_framework");
        requireText(issuingAuthority, "issuing_authority");
        if (level == null) {
            throw new IllegalArgumentException("certification_level is required");
        }
        List<String> evidence = evidenceLinks == null ? List.of() : List.copyOf(evidenceLinks);
        int months = validityMonths(validityMonths);

        Instant issued = clock.instant();
        Map<String, Object> hashed = new LinkedHashMap<>();
        hashed.put("subject_id", subjectId);
        hashed.put("compliance_framework", complianceFramework);
        hashed.put("certification_level", level.getValue());
        hashed.put("issuing_authority", issuingAuthority);
        hashed.put("evidence_links", new ArrayList<>(evidence));
        hashed.put("issue_date", issued.toString());

        ComplianceCertification certification = new ComplianceCertification(
            "cert_" + UUID.randomUUID(),
            subjectId,
            complianceFramework,
            level,
            issuingAuthority,
            HashChain.linkHash(hashed),
            issued,
            issued.plus(MONTH.multipliedBy(months)),
            renewalRequirements(complianceFramework),
            evidence,
            0,
            null,
            CertificationStatus.ACTIVE
        );

        Map<String, Object> payload = eventPayload(certification);
        payload.put("issuing_authority", issuingAuthority);
        payload.put("renewal_requirements", new ArrayList<>(certification.renewalRequirements()));
        payload.put("evidence_links", new ArrayList<>(evidence));
        feedEventService.appendEvent(feed, ISSUED_EVENT, payload, 1.0);
        certifications.put(certification.certificationId(), certification);

        log.info("Issued {} certification {} ({}) to subject={}, expires {}", complianceFramework,
            certification.certificationId(), level.getValue(), subjectId, certification.expirationDate());
        return certification;
    }

    public ComplianceCertification getCertification(String certificationId) {
        ComplianceCertification certification = certifications.get(certificationId);
        if (certification == null) {
            throw new CertificationNotFoundException(certificationId);
        }
        return certification.at(clock.instant());
    }

    /** Certifications of {@code subjectId}, oldest first. */
    public List<ComplianceCertification> certifications(String subjectId) {
        requireText(subjectId, "subject_id");
        Instant now = clock.instant();
        return certifications.values().stream()
            .filter(c -> c.subjectId().equals(subjectId))
            .sorted(Comparator.comparing(ComplianceCertification::issueDate)
                .thenComparing(ComplianceCertification::certificationId))
            .map(c -> c.at(now))
            .toList();
    }

    /**
     * Extends the certification by {@code validityMonths} from its current
     * expiration, or from now if it has already expired.
     */
    public ComplianceCertification renewCertification(String certificationId, Integer validityMonths) {
        int months = validityMonths(validityMonths);
        synchronized (renewalLock) {
            ComplianceCertification current = certifications.get(certificationId);
            if (current == null) {
                throw new CertificationNotFoundException(certificationId);
            }
            Instant now = clock.instant();
            Instant base = current.expirationDate().isAfter(now) ? current.expirationDate() : now;
            ComplianceCertification renewed = current.renewedUntil(base.plus(MONTH.multipliedBy(months)), now);

            Map<String, Object> payload = eventPayload(renewed);
            payload.put("previous_expiration_date", current.expirationDate().toString());
            payload.put("renewal_count", renewed.renewalCount());
            feedEventService.appendEvent(FeedRef.of(FeedType.COMPLIANCE_EVENTS, renewed.subjectId()),
                RENEWED_EVENT, payload, 1.0);
            certifications.put(certificationId, renewed);

            log.info("Renewed certification {} for subject={} until {}", certificationId,
                renewed.subjectId(), renewed.expirationDate());
            return renewed;
        }
    }

    static List<String> renewalRequirements(String framework) {
        return RENEWAL_REQUIREMENTS.getOrDefault(framework.toUpperCase(Locale.ROOT).replace(" ", ""),
            GENERAL_REQUIREMENTS);
    }

    private static Map<String, Object> eventPayload(ComplianceCertification certification) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("organization_id", certification.subjectId());
        payload.put("certification_id", certification.certificationId());
        payload.put("compliance_framework", certification.complianceFramework());
        payload.put("certification_level", certification.certificationLevel().getValue());
        payload.put("certification_hash", certification.certificationHash());
        payload.put("issue_date", certification.issueDate().toString());
        payload.put("expiration_date", certification.expirationDate().toString());
        return payload;
    }

    private static int validityMonths(Integer requested) {
        int months = requested == null ? DEFAULT_VALIDITY_MONTHS : requested;
        if (months < 1 || months > MAX_VALIDITY_MONTHS) {
            throw new IllegalArgumentException("validity_months must be within [1, " + MAX_VALIDITY_MONTHS
                + "], got " + months);
        }
        return months;
    }

    private static String requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(field + " is required");
        }
        return value;
    }
}
