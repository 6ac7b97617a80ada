package com.truthfeed.trust;

import com.truthfeed.bus.FeedEventService;
import com.truthfeed.feed.FeedRef;
import com.truthfeed.feed.FeedType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Checks a claim against independent sources and records the outcome on
 * {@code compliance_events/{subject}}.
 *
 * {@code cross_validation_score} is the share of sources supporting the
 * claim. Fewer than two sources give {@code insufficient_data}; otherwise a
 * majority verifies the claim and anything else disputes it.
 */
@Service
public class CrossReferenceService {

    private static final Logger log = LoggerFactory.getLogger(CrossReferenceService.class);

    static final String VERIFICATION_EVENT = "cross_reference_verification";
    static final int MIN_SOURCES = 2;

    private final FeedEventService feedEventService;
    private final Clock clock;

    public CrossReferenceService(FeedEventService feedEventService, Clock clock) {
        this.feedEventService = feedEventService;
        this.clock = clock;
    }

    public CrossReferenceVerification verifyClaim(String subjectId, String primaryClaim,
                                                  List<ReferenceSource> referenceSources) {
        if (subjectId == null || subjectId.isBlank()) {
            throw new IllegalArgumentException("subject_id is required");
        }
        FeedRef feed = FeedRef.of(FeedType.COMPLIANCE_EVENTS, subjectId);
        if (primaryClaim == null || primaryClaim.isBlank()) {
            throw new IllegalArgumentException("primary_claim is required");
        }
        List<ReferenceSource> sources = referenceSources == null ? List.of() : new ArrayList<>(referenceSources);
        Set<String> seen = new HashSet<>();
        int supporting = 0;
        List<String> discrepancies = new ArrayList<>();
        for (ReferenceSource source : sources) {
            if (source == null || source.source() == null || source.source().isBlank() || source.supports() == null) {
                throw new IllegalArgumentException("each reference source needs a source and a supports flag");
            }
            if (!seen.add(source.source())) {
                throw new IllegalArgumentException("duplicate reference source: " + source.source());
            }
            if (source.supports()) {
                supporting++;
            } else {
                discrepancies.add(source.source());
            }
        }

        double score = sources.isEmpty() ? 0.0 : (double) supporting / sources.size();
        CrossReferenceResult result;
        double confidence;
        if (sources.size() < MIN_SOURCES) {
            result = CrossReferenceResult.INSUFFICIENT_DATA;
            confidence = 0.0;
        } else if (score > 0.5) {
            result = CrossReferenceResult.VERIFIED;
            confidence = score;
        } else {
            result = CrossReferenceResult.DISPUTED;
            confidence = 1.0 - score;
        }

        CrossReferenceVerification verification = new CrossReferenceVerification("xref_" + UUID.randomUUID(),
            subjectId, primaryClaim, List.copyOf(sources), result, score, confidence, List.copyOf(discrepancies), clock.instant());

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("organization_id", subjectId);
        payload.put("verification_id", verification.verificationId());
        payload.put("primary_claim", primaryClaim);
        payload.put("reference_sources", sources.stream().map(ReferenceSource::source).toList());
        payload.put("verification_result", result.getValue());
        payload.put("cross_validation_score", score);
        payload.put("discrepancies", new ArrayList<>(discrepancies));
        feedEventService.appendEvent(feed, VERIFICATION_EVENT, payload, confidence);

        log.info("Cross-reference verification {} for subject={}: {} ({} of {} sources support)",
            verification.verificationId(), subjectId, result.getValue(), supporting, sources.size());
        return verification;
    }
}
