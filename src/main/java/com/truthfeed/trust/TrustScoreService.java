package com.truthfeed.trust;

import com.truthfeed.bus.FeedEventService;
import com.truthfeed.config.TruthFeedProperties;
import com.truthfeed.feed.FeedRef;
import com.truthfeed.feed.FeedType;
import com.truthfeed.feed.VerificationStatus;
import com.truthfeed.integrity.IntegrityChainService;
import com.truthfeed.integrity.TemporalIntegrityChain;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Records trust evidence per subject and keeps the aggregate score current.
 *
 * Each recorded piece of evidence is also published as an event, carrying the
 * score before and after, to {@code trust_score/{subject}} for attestations
 * and {@code expert_opinions/{subject}} for expert validations. Evidence only
 * counts once its event has been appended.
 */
@Service
public class TrustScoreService {

    private static final Logger log = LoggerFactory.getLogger(TrustScoreService.class);

    static final String ATTESTATION_EVENT = "trust_attestation";
    static final String EXPERT_VALIDATION_EVENT = "expert_validation";

    private final FeedEventService feedEventService;
    private final IntegrityChainService integrityChainService;
    private final Clock clock;
    private final double stakeNormalization;
    private final ConcurrentHashMap<String, SubjectEvidence> evidence = new ConcurrentHashMap<>();

    public TrustScoreService(FeedEventService feedEventService,
                             IntegrityChainService integrityChainService,
                             Clock clock,
                             TruthFeedProperties properties) {
        this.feedEventService = feedEventService;
        this.integrityChainService = integrityChainService;
        this.clock = clock;
        this.stakeNormalization = properties.trust().stakeNormalization();
    }

    /**
     * Current aggregate for {@code subjectId}. A subject with no evidence
     * yields score 0 and {@code has_evidence=false}.
     */
    public TrustScoreRecord computeTrustScore(String subjectId) {
        requireSubject(subjectId);
        SubjectEvidence subject = evidence.get(subjectId);
        if (subject == null) {
            return toRecord(subjectId, List.of(), List.of());
        }
        synchronized (subject) {
            return toRecord(subjectId, List.copyOf(subject.attestations), List.copyOf(subject.validations));
        }
    }

    public TrustScoreRecord recordAttestation(String subjectId, AttestationType type, double score, String source) {
        requireSubject(subjectId);
        if (type == null) {
            throw new IllegalArgumentException("attestation_type is required");
        }
        requireUnitInterval(score, "score");

        SubjectEvidence subject = evidence.computeIfAbsent(subjectId, id -> new SubjectEvidence());
        Attestation attestation = new Attestation("att_" + UUID.randomUUID(), subjectId, type, score,
            source, clock.instant());
        synchronized (subject) {
            double previous = aggregate(subject);
            List<Attestation> attestations = new ArrayList<>(subject.attestations);
            attestations.add(attestation);
            TrustScoreRecord updated = toRecord(subjectId, List.copyOf(attestations),
                List.copyOf(subject.validations));

            Map<String, Object> payload = scoreChangePayload(subjectId, previous, updated);
            payload.put("attestation_id", attestation.attestationId());
            payload.put("attestation_type", type.getValue());
            payload.put("weight", type.getWeight());
            payload.put("value", score);
            if (source != null) {
                payload.put("source", source);
            }
            feedEventService.appendEvent(FeedRef.of(FeedType.TRUST_SCORE, subjectId), ATTESTATION_EVENT,
                payload, score);
            subject.attestations.add(attestation);
            log.info("Recorded {} attestation for subject={}, trust_score {} -> {}",
                type.getValue(), subjectId, previous, updated.trustScore());
            return updated;
        }
    }

    public TrustScoreRecord recordExpertValidation(String subjectId, String expertId, List<String> credentials,
                                                   double confidence, double stake) {
        requireSubject(subjectId);
        if (expertId == null || expertId.isBlank()) {
            throw new IllegalArgumentException("expert_id is required");
        }
        requireUnitInterval(confidence, "confidence");
        if (Double.isNaN(stake) || Double.isInfinite(stake) || stake <= 0.0) {
            throw new IllegalArgumentException("stake must be a positive number");
        }

        List<String> expertCredentials = credentials == null ? List.of() : List.copyOf(credentials);
        SubjectEvidence subject = evidence.computeIfAbsent(subjectId, id -> new SubjectEvidence());
        ExpertValidation validation = new ExpertValidation("val_" + UUID.randomUUID(), subjectId, expertId,
            expertCredentials, confidence, stake, stake / stakeNormalization, clock.instant());
        synchronized (subject) {
            double previous = aggregate(subject);
            List<ExpertValidation> validations = new ArrayList<>(subject.validations);
            validations.add(validation);
            TrustScoreRecord updated = toRecord(subjectId, List.copyOf(subject.attestations),
                List.copyOf(validations));

            Map<String, Object> payload = scoreChangePayload(subjectId, previous, updated);
            payload.put("validation_id", validation.validationId());
            payload.put("expert_id", expertId);
            payload.put("expert_credentials", new ArrayList<>(expertCredentials));
            payload.put("stake", stake);
            payload.put("weight", validation.weight());
            feedEventService.appendEvent(FeedRef.of(FeedType.EXPERT_OPINIONS, subjectId), EXPERT_VALIDATION_EVENT,
                payload, confidence);
            subject.validations.add(validation);
            log.info("Recorded expert validation by {} for subject={}, trust_score {} -> {}",
                expertId, subjectId, previous, updated.trustScore());
            return updated;
        }
    }

    private TrustScoreRecord toRecord(String subjectId, List<Attestation> attestations,
                                      List<ExpertValidation> validations) {
        boolean hasEvidence = !attestations.isEmpty() || !validations.isEmpty();
        double score = TrustScoreAggregator.aggregate(attestations, validations);
        Optional<TemporalIntegrityChain> chain = integrityChainService.findChain(subjectId);
        double integrityScore = chain.map(TemporalIntegrityChain::getIntegrityScore).orElse(0.0);
        VerificationStatus status = chain.map(TemporalIntegrityChain::getVerificationStatus)
            .orElse(VerificationStatus.PENDING);
        return new TrustScoreRecord(subjectId, score, hasEvidence, attestations, validations,
            attestations.size(), validations.size(), integrityScore, status, clock.instant());
    }

    private static double aggregate(SubjectEvidence subject) {
        return TrustScoreAggregator.aggregate(subject.attestations, subject.validations);
    }

    private static Map<String, Object> scoreChangePayload(String subjectId, double previous, TrustScoreRecord updated) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("organization_id", subjectId);
        payload.put("previous_score", previous);
        payload.put("new_score", updated.trustScore());
        payload.put("score_change", updated.trustScore() - previous);
        payload.put("contributing_factors", updated.attestationCount() + updated.expertValidationCount());
        return payload;
    }

    private static void requireSubject(String subjectId) {
        if (subjectId == null || subjectId.isBlank()) {
            throw new IllegalArgumentException("subject_id is required");
        }
    }

    private static void requireUnitInterval(double value, String field) {
        if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
            throw new IllegalArgumentException(field + " must be within [0, 1], got " + value);
        }
    }

    private static final class SubjectEvidence {
        private final List<Attestation> attestations = new ArrayList<>();
        private final List<ExpertValidation> validations = new ArrayList<>();
    }
}
