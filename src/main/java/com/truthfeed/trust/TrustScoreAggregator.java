package com.truthfeed.trust;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;

/**
 * Weighted average over attestations and expert validations:
 * {@code score = Σ(value·weight) / Σ(weight)}.
 *
 * Evidence is summed in a fixed order so the result does not depend on the
 * order in which it was recorded.
 */
public final class TrustScoreAggregator {

    private TrustScoreAggregator() {
    }

    public static double aggregate(Collection<Attestation> attestations, Collection<ExpertValidation> validations) {
        List<Attestation> sortedAttestations = new ArrayList<>(attestations);
        sortedAttestations.sort(Comparator.comparing(Attestation::attestationId));
        List<ExpertValidation> sortedValidations = new ArrayList<>(validations);
        sortedValidations.sort(Comparator.comparing(ExpertValidation::validationId));

        double weightedSum = 0.0;
        double totalWeight = 0.0;
        for (Attestation attestation : sortedAttestations) {
            weightedSum += attestation.score() * attestation.weight();
            totalWeight += attestation.weight();
        }
        for (ExpertValidation validation : sortedValidations) {
            weightedSum += validation.confidence() * validation.weight();
            totalWeight += validation.weight();
        }
        return totalWeight > 0.0 ? weightedSum / totalWeight : 0.0;
    }
}
