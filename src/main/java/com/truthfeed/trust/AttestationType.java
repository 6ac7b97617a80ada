package com.truthfeed.trust;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Source of an attestation, with the fixed weight its score carries in the
 * aggregate. Evidence from compliance checks outweighs self-reported claims.
 */
public enum AttestationType {
    COMPLIANCE("compliance", 0.4),
    PROFESSIONAL("professional", 0.3),
    REGULATORY("regulatory", 0.2),
    CROSS_PLATFORM("cross_platform", 0.1);

    private final String value;
    private final double weight;

    AttestationType(String value, double weight) {
        this.value = value;
        this.weight = weight;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public double getWeight() {
        return weight;
    }

    @JsonCreator
    public static AttestationType fromValue(String value) {
        for (AttestationType type : values()) {
            if (type.value.equals(value) || type.name().equals(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown attestation_type: " + value);
    }
}
