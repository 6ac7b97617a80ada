package com.truthfeed.subscription;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Event attribute a filter inspects.
 */
public enum FilterType {
    /** The event's subject, or its payload {@code organization_id}. */
    ORGANIZATION("organization"),
    EVENT_TYPE("event_type"),
    /** Payload {@code framework}, {@code compliance_framework} or {@code affected_frameworks}. */
    COMPLIANCE_FRAMEWORK("compliance_framework"),
    /** Payload {@code new_score}, falling back to {@code trust_score}. */
    TRUST_SCORE("trust_score"),
    CONFIDENCE("confidence"),
    /** Payload {@code expert_credentials}. */
    EXPERT_CREDENTIAL("expert_credential");

    private final String value;

    FilterType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public boolean isNumeric() {
        return this == TRUST_SCORE || this == CONFIDENCE;
    }

    @JsonCreator
    public static FilterType fromValue(String value) {
        if ("trust_score_range".equals(value)) {
            return TRUST_SCORE;
        }
        for (FilterType type : values()) {
            if (type.value.equals(value) || type.name().equals(value)) {
                return type;
            }
        }
        throw new FilterEvaluationException("Unknown filter_type: " + value);
    }
}
