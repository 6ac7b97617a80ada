package com.truthfeed.subscription;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum FilterOperator {
    EQUALS("equals"),
    GREATER_THAN("greater_than"),
    LESS_THAN("less_than"),
    CONTAINS("contains"),
    REGEX("regex");

    private final String value;

    FilterOperator(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public boolean isNumericComparison() {
        return this == GREATER_THAN || this == LESS_THAN;
    }

    @JsonCreator
    public static FilterOperator fromValue(String value) {
        for (FilterOperator operator : values()) {
            if (operator.value.equals(value) || operator.name().equals(value)) {
                return operator;
            }
        }
        throw new FilterEvaluationException("Unknown filter operator: " + value);
    }
}
