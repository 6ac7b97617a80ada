package com.truthfeed.subscription;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A subscription predicate as submitted by the subscriber.
 * {@code value} is a string for text operators and a number for comparisons.
 */
public record FeedFilter(
    @JsonProperty("filter_type") FilterType filterType,
    @JsonProperty("operator") FilterOperator operator,
    @JsonProperty("value") Object value
) {

    public static FeedFilter of(FilterType filterType, FilterOperator operator, Object value) {
        return new FeedFilter(filterType, operator, value);
    }
}
