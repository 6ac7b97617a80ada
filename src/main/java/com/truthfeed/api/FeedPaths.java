package com.truthfeed.api;

import com.truthfeed.feed.FeedRef;
import com.truthfeed.feed.FeedType;

final class FeedPaths {

    static final int MAX_PAGE = 1000;

    private FeedPaths() {
    }

    static FeedRef ref(String type, String subject) {
        return FeedRef.of(FeedType.fromValue(type), subject);
    }

    static int clampLimit(int limit) {
        return Math.max(1, Math.min(limit, MAX_PAGE));
    }

    static double require(Double value, String field) {
        if (value == null) {
            throw new IllegalArgumentException(field + " is required");
        }
        return value;
    }
}
