package com.truthfeed.feed;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Identity of a feed: its type plus an optional subject. A null subject
 * denotes the global feed of that type.
 *
 * {@link #feedId()} must be unique per ref, so {@value #GLOBAL_SUBJECT} is
 * not accepted as a subject id.
 */
public record FeedRef(
    @JsonProperty("feed_type") FeedType feedType,
    @JsonProperty("subject_id") String subjectId
) {

    public static final String GLOBAL_SUBJECT = "global";

    public FeedRef {
        if (feedType == null) {
            throw new IllegalArgumentException("feed_type is required");
        }
        if (subjectId != null && subjectId.isBlank()) {
            subjectId = null;
        }
        if (GLOBAL_SUBJECT.equals(subjectId)) {
            throw new IllegalArgumentException("subject_id '" + GLOBAL_SUBJECT + "' is reserved for the global "
                + feedType.getValue() + " feed");
        }
    }

    public static FeedRef global(FeedType feedType) {
        return new FeedRef(feedType, null);
    }

    public static FeedRef of(FeedType feedType, String subjectId) {
        return new FeedRef(feedType, subjectId);
    }

    public boolean isGlobal() {
        return subjectId == null;
    }

    public String feedId() {
        return "feed_" + feedType.getValue() + "_" + (subjectId == null ? GLOBAL_SUBJECT : subjectId);
    }

    public String path() {
        return "/v1/feeds/" + feedType.getValue() + (subjectId == null ? "" : "/" + subjectId);
    }

    @Override
    public String toString() {
        return feedType.getValue() + (subjectId == null ? "" : "/" + subjectId);
    }
}
