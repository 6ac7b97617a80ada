package com.truthfeed.feed;

public class FeedNotFoundException extends NotFoundException {

    public FeedNotFoundException(FeedRef ref) {
        super("feed not found: " + ref);
    }

    public FeedNotFoundException(String feedId) {
        super("feed not found: " + feedId);
    }
}
