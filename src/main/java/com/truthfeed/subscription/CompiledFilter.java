package com.truthfeed.subscription;

import com.truthfeed.bus.FeedEvent;

import java.util.function.Predicate;

public record CompiledFilter(FeedFilter source, Predicate<FeedEvent> predicate) {

    public boolean matches(FeedEvent event) {
        return predicate.test(event);
    }
}
