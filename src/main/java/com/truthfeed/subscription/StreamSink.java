package com.truthfeed.subscription;

import com.truthfeed.bus.FeedEvent;

import java.io.IOException;

/**
 * An open push connection for a stream-mode subscription.
 */
@FunctionalInterface
public interface StreamSink {

    void send(FeedEvent event) throws IOException;

    default void close() {
    }
}
