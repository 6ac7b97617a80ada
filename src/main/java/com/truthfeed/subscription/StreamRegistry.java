package com.truthfeed.subscription;

import com.truthfeed.bus.FeedEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Open stream connections by subscription id. Stream delivery is
 * fire-and-forget: with no connection, or a broken one, the event is dropped.
 */
@Component
public class StreamRegistry {

    private static final Logger log = LoggerFactory.getLogger(StreamRegistry.class);

    private final ConcurrentHashMap<String, StreamSink> sinks = new ConcurrentHashMap<>();

    /** Attaches {@code sink}, closing any connection it replaces. */
    public void attach(String subscriptionId, StreamSink sink) {
        StreamSink previous = sinks.put(subscriptionId, sink);
        if (previous != null && previous != sink) {
            previous.close();
        }
        log.info("Stream attached for subscription={}", subscriptionId);
    }

    /** Detaches {@code sink} if it is still the current connection. */
    public void detach(String subscriptionId, StreamSink sink) {
        if (sinks.remove(subscriptionId, sink)) {
            log.info("Stream detached for subscription={}", subscriptionId);
        }
    }

    public void close(String subscriptionId) {
        StreamSink sink = sinks.remove(subscriptionId);
        if (sink != null) {
            sink.close();
        }
    }

    public boolean isAttached(String subscriptionId) {
        return sinks.containsKey(subscriptionId);
    }

    boolean send(String subscriptionId, FeedEvent event) {
        StreamSink sink = sinks.get(subscriptionId);
        if (sink == null) {
            log.debug("No stream for subscription={}, dropped event={}", subscriptionId, event.eventId());
            return false;
        }
        try {
            sink.send(event);
            return true;
        } catch (IOException ex) {
            sinks.remove(subscriptionId, sink);
            log.debug("Stream for subscription={} broken, dropped event={}: {}",
                subscriptionId, event.eventId(), ex.getMessage());
            return false;
        }
    }
}
