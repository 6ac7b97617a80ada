package com.truthfeed.subscription;

import com.truthfeed.bus.FeedEvent;

/**
 * Sends one event to a subscriber's callback endpoint.
 */
public interface CallbackClient {

    /**
     * @throws CallbackDeliveryException if the endpoint did not accept the event
     */
    void deliver(String endpoint, String webhookSecret, FeedEvent event);
}
