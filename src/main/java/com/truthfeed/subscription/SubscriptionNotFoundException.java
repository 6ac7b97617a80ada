package com.truthfeed.subscription;

import com.truthfeed.feed.NotFoundException;

public class SubscriptionNotFoundException extends NotFoundException {

    public SubscriptionNotFoundException(String subscriptionId) {
        super("subscription not found: " + subscriptionId);
    }
}
