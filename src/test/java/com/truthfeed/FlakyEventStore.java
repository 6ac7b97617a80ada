package com.truthfeed;

import com.truthfeed.bus.FeedEvent;
import com.truthfeed.bus.InMemoryEventStore;

/**
 * In-memory store whose appends can be made to fail, to observe what callers
 * leave behind when an append does not happen.
 */
public class FlakyEventStore extends InMemoryEventStore {

    private volatile boolean failing;

    public void setFailing(boolean failing) {
        this.failing = failing;
    }

    @Override
    public FeedEvent append(FeedEvent event) {
        if (failing) {
            throw new IllegalStateException("store unavailable");
        }
        return super.append(event);
    }
}
