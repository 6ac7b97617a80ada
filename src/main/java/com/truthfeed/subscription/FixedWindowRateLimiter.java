package com.truthfeed.subscription;

import java.time.Duration;
import java.time.Instant;

/**
 * Counts deliveries in fixed windows of {@code period}. Not thread-safe;
 * the owning subscription guards it.
 */
class FixedWindowRateLimiter {

    private final int limit;
    private final Duration period;
    private Instant windowStart;
    private int used;

    FixedWindowRateLimiter(int limit, Duration period, Instant start) {
        this.limit = limit;
        this.period = period;
        this.windowStart = start;
    }

    boolean tryAcquire(Instant now) {
        roll(now);
        if (used >= limit) {
            return false;
        }
        used++;
        return true;
    }

    private void roll(Instant now) {
        if (!now.isBefore(windowStart.plus(period))) {
            long elapsedWindows = Duration.between(windowStart, now).toMillis() / period.toMillis();
            windowStart = windowStart.plus(period.multipliedBy(elapsedWindows));
            used = 0;
        }
    }
}
