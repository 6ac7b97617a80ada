package com.truthfeed.subscription;

import com.truthfeed.bus.FeedEvent;
import com.truthfeed.config.TruthFeedProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;

/**
 * Outbound queue for callback deliveries, at-least-once.
 *
 * Failed sends are retried with exponential backoff up to the configured
 * number of attempts. Retries stop once the subscription is deactivated;
 * first attempts that were already queued are still made. Deliveries that
 * exhaust their attempts become dead letters; past the configured count the
 * oldest are evicted.
 */
@Component
public class CallbackDeliveryQueue {

    private static final Logger log = LoggerFactory.getLogger(CallbackDeliveryQueue.class);

    private final CallbackClient callbackClient;
    private final Clock clock;
    private final int maxAttempts;
    private final Duration initialBackoff;
    private final Duration maxBackoff;
    private final int maxDeadLetters;
    private final List<PendingDelivery> queue = new ArrayList<>();
    private final Deque<FailedDelivery> deadLetters = new ArrayDeque<>();

    public CallbackDeliveryQueue(CallbackClient callbackClient, Clock clock, TruthFeedProperties properties) {
        this.callbackClient = callbackClient;
        this.clock = clock;
        this.maxAttempts = properties.delivery().maxAttempts();
        this.initialBackoff = properties.delivery().initialBackoff();
        this.maxBackoff = properties.delivery().maxBackoff();
        this.maxDeadLetters = properties.delivery().maxDeadLetters();
    }

    void enqueue(Subscription subscription, FeedEvent event) {
        synchronized (queue) {
            queue.add(new PendingDelivery(subscription, event, 0, clock.instant()));
        }
    }

    public int size() {
        synchronized (queue) {
            return queue.size();
        }
    }

    public List<FailedDelivery> deadLetters() {
        synchronized (deadLetters) {
            return List.copyOf(deadLetters);
        }
    }

    @Scheduled(fixedDelayString = "${truth-feed.delivery.drain-interval:PT1S}")
    public void drainScheduled() {
        drain();
    }

    /**
     * Sends every delivery whose next attempt is due.
     *
     * @return number of successful deliveries in this pass
     */
    public int drain() {
        Instant now = clock.instant();
        List<PendingDelivery> due = new ArrayList<>();
        synchronized (queue) {
            Iterator<PendingDelivery> it = queue.iterator();
            while (it.hasNext()) {
                PendingDelivery delivery = it.next();
                if (!delivery.nextAttemptAt().isAfter(now)) {
                    due.add(delivery);
                    it.remove();
                }
            }
        }

        int delivered = 0;
        List<PendingDelivery> retries = new ArrayList<>();
        for (PendingDelivery delivery : due) {
            Subscription subscription = delivery.subscription();
            if (delivery.attempts() > 0 && !subscription.isActive()) {
                log.info("Cancelled callback retry for inactive subscription={} event={}",
                    subscription.getSubscriptionId(), delivery.event().eventId());
                continue;
            }
            try {
                callbackClient.deliver(subscription.getEndpoint(), subscription.getWebhookSecret(), delivery.event());
                subscription.recordDelivered();
                delivered++;
            } catch (CallbackDeliveryException ex) {
                int attempts = delivery.attempts() + 1;
                if (attempts >= maxAttempts) {
                    log.warn("Callback delivery of event={} to subscription={} failed after {} attempts: {}",
                        delivery.event().eventId(), subscription.getSubscriptionId(), attempts, ex.getMessage());
                    addDeadLetter(new FailedDelivery(subscription.getSubscriptionId(),
                        delivery.event().eventId(), attempts, ex.getMessage(), now));
                } else {
                    Instant next = now.plus(backoff(attempts));
                    log.warn("Callback delivery of event={} to subscription={} failed (attempt {}), retry at {}: {}",
                        delivery.event().eventId(), subscription.getSubscriptionId(), attempts, next, ex.getMessage());
                    retries.add(new PendingDelivery(subscription, delivery.event(), attempts, next));
                }
            }
        }
        if (!retries.isEmpty()) {
            synchronized (queue) {
                queue.addAll(retries);
            }
        }
        return delivered;
    }

    private void addDeadLetter(FailedDelivery failed) {
        synchronized (deadLetters) {
            deadLetters.addLast(failed);
            while (deadLetters.size() > maxDeadLetters) {
                FailedDelivery evicted = deadLetters.pollFirst();
                log.debug("Evicted dead letter for subscription={} event={}",
                    evicted.subscriptionId(), evicted.eventId());
            }
        }
    }

    private Duration backoff(int attempts) {
        Duration delay = initialBackoff;
        for (int i = 1; i < attempts && delay.compareTo(maxBackoff) < 0; i++) {
            delay = delay.multipliedBy(2);
        }
        return delay.compareTo(maxBackoff) > 0 ? maxBackoff : delay;
    }

    private record PendingDelivery(Subscription subscription, FeedEvent event, int attempts, Instant nextAttemptAt) {}

    public record FailedDelivery(String subscriptionId, String eventId, int attempts, String lastError,
                                 Instant failedAt) {}
}
