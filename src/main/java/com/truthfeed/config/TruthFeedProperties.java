package com.truthfeed.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Engine settings bound from {@code truth-feed.*}.
 *
 * <pre>
 * truth-feed:
 *   dispatch:
 *     async: true
 *     core-pool-size: 4
 *   delivery:
 *     max-attempts: 8
 *     initial-backoff: 1s
 *     drain-interval: 1s
 *     max-dead-letters: 1000
 *   subscription:
 *     default-rate-limit: 1000
 *     rate-period: 1h
 *     release-interval: 1m
 *   anchoring:
 *     endpoint: https://anchor.example.com/v1/anchors
 *     retry-initial-backoff: 5s
 *     retry-interval: 30s
 *   archival:
 *     interval: 1h
 *   trust:
 *     stake-normalization: 1000
 * </pre>
 *
 * Missing sections fall back to the defaults applied in the compact constructors.
 */
@ConfigurationProperties(prefix = "truth-feed")
public record TruthFeedProperties(
    Dispatch dispatch,
    Delivery delivery,
    Subscription subscription,
    Anchoring anchoring,
    Archival archival,
    Trust trust
) {

    public TruthFeedProperties {
        dispatch = dispatch != null ? dispatch : new Dispatch(null, 0, 0, 0);
        delivery = delivery != null ? delivery : new Delivery(0, null, null, null, 0);
        subscription = subscription != null ? subscription : new Subscription(0, null, null);
        anchoring = anchoring != null ? anchoring : new Anchoring(null, null, null, null);
        archival = archival != null ? archival : new Archival(null);
        trust = trust != null ? trust : new Trust(0);
    }

    public static TruthFeedProperties defaults() {
        return new TruthFeedProperties(null, null, null, null, null, null);
    }

    /**
     * Post-append work (integrity updates, subscription matching). With
     * {@code async=false} it runs on the appending thread.
     */
    public record Dispatch(Boolean async, int corePoolSize, int maxPoolSize, int queueCapacity) {
        public Dispatch {
            async = async == null || async;
            corePoolSize = corePoolSize > 0 ? corePoolSize : 4;
            maxPoolSize = maxPoolSize >= corePoolSize ? maxPoolSize : Math.max(corePoolSize, 8);
            queueCapacity = queueCapacity > 0 ? queueCapacity : 1000;
        }
    }

    /** Outbound callback delivery retries. Only the newest dead letters are kept. */
    public record Delivery(int maxAttempts, Duration initialBackoff, Duration maxBackoff, Duration drainInterval,
                           int maxDeadLetters) {
        public Delivery {
            maxAttempts = maxAttempts > 0 ? maxAttempts : 8;
            initialBackoff = initialBackoff != null ? initialBackoff : Duration.ofSeconds(1);
            maxBackoff = maxBackoff != null ? maxBackoff : Duration.ofMinutes(10);
            drainInterval = drainInterval != null ? drainInterval : Duration.ofSeconds(1);
            maxDeadLetters = maxDeadLetters > 0 ? maxDeadLetters : 1000;
        }
    }

    /** Defaults for new subscriptions and the deferred-delivery release job. */
    public record Subscription(int defaultRateLimit, Duration ratePeriod, Duration releaseInterval) {
        public Subscription {
            defaultRateLimit = defaultRateLimit > 0 ? defaultRateLimit : 1000;
            ratePeriod = ratePeriod != null ? ratePeriod : Duration.ofHours(1);
            releaseInterval = releaseInterval != null ? releaseInterval : Duration.ofMinutes(1);
        }
    }

    /** Optional remote anchoring endpoint plus the retry schedule for pending anchors. */
    public record Anchoring(String endpoint, Duration retryInitialBackoff, Duration retryMaxBackoff,
                            Duration retryInterval) {
        public Anchoring {
            retryInitialBackoff = retryInitialBackoff != null ? retryInitialBackoff : Duration.ofSeconds(5);
            retryMaxBackoff = retryMaxBackoff != null ? retryMaxBackoff : Duration.ofMinutes(30);
            retryInterval = retryInterval != null ? retryInterval : Duration.ofSeconds(30);
        }
    }

    public record Archival(Duration interval) {
        public Archival {
            interval = interval != null ? interval : Duration.ofHours(1);
        }
    }

    /** Expert stake is divided by this value to obtain its weight. */
    public record Trust(double stakeNormalization) {
        public Trust {
            stakeNormalization = stakeNormalization > 0 ? stakeNormalization : 1000.0;
        }
    }
}
