package com.truthfeed.feed;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.List;

@Configuration
public class FeedConfiguration {

    /**
     * Global feeds for every feed type. Retention follows the regulatory
     * record-keeping horizon of each category.
     */
    static final List<CoreFeed> CORE_FEEDS = List.of(
        new CoreFeed(FeedType.TRUST_SCORE, UpdateFrequency.REAL_TIME, 2555),
        new CoreFeed(FeedType.COMPLIANCE_EVENTS, UpdateFrequency.EVENT_DRIVEN, 2555),
        new CoreFeed(FeedType.REGULATORY_UPDATES, UpdateFrequency.EVENT_DRIVEN, 3650),
        new CoreFeed(FeedType.EXPERT_OPINIONS, UpdateFrequency.EVENT_DRIVEN, 1825),
        new CoreFeed(FeedType.AUDIT_ACTIVITIES, UpdateFrequency.REAL_TIME, 2555)
    );

    @Bean
    public FeedRegistry feedRegistry(Clock clock) {
        FeedRegistry registry = new FeedRegistry(clock);
        for (CoreFeed core : CORE_FEEDS) {
            registry.registerFeed(core.type(), null, core.frequency(), core.retentionDays());
        }
        return registry;
    }

    record CoreFeed(FeedType type, UpdateFrequency frequency, int retentionDays) {}
}
