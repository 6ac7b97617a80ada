package com.truthfeed.config;

import com.truthfeed.bus.KeyedSerialExecutor;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.SyncTaskExecutor;
import org.springframework.core.task.TaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ThreadPoolExecutor;

@Configuration
public class EngineConfiguration {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Executor for work that follows a durable append. Falls back to the
     * caller's thread when async dispatch is disabled.
     */
    @Bean
    public TaskExecutor dispatchTaskExecutor(TruthFeedProperties properties) {
        TruthFeedProperties.Dispatch dispatch = properties.dispatch();
        if (!dispatch.async()) {
            return new SyncTaskExecutor();
        }
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(dispatch.corePoolSize());
        executor.setMaxPoolSize(dispatch.maxPoolSize());
        executor.setQueueCapacity(dispatch.queueCapacity());
        executor.setKeepAliveSeconds(60);
        executor.setThreadNamePrefix("Dispatch-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.initialize();
        return executor;
    }

    /** Serializes integrity updates per subject. */
    @Bean
    public KeyedSerialExecutor integrityDispatcher(TaskExecutor dispatchTaskExecutor) {
        return new KeyedSerialExecutor(dispatchTaskExecutor);
    }

    /** Serializes subscription matching per feed so deliveries keep feed order. */
    @Bean
    public KeyedSerialExecutor deliveryDispatcher(TaskExecutor dispatchTaskExecutor) {
        return new KeyedSerialExecutor(dispatchTaskExecutor);
    }

    @Bean
    public RestTemplate outboundRestTemplate(RestTemplateBuilder builder) {
        return builder
            .setConnectTimeout(Duration.ofSeconds(5))
            .setReadTimeout(Duration.ofSeconds(10))
            .build();
    }
}
