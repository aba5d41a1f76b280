package com.shortener.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
public class TelemetryConfig {

    private static final int QUEUE_CAPACITY = 1_000;

    // Events are dropped to the local fallback once the queue is full.
    @Bean
    public ThreadPoolTaskExecutor telemetryExecutor(TelemetryProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setThreadNamePrefix("telemetry-");
        executor.setCorePoolSize(properties.executorThreads());
        executor.setMaxPoolSize(properties.executorThreads());
        executor.setQueueCapacity(QUEUE_CAPACITY);
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(5);
        return executor;
    }
}
