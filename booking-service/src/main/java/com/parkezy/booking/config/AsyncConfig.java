package com.parkezy.booking.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

/**
 * Thread pool that delivers subscription snapshots off the committing thread.
 */
@Configuration
public class AsyncConfig {

    @Bean(name = "subscriptionExecutor")
    public Executor subscriptionExecutor(
            @Value("${parking.subscription.executor.core-pool-size:4}") int corePoolSize,
            @Value("${parking.subscription.executor.max-pool-size:16}") int maxPoolSize,
            @Value("${parking.subscription.executor.queue-capacity:500}") int queueCapacity) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(corePoolSize);
        executor.setMaxPoolSize(maxPoolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("subscription-");
        executor.initialize();
        return executor;
    }
}
