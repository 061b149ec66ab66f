package com.fintech.supply.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;

/**
 * Core beans for the reconciliation engine.
 */
@Configuration
@EnableConfigurationProperties(ReconciliationProperties.class)
@Slf4j
public class ReconciliationConfig {

    @Value("${reconciliation.fetch-pool.core-size:4}")
    private int corePoolSize;

    @Value("${reconciliation.fetch-pool.max-size:16}")
    private int maxPoolSize;

    @Value("${reconciliation.fetch-pool.queue-capacity:100}")
    private int queueCapacity;

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Runs the layer one and layer two fetches of a reconciliation side by side.
     * Retry backoff sleeps happen on these threads, so the pool bounds how many
     * fetches can be waiting at once.
     */
    @Bean(name = "supplyFetchExecutor")
    public ThreadPoolTaskExecutor supplyFetchExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(corePoolSize);
        executor.setMaxPoolSize(maxPoolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("supply-fetch-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        log.info("Supply fetch executor configured: core={}, max={}, queue={}",
                corePoolSize, maxPoolSize, queueCapacity);
        return executor;
    }
}
