package com.dataops.costanomaly.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Bounded pools for the concurrent stages of a detection run. Each stage gets
 * its own pool so a slow breakdown lookup cannot starve detector execution.
 */
@Configuration
public class AsyncConfig {

    @Bean(name = "detectionExecutor")
    public ThreadPoolTaskExecutor detectionExecutor(DetectionConfig config) {
        return pool("detector-", config.getDetectorPoolSize(), 32);
    }

    @Bean(name = "enrichmentExecutor")
    public ThreadPoolTaskExecutor enrichmentExecutor(DetectionConfig config) {
        return pool("enrichment-", config.getEnrichment().getPoolSize(), 256);
    }

    @Bean(name = "alertExecutor")
    public ThreadPoolTaskExecutor alertExecutor(AlertConfig config) {
        return pool("alert-dispatch-", config.getPoolSize(), 64);
    }

    private ThreadPoolTaskExecutor pool(String prefix, int size, int queueCapacity) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setThreadNamePrefix(prefix);
        executor.setCorePoolSize(size);
        executor.setMaxPoolSize(size);
        executor.setQueueCapacity(queueCapacity);
        executor.setDaemon(true);
        executor.setWaitForTasksToCompleteOnShutdown(false);
        return executor;
    }
}
