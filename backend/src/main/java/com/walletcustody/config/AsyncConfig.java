package com.walletcustody.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Named thread pools. reconciliation-executor hosts one long-lived worker per confirmation tier.
 */
@Configuration
@EnableAsync
public class AsyncConfig {

    public static final String RECONCILIATION_EXECUTOR = "reconciliation-executor";

    /** Tier loops never return until stopped; ReconciliationManager rejects more tiers than max pool size. */
    @Bean(name = RECONCILIATION_EXECUTOR)
    public ThreadPoolTaskExecutor reconciliationExecutor() {
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(4);
        e.setMaxPoolSize(8);
        e.setQueueCapacity(0);
        e.setThreadNamePrefix("reconcile-");
        e.setWaitForTasksToCompleteOnShutdown(false);
        e.initialize();
        return e;
    }
}
