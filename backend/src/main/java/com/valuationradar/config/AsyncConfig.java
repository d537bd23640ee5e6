package com.valuationradar.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

/**
 * Named thread pools. provider-fetch-executor runs availability probes and provider fetches for every query.
 */
@Configuration
public class AsyncConfig {

    public static final String PROVIDER_EXECUTOR = "provider-fetch-executor";

    /**
     * Direct hand-off, no queue: every probe and fetch gets its own thread right away, so one query's slow
     * provider never delays another query's fast one. Past the max the pool rejects and the orchestrator
     * counts that provider as failed.
     */
    @Bean(name = PROVIDER_EXECUTOR)
    public Executor providerFetchExecutor() {
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(12);
        e.setMaxPoolSize(96);
        e.setQueueCapacity(0);
        e.setKeepAliveSeconds(60);
        e.setThreadNamePrefix("provider-fetch-");
        e.initialize();
        return e;
    }
}
