package com.valuationradar.cache.config;

import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.cache.CacheManager;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.cache.caffeine.CaffeineCacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.TimeUnit;

/**
 * Caffeine in-process caches. The valuation cache backs the caffeine cache store; entries carry their own
 * expiry, the Caffeine bound only caps memory.
 */
@Configuration
@EnableCaching
public class CaffeineConfig {

    public static final String VALUATION_CACHE = "valuationCache";

    @Bean
    public CacheManager caffeineCacheManager(CacheProperties cacheProperties) {
        CaffeineCacheManager manager = new CaffeineCacheManager();
        manager.registerCustomCache(VALUATION_CACHE, Caffeine.newBuilder()
                .expireAfterWrite(cacheProperties.getTtlSeconds(), TimeUnit.SECONDS)
                .maximumSize(cacheProperties.getMaxEntries())
                .build());
        return manager;
    }
}
