package com.valuationradar.cache;

import com.valuationradar.cache.config.CaffeineConfig;
import com.valuationradar.domain.ValuationResult;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.cache.Cache;
import org.springframework.cache.CacheManager;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

/**
 * In-process store over the Caffeine valuation cache. Single-instance deployments only.
 */
@Component
@ConditionalOnProperty(prefix = "valuationradar.cache", name = "store", havingValue = "caffeine")
public class CaffeineValuationCacheStore implements ValuationCacheStore {

    private final Cache cache;
    private final Clock clock;

    public CaffeineValuationCacheStore(CacheManager cacheManager, Clock clock) {
        this.cache = cacheManager.getCache(CaffeineConfig.VALUATION_CACHE);
        if (this.cache == null) {
            throw new IllegalStateException("Cache " + CaffeineConfig.VALUATION_CACHE + " is not registered");
        }
        this.clock = clock;
    }

    @Override
    public Optional<ValuationResult> get(String key) {
        CachedValuation entry = cache.get(key, CachedValuation.class);
        if (entry == null) {
            return Optional.empty();
        }
        if (!clock.instant().isBefore(entry.expiresAt())) {
            cache.evict(key);
            return Optional.empty();
        }
        return Optional.of(entry.result());
    }

    @Override
    public void put(String key, ValuationResult result, long ttlSeconds) {
        cache.put(key, new CachedValuation(result, clock.instant().plusSeconds(ttlSeconds)));
    }

    @Override
    public void evict(String key) {
        cache.evict(key);
    }

    record CachedValuation(ValuationResult result, Instant expiresAt) {
    }
}
