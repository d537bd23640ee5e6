package com.valuationradar.cache;

import com.valuationradar.domain.ValuationResult;

import java.util.Optional;

/**
 * Key-value store for computed valuations. Implementations throw {@link CacheStoreException} on store failure;
 * expired entries are never returned.
 */
public interface ValuationCacheStore {

    Optional<ValuationResult> get(String key);

    void put(String key, ValuationResult result, long ttlSeconds);

    void evict(String key);
}
