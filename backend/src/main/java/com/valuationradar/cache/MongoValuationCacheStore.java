package com.valuationradar.cache;

import com.valuationradar.domain.ValuationResult;
import com.valuationradar.domain.ValuationSnapshot;
import com.valuationradar.domain.ValuationSnapshotRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.data.mapping.MappingException;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

/**
 * valuation_snapshots backed store. Expiry is enforced on read; the TTL index on expiresAt removes documents later.
 * Driver failures and documents that no longer map onto {@link ValuationSnapshot} surface as {@link CacheStoreException}.
 */
@Component
@ConditionalOnProperty(prefix = "valuationradar.cache", name = "store", havingValue = "mongo", matchIfMissing = true)
@RequiredArgsConstructor
public class MongoValuationCacheStore implements ValuationCacheStore {

    private final ValuationSnapshotRepository repository;
    private final Clock clock;

    @Override
    public Optional<ValuationResult> get(String key) {
        try {
            Instant now = clock.instant();
            return repository.findById(key)
                    .filter(snapshot -> !snapshot.isExpired(now))
                    .map(ValuationSnapshot::getResult);
        } catch (DataAccessException | MappingException e) {
            throw new CacheStoreException("Failed to read valuation snapshot " + key, e);
        }
    }

    @Override
    public void put(String key, ValuationResult result, long ttlSeconds) {
        Instant now = clock.instant();
        ValuationSnapshot snapshot = new ValuationSnapshot();
        snapshot.setId(key);
        snapshot.setResult(result);
        snapshot.setCreatedAt(now);
        snapshot.setExpiresAt(now.plusSeconds(ttlSeconds));
        try {
            repository.save(snapshot);
        } catch (DataAccessException | MappingException e) {
            throw new CacheStoreException("Failed to write valuation snapshot " + key, e);
        }
    }

    @Override
    public void evict(String key) {
        try {
            repository.deleteById(key);
        } catch (DataAccessException | MappingException e) {
            throw new CacheStoreException("Failed to delete valuation snapshot " + key, e);
        }
    }
}
