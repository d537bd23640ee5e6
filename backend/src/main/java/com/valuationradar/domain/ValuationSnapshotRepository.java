package com.valuationradar.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

/**
 * Persistence for valuation_snapshots. One document per cache key; saves overwrite (last writer wins).
 */
public interface ValuationSnapshotRepository extends MongoRepository<ValuationSnapshot, String> {
}
