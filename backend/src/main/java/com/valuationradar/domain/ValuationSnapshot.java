package com.valuationradar.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Cached valuation per caller+item, persisted in valuation_snapshots.
 * A TTL index on expiresAt removes expired documents; readers also ignore them before the TTL monitor runs.
 */
@Document(collection = "valuation_snapshots")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class ValuationSnapshot {

    /** Cache key, see {@link CallerIdentity#cacheKey()}. */
    @Id
    @EqualsAndHashCode.Include
    private String id;
    private ValuationResult result;
    private Instant createdAt;
    @Indexed(expireAfterSeconds = 0)
    private Instant expiresAt;

    public boolean isExpired(Instant now) {
        return expiresAt == null || !now.isBefore(expiresAt);
    }
}
