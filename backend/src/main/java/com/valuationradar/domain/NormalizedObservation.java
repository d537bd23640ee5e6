package com.valuationradar.domain;

import java.time.Instant;

/**
 * Observation in USD on the standard condition scale. {@code priceUsd} is finite and positive.
 */
public record NormalizedObservation(
        String source,
        double priceUsd,
        StandardCondition standardCondition,
        Instant observedDate,
        String listingUrl
) {

    public NormalizedObservation {
        if (!Double.isFinite(priceUsd) || priceUsd <= 0) {
            throw new IllegalArgumentException("priceUsd must be finite and positive: " + priceUsd);
        }
    }
}
