package com.valuationradar.domain;

import java.time.Instant;

/**
 * One price point as reported by a provider, before currency and condition normalization.
 *
 * @param currency  ISO 4217 code as reported, e.g. "USD", "EUR"
 * @param condition provider's free-text condition
 * @param listingUrl optional link to the listing or product page
 */
public record RawObservation(
        String source,
        double price,
        String currency,
        String condition,
        Instant observedDate,
        String listingUrl
) {
}
