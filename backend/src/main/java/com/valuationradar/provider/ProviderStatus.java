package com.valuationradar.provider;

import com.valuationradar.resilience.BreakerState;

import java.time.Instant;

/**
 * Monitoring view of one provider.
 */
public record ProviderStatus(
        String name,
        boolean available,
        BreakerState breakerState,
        int failureCount,
        Instant lastFailureTime
) {
}
