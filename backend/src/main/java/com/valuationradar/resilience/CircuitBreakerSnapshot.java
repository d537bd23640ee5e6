package com.valuationradar.resilience;

import java.time.Instant;

/**
 * Point-in-time copy of one provider's breaker state, for monitoring.
 *
 * @param lastFailureTime null until the first failure
 */
public record CircuitBreakerSnapshot(BreakerState state, int failureCount, Instant lastFailureTime) {

    public boolean isOpen() {
        return state == BreakerState.OPEN;
    }
}
