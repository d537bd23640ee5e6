package com.valuationradar.resilience;

/**
 * Circuit breaker states. HALF_OPEN admits a single probe call.
 */
public enum BreakerState {
    CLOSED,
    OPEN,
    HALF_OPEN
}
