package com.valuationradar.orchestration;

/**
 * Application event: a computed valuation could not be cached. The valuation itself was still returned.
 */
public record ValuationCacheWriteFailedEvent(String cacheKey, String reason) {
}
