package com.valuationradar.orchestration;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Consumes {@link ValuationCacheWriteFailedEvent}: keeps a running count for monitoring.
 */
@Component
@Slf4j
public class CacheWriteFailureListener {

    private final AtomicLong failures = new AtomicLong();

    @EventListener
    public void onCacheWriteFailed(ValuationCacheWriteFailedEvent event) {
        long total = failures.incrementAndGet();
        log.warn("Valuation cache write failed for {} ({} failures since start): {}", event.cacheKey(), total, event.reason());
    }

    public long getFailureCount() {
        return failures.get();
    }
}
