package com.valuationradar.orchestration;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class CacheWriteFailureListenerTest {

    @Test
    void countsFailures() {
        CacheWriteFailureListener listener = new CacheWriteFailureListener();

        listener.onCacheWriteFailed(new ValuationCacheWriteFailedEvent("u#1", "down"));
        listener.onCacheWriteFailed(new ValuationCacheWriteFailedEvent("u#2", "down"));

        assertThat(listener.getFailureCount()).isEqualTo(2);
    }
}
