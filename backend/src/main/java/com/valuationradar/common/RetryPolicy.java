package com.valuationradar.common;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Exponential backoff for provider retries, with optional jitter.
 * maxAttempts counts the initial call: 3 means one call plus two retries.
 */
public final class RetryPolicy {

    private final long baseDelayMs;
    private final double jitterFactor;
    private final int maxAttempts;

    public RetryPolicy(long baseDelayMs, double jitterFactor, int maxAttempts) {
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException("maxAttempts must be positive");
        }
        this.baseDelayMs = Math.max(0L, baseDelayMs);
        this.jitterFactor = Math.max(0.0, jitterFactor);
        this.maxAttempts = maxAttempts;
    }

    /**
     * Delay in milliseconds after the given zero-based failed attempt.
     * Formula: baseDelay * 2^attempt, then ±jitter.
     */
    public long delayMs(int attempt) {
        if (attempt <= 0) {
            return jitter(baseDelayMs);
        }
        long exponential = baseDelayMs * (1L << Math.min(attempt, 20));
        return jitter(exponential);
    }

    private long jitter(long value) {
        if (jitterFactor == 0.0) {
            return value;
        }
        ThreadLocalRandom r = ThreadLocalRandom.current();
        double jitter = 1.0 + (r.nextDouble() * 2.0 - 1.0) * jitterFactor;
        return Math.max(0, (long) (value * jitter));
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    /**
     * Default: 1s base, no jitter, 3 attempts (waits of 1s and 2s between them).
     */
    public static RetryPolicy defaultPolicy() {
        return new RetryPolicy(1000L, 0.0, 3);
    }
}
