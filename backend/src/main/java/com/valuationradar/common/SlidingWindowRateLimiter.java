package com.valuationradar.common;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Sliding-window rate limiter: at most {@code maxRequests} permits within any trailing window.
 * When the window is full the caller waits until the oldest permit leaves it, then re-checks.
 * Requests are delayed, never dropped. The lock is not held while sleeping.
 */
@Slf4j
public class SlidingWindowRateLimiter {

    private final String name;
    private final int maxRequests;
    private final long windowMs;
    private final Clock clock;
    private final Sleeper sleeper;
    private final Deque<Long> requestTimestamps = new ArrayDeque<>();
    private final ReentrantLock lock = new ReentrantLock();

    /**
     * @param maxRequests permits per window, e.g. 20 for 20 requests per minute
     * @param window      trailing window length, typically one minute
     */
    public SlidingWindowRateLimiter(String name, int maxRequests, Duration window, Clock clock, Sleeper sleeper) {
        if (maxRequests <= 0) {
            throw new IllegalArgumentException("maxRequests must be positive");
        }
        if (window == null || window.isZero() || window.isNegative()) {
            throw new IllegalArgumentException("window must be positive");
        }
        this.name = name;
        this.maxRequests = maxRequests;
        this.windowMs = window.toMillis();
        this.clock = clock;
        this.sleeper = sleeper;
    }

    /**
     * Blocks until a permit is available, then records it.
     *
     * @throws InterruptedException when interrupted while waiting for the window to free up
     */
    public void acquire() throws InterruptedException {
        while (true) {
            long waitMs;
            lock.lock();
            try {
                long now = clock.millis();
                evictExpired(now);
                if (requestTimestamps.size() < maxRequests) {
                    requestTimestamps.addLast(now);
                    return;
                }
                waitMs = Math.max(1L, requestTimestamps.peekFirst() + windowMs - now);
            } finally {
                lock.unlock();
            }
            log.warn("Rate limit reached for {} ({} per {}ms), waiting {}ms", name, maxRequests, windowMs, waitMs);
            sleeper.sleep(Duration.ofMillis(waitMs));
        }
    }

    /**
     * Non-blocking: returns true if a permit was taken, false if the window is full.
     */
    public boolean tryAcquire() {
        lock.lock();
        try {
            long now = clock.millis();
            evictExpired(now);
            if (requestTimestamps.size() < maxRequests) {
                requestTimestamps.addLast(now);
                return true;
            }
            return false;
        } finally {
            lock.unlock();
        }
    }

    /** Permits currently counted inside the window. */
    public int inFlightWindowCount() {
        lock.lock();
        try {
            evictExpired(clock.millis());
            return requestTimestamps.size();
        } finally {
            lock.unlock();
        }
    }

    private void evictExpired(long now) {
        long windowStart = now - windowMs;
        while (!requestTimestamps.isEmpty() && requestTimestamps.peekFirst() <= windowStart) {
            requestTimestamps.pollFirst();
        }
    }
}
