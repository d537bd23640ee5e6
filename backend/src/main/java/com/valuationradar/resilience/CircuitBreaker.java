package com.valuationradar.resilience;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Consecutive-failure circuit breaker owned by a single provider.
 * <p>
 * CLOSED: calls pass; {@code failureThreshold} consecutive failures open the breaker.
 * OPEN: calls are refused until {@code cooldown} has elapsed since the last failure.
 * HALF_OPEN: exactly one probe is admitted; success closes, failure re-opens.
 * <p>
 * {@link #isAvailable()} only reports; {@link #tryAcquirePermission()} is what consumes the probe.
 */
@Slf4j
public class CircuitBreaker {

    private final String name;
    private final int failureThreshold;
    private final Duration cooldown;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();

    private BreakerState state = BreakerState.CLOSED;
    private int failureCount;
    private Instant lastFailureTime;
    private boolean probeInFlight;

    public CircuitBreaker(String name, int failureThreshold, Duration cooldown, Clock clock) {
        if (failureThreshold <= 0) {
            throw new IllegalArgumentException("failureThreshold must be positive");
        }
        this.name = name;
        this.failureThreshold = failureThreshold;
        this.cooldown = cooldown;
        this.clock = clock;
    }

    /**
     * Whether a call would currently be admitted. Does not change state.
     */
    public boolean isAvailable() {
        lock.lock();
        try {
            return switch (state) {
                case CLOSED -> true;
                case OPEN -> cooldownElapsed();
                case HALF_OPEN -> !probeInFlight;
            };
        } finally {
            lock.unlock();
        }
    }

    /**
     * Admits a call, moving OPEN to HALF_OPEN once the cooldown has elapsed.
     *
     * @return false when the call must be short-circuited
     */
    public boolean tryAcquirePermission() {
        lock.lock();
        try {
            switch (state) {
                case CLOSED:
                    return true;
                case OPEN:
                    if (!cooldownElapsed()) {
                        return false;
                    }
                    state = BreakerState.HALF_OPEN;
                    probeInFlight = true;
                    log.info("Circuit breaker half-open for {}, admitting probe call", name);
                    return true;
                case HALF_OPEN:
                default:
                    if (probeInFlight) {
                        return false;
                    }
                    probeInFlight = true;
                    return true;
            }
        } finally {
            lock.unlock();
        }
    }

    public void onSuccess() {
        lock.lock();
        try {
            if (state != BreakerState.CLOSED || failureCount > 0) {
                log.info("{} recovered, resetting circuit breaker (was {} with {} failures)", name, state, failureCount);
            }
            state = BreakerState.CLOSED;
            failureCount = 0;
            probeInFlight = false;
        } finally {
            lock.unlock();
        }
    }

    public void onFailure() {
        lock.lock();
        try {
            failureCount++;
            lastFailureTime = clock.instant();
            if (state == BreakerState.HALF_OPEN) {
                state = BreakerState.OPEN;
                log.error("Circuit breaker re-opened for {}: half-open probe failed", name);
            } else if (state == BreakerState.CLOSED && failureCount >= failureThreshold) {
                state = BreakerState.OPEN;
                log.error("Circuit breaker opened for {} after {} consecutive failures", name, failureCount);
            }
            probeInFlight = false;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Gives back a permission that ended with neither success nor failure (e.g. interruption),
     * so a half-open breaker can admit another probe.
     */
    public void releasePermission() {
        lock.lock();
        try {
            probeInFlight = false;
        } finally {
            lock.unlock();
        }
    }

    public CircuitBreakerSnapshot snapshot() {
        lock.lock();
        try {
            BreakerState reported = state == BreakerState.OPEN && cooldownElapsed() ? BreakerState.HALF_OPEN : state;
            return new CircuitBreakerSnapshot(reported, failureCount, lastFailureTime);
        } finally {
            lock.unlock();
        }
    }

    private boolean cooldownElapsed() {
        return lastFailureTime == null
                || !clock.instant().isBefore(lastFailureTime.plus(cooldown));
    }
}
