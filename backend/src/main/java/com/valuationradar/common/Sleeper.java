package com.valuationradar.common;

import java.time.Duration;

/**
 * Blocking pause used by the rate limiter. Tests substitute an implementation that advances a fake clock.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper THREAD = duration -> Thread.sleep(Math.max(0L, duration.toMillis()));

    void sleep(Duration duration) throws InterruptedException;
}
