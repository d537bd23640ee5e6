package com.valuationradar.resilience;

import com.valuationradar.common.RetryPolicy;
import com.valuationradar.common.SlidingWindowRateLimiter;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.concurrent.Callable;

/**
 * Per-provider resilience wrapper: circuit breaker, then sliding-window rate limit, then bounded retry.
 * Every attempt (retries included) takes a rate-limiter slot. Only exhausting all attempts counts as one
 * breaker failure. Never throws: failures and short-circuits yield an empty list.
 */
@Slf4j
public class ResilienceGuard {

    private final String name;
    private final CircuitBreaker circuitBreaker;
    private final SlidingWindowRateLimiter rateLimiter;
    private final Retry retry;
    private final int maxAttempts;

    public ResilienceGuard(String name, CircuitBreaker circuitBreaker, SlidingWindowRateLimiter rateLimiter,
                           RetryPolicy retryPolicy) {
        this.name = name;
        this.circuitBreaker = circuitBreaker;
        this.rateLimiter = rateLimiter;
        this.maxAttempts = retryPolicy.getMaxAttempts();
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(retryPolicy.getMaxAttempts())
                .intervalFunction(attempt -> retryPolicy.delayMs(attempt - 1))
                .retryExceptions(Exception.class)
                .ignoreExceptions(InterruptedException.class)
                .build();
        this.retry = Retry.of(name, config);
        this.retry.getEventPublisher().onRetry(event -> log.warn(
                "{} fetch attempt {} failed, retrying in {}ms: {}",
                name, event.getNumberOfRetryAttempts(), event.getWaitInterval().toMillis(),
                messageOf(event.getLastThrowable())));
    }

    public boolean isAvailable() {
        return circuitBreaker.isAvailable();
    }

    /**
     * Runs the operation under breaker, limiter and retry.
     *
     * @return the operation's result, or an empty list when short-circuited, interrupted or exhausted
     */
    public <T> List<T> execute(Callable<List<T>> operation) {
        if (!circuitBreaker.tryAcquirePermission()) {
            log.warn("{} unavailable due to open circuit breaker, skipping call", name);
            return List.of();
        }
        try {
            List<T> result = retry.executeCallable(() -> {
                rateLimiter.acquire();
                return operation.call();
            });
            circuitBreaker.onSuccess();
            return result != null ? result : List.of();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            circuitBreaker.releasePermission();
            log.warn("{} call interrupted while waiting for rate limiter", name);
            return List.of();
        } catch (Exception e) {
            if (Thread.currentThread().isInterrupted()) {
                circuitBreaker.releasePermission();
                log.warn("{} call interrupted during retry backoff", name);
                return List.of();
            }
            circuitBreaker.onFailure();
            log.error("{} failed after {} attempts: {}", name, maxAttempts, messageOf(e), e);
            return List.of();
        }
    }

    public CircuitBreakerSnapshot breakerSnapshot() {
        return circuitBreaker.snapshot();
    }

    public String getName() {
        return name;
    }

    private static String messageOf(Throwable t) {
        if (t == null) {
            return "unknown error";
        }
        return t.getMessage() != null ? t.getMessage() : t.getClass().getSimpleName();
    }
}
