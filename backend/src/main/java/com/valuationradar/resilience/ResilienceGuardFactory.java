package com.valuationradar.resilience;

import com.valuationradar.common.RetryPolicy;
import com.valuationradar.common.Sleeper;
import com.valuationradar.common.SlidingWindowRateLimiter;
import com.valuationradar.resilience.config.ResilienceProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;

/**
 * Builds one {@link ResilienceGuard} per provider. Each call returns fresh breaker and limiter state,
 * so no state is shared across providers.
 */
@Component
@RequiredArgsConstructor
public class ResilienceGuardFactory {

    private final ResilienceProperties properties;
    private final Clock clock;
    private final Sleeper sleeper;

    /**
     * @param maxRequestsPerWindow provider ceiling; non-positive falls back to the configured default
     */
    public ResilienceGuard create(String providerName, int maxRequestsPerWindow) {
        int ceiling = maxRequestsPerWindow > 0 ? maxRequestsPerWindow : properties.getDefaultMaxRequestsPerWindow();
        CircuitBreaker breaker = new CircuitBreaker(
                providerName,
                properties.getFailureThreshold(),
                Duration.ofMillis(properties.getCooldownMs()),
                clock);
        SlidingWindowRateLimiter limiter = new SlidingWindowRateLimiter(
                providerName,
                ceiling,
                Duration.ofMillis(properties.getRateWindowMs()),
                clock,
                sleeper);
        ResilienceProperties.Retry retry = properties.getRetry();
        RetryPolicy retryPolicy = new RetryPolicy(retry.getBaseDelayMs(), retry.getJitterFactor(), retry.getMaxAttempts());
        return new ResilienceGuard(providerName, breaker, limiter, retryPolicy);
    }
}
