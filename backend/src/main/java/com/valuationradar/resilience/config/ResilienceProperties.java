package com.valuationradar.resilience.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Circuit breaker, rate limiter and retry settings shared by every provider. Documented in application.yml.
 */
@ConfigurationProperties(prefix = "valuationradar.resilience")
@NoArgsConstructor
@Getter
@Setter
public class ResilienceProperties {

    /** Consecutive exhausted calls before the breaker opens. Default 5. */
    private int failureThreshold = 5;

    /** Time after the last failure before a half-open probe is admitted. Default 60s. */
    private long cooldownMs = 60_000L;

    /** Sliding window length for rate limiting. Default 60s. */
    private long rateWindowMs = 60_000L;

    /** Permits per window for providers that do not set their own. Default 30. */
    private int defaultMaxRequestsPerWindow = 30;

    private Retry retry = new Retry();

    @NoArgsConstructor
    @Getter
    @Setter
    public static class Retry {
        /** Delay before the first retry; doubles each attempt. Default 1000. */
        private long baseDelayMs = 1000L;
        /** Jitter factor 0..1 (0.2 = ±20%). Default 0. */
        private double jitterFactor = 0.0;
        /** Total attempts including the initial call. Default 3. */
        private int maxAttempts = 3;
    }
}
