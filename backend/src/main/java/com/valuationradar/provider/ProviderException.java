package com.valuationradar.provider;

/**
 * Thrown when a provider call fails (HTTP status, transport error or unusable response shape).
 * Retried by the resilience guard; never escapes {@link PriceProvider#fetchComparables}.
 */
public class ProviderException extends RuntimeException {

    public ProviderException(String message) {
        super(message);
    }

    public ProviderException(String message, Throwable cause) {
        super(message, cause);
    }
}
