package com.valuationradar.valuation;

import lombok.Getter;

/**
 * Fatal valuation outcome. The API layer maps NO_PROVIDERS_AVAILABLE to 503 and NO_DATA_AVAILABLE to 404.
 */
@Getter
public class ValuationException extends RuntimeException {

    private final Kind kind;

    public ValuationException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public static ValuationException noProvidersAvailable(String message) {
        return new ValuationException(Kind.NO_PROVIDERS_AVAILABLE, message);
    }

    public static ValuationException noDataAvailable(String message) {
        return new ValuationException(Kind.NO_DATA_AVAILABLE, message);
    }

    public enum Kind {
        /** Every provider's breaker is open (or none is registered). */
        NO_PROVIDERS_AVAILABLE,
        /** Providers were called but no usable observation came back. */
        NO_DATA_AVAILABLE
    }
}
