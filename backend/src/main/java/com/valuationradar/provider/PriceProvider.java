package com.valuationradar.provider;

import com.valuationradar.domain.PriceQuery;
import com.valuationradar.domain.RawObservation;

import java.util.List;

/**
 * One external source of comparable price observations. Implementations are Spring beans; the orchestrator
 * works on the registered set and never names a concrete provider.
 */
public interface PriceProvider {

    /** Source name stamped on every observation, e.g. "eBay". */
    String getName();

    /**
     * Fetch comparable observations for the query. Never throws: failures, open breakers and exhausted
     * retries yield an empty list.
     */
    List<RawObservation> fetchComparables(PriceQuery query);

    /** False while this provider's circuit breaker refuses calls. */
    boolean isAvailable();

    ProviderStatus getStatus();
}
