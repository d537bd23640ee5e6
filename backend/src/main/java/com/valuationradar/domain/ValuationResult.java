package com.valuationradar.domain;

import java.util.Collections;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Fused valuation. Immutable once produced.
 *
 * @param sources    names of providers that contributed observations after outlier removal, sorted
 * @param confidence 0..1 from sample size and dispersion
 * @param volatility coefficient of variation, never negative
 */
public record ValuationResult(
        double valueLow,
        double valueMedian,
        double valueHigh,
        int observationCount,
        int windowDays,
        SortedSet<String> sources,
        double confidence,
        double volatility
) {

    public ValuationResult {
        sources = sources == null
                ? Collections.emptySortedSet()
                : Collections.unmodifiableSortedSet(new TreeSet<>(sources));
    }
}
