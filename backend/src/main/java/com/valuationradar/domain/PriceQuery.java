package com.valuationradar.domain;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Immutable valuation request. {@code windowDays} bounds the age of observations.
 *
 * @param set       optional set/series name
 * @param number    optional collector number within the set
 * @param condition optional condition filter; null means any condition
 */
public record PriceQuery(String itemName, String set, String number, StandardCondition condition, int windowDays) {

    public static final int DEFAULT_WINDOW_DAYS = 14;

    public PriceQuery {
        Objects.requireNonNull(itemName, "itemName");
        if (itemName.isBlank()) {
            throw new IllegalArgumentException("itemName must not be blank");
        }
        if (windowDays <= 0) {
            throw new IllegalArgumentException("windowDays must be positive");
        }
    }

    public static PriceQuery of(String itemName) {
        return new PriceQuery(itemName, null, null, null, DEFAULT_WINDOW_DAYS);
    }

    /**
     * Name, set and number joined by spaces, skipping absent parts.
     */
    public String keywords() {
        List<String> parts = new ArrayList<>();
        parts.add(itemName.strip());
        if (set != null && !set.isBlank()) {
            parts.add(set.strip());
        }
        if (number != null && !number.isBlank()) {
            parts.add(number.strip());
        }
        return String.join(" ", parts);
    }
}
