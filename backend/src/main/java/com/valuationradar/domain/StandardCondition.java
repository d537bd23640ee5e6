package com.valuationradar.domain;

import java.util.Arrays;
import java.util.Optional;

/**
 * Five-level ordinal condition scale, worst to best.
 */
public enum StandardCondition {
    POOR("Poor"),
    GOOD("Good"),
    EXCELLENT("Excellent"),
    NEAR_MINT("Near Mint"),
    MINT("Mint");

    private final String label;

    StandardCondition(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    /**
     * Exact match on display label or enum name, case-insensitive. Free text goes through ConditionClassifier.
     */
    public static Optional<StandardCondition> fromLabel(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        String t = text.strip();
        return Arrays.stream(values())
                .filter(c -> c.label.equalsIgnoreCase(t) || c.name().equalsIgnoreCase(t))
                .findFirst();
    }
}
