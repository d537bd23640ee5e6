package com.valuationradar.api.dto;

import com.valuationradar.api.validation.ConditionLabel;
import com.valuationradar.domain.CallerIdentity;
import com.valuationradar.domain.PriceQuery;
import com.valuationradar.domain.StandardCondition;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;

/**
 * POST /api/v1/valuations request body. Validated with Jakarta Bean Validation.
 * Caching applies only when both userId and itemId are supplied.
 */
public record ValuationRequest(
        @NotBlank(message = "INVALID_ITEM_NAME")
        String itemName,
        String set,
        String number,
        @ConditionLabel
        String condition,
        @Positive(message = "INVALID_WINDOW")
        Integer windowDays,
        String userId,
        String itemId,
        Boolean forceRefresh
) {

    public PriceQuery toQuery() {
        StandardCondition standard = StandardCondition.fromLabel(condition).orElse(null);
        int window = windowDays != null ? windowDays : PriceQuery.DEFAULT_WINDOW_DAYS;
        return new PriceQuery(itemName.strip(), set, number, standard, window);
    }

    /** Null unless both identity parts are present. */
    public CallerIdentity identity() {
        if (userId == null || userId.isBlank() || itemId == null || itemId.isBlank()) {
            return null;
        }
        return new CallerIdentity(userId.strip(), itemId.strip());
    }

    public boolean forceRefreshOrDefault() {
        return Boolean.TRUE.equals(forceRefresh);
    }
}
