package com.valuationradar.domain;

/**
 * Caller and item the cached valuation belongs to. Not verified here; authentication happens upstream.
 */
public record CallerIdentity(String userId, String itemId) {

    public CallerIdentity {
        if (userId == null || userId.isBlank() || itemId == null || itemId.isBlank()) {
            throw new IllegalArgumentException("userId and itemId are required");
        }
    }

    /** Cache key: user and item joined with '#'. */
    public String cacheKey() {
        return userId + "#" + itemId;
    }
}
