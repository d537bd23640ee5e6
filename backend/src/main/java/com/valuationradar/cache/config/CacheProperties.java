package com.valuationradar.cache.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Valuation cache settings (valuationradar.cache).
 */
@ConfigurationProperties(prefix = "valuationradar.cache")
@NoArgsConstructor
@Getter
@Setter
public class CacheProperties {

    /** "mongo" (shared, default) or "caffeine" (in-process). */
    private String store = "mongo";
    private long ttlSeconds = 300;
    /** Caffeine store size bound. */
    private long maxEntries = 10_000;
}
