package com.valuationradar.valuation.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.HashMap;
import java.util.Map;

/**
 * Normalization and fusion tunables. Documented in application.yml under valuationradar.fusion.
 */
@ConfigurationProperties(prefix = "valuationradar.fusion")
@NoArgsConstructor
@Getter
@Setter
public class FusionProperties {

    /** Weight of the sample-size factor in confidence. */
    private double sampleSizeWeight = 0.6;

    /** Weight of the dispersion factor (1 - coefficient of variation) in confidence. */
    private double dispersionWeight = 0.4;

    /** Observation count at which the sample-size factor saturates at 1. */
    private int sampleSizeSaturation = 50;

    /** Tukey fence multiplier applied to the IQR. */
    private double iqrMultiplier = 1.5;

    /** Below this count outlier removal is skipped. */
    private int minObservationsForOutlierRemoval = 4;

    /**
     * Currency code -> USD per unit. Static table; entries from configuration are merged over the defaults.
     */
    private Map<String, Double> currencyRates = new HashMap<>(Map.of(
            "USD", 1.0,
            "EUR", 1.08,
            "GBP", 1.27,
            "CAD", 0.73,
            "AUD", 0.65,
            "JPY", 0.0067
    ));
}
