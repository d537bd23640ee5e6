package com.valuationradar.valuation;

import com.valuationradar.valuation.config.FusionProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Converts prices to USD with the static rate table from {@link FusionProperties#getCurrencyRates()}.
 * Unknown codes pass through unconverted.
 */
@Slf4j
@Component
public class CurrencyConverter {

    private final Map<String, Double> usdRates;

    public CurrencyConverter(FusionProperties properties) {
        this.usdRates = properties.getCurrencyRates().entrySet().stream()
                .filter(e -> e.getKey() != null && e.getValue() != null && e.getValue() > 0)
                .collect(Collectors.toUnmodifiableMap(e -> e.getKey().toUpperCase(Locale.ROOT).strip(), Map.Entry::getValue));
    }

    public double toUsd(double price, String currency) {
        Double rate = currency == null ? null : usdRates.get(currency.toUpperCase(Locale.ROOT).strip());
        if (rate == null) {
            log.warn("Unknown currency {}, assuming USD", currency);
            return price;
        }
        return price * rate;
    }

    public boolean isKnown(String currency) {
        return currency != null && usdRates.containsKey(currency.toUpperCase(Locale.ROOT).strip());
    }
}
