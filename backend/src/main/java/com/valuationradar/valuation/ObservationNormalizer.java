package com.valuationradar.valuation;

import com.valuationradar.domain.NormalizedObservation;
import com.valuationradar.domain.RawObservation;
import com.valuationradar.domain.StandardCondition;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Converts raw provider observations to USD on the standard condition scale.
 * Records with a non-positive or non-finite price (before or after conversion) are dropped and counted.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ObservationNormalizer {

    private final CurrencyConverter currencyConverter;
    private final ConditionClassifier conditionClassifier;

    public List<NormalizedObservation> normalize(List<RawObservation> observations) {
        if (observations == null || observations.isEmpty()) {
            return List.of();
        }
        List<NormalizedObservation> normalized = new ArrayList<>(observations.size());
        int dropped = 0;
        for (RawObservation raw : observations) {
            if (raw == null || !isUsablePrice(raw.price())) {
                dropped++;
                continue;
            }
            double priceUsd = currencyConverter.toUsd(raw.price(), raw.currency());
            if (!isUsablePrice(priceUsd)) {
                dropped++;
                continue;
            }
            StandardCondition condition = conditionClassifier.classify(raw.condition());
            normalized.add(new NormalizedObservation(raw.source(), priceUsd, condition, raw.observedDate(), raw.listingUrl()));
        }
        if (dropped > 0) {
            log.info("Normalized {} observations from {} raw ({} dropped for unusable price)",
                    normalized.size(), observations.size(), dropped);
        } else {
            log.debug("Normalized {} observations", normalized.size());
        }
        return normalized;
    }

    private static boolean isUsablePrice(double price) {
        return Double.isFinite(price) && price > 0;
    }
}
