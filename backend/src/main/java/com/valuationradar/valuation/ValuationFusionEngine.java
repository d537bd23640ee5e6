package com.valuationradar.valuation;

import com.valuationradar.domain.NormalizedObservation;
import com.valuationradar.domain.PriceQuery;
import com.valuationradar.domain.ValuationResult;
import com.valuationradar.valuation.config.FusionProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.TreeSet;

/**
 * Fuses normalized observations into a {@link ValuationResult}: IQR outlier removal, interpolated
 * 10th/50th/90th percentiles, confidence and volatility. Pure and deterministic for a given input.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ValuationFusionEngine {

    private static final double LOW_PERCENTILE = 10;
    private static final double MEDIAN_PERCENTILE = 50;
    private static final double HIGH_PERCENTILE = 90;

    private final FusionProperties properties;

    /**
     * @throws ValuationException NO_DATA_AVAILABLE when there is nothing to fuse
     */
    public ValuationResult fuse(List<NormalizedObservation> observations, PriceQuery query) {
        if (observations == null || observations.isEmpty()) {
            throw ValuationException.noDataAvailable("Cannot fuse an empty observation set");
        }
        List<NormalizedObservation> filtered = removeOutliers(observations);
        if (filtered.isEmpty()) {
            log.warn("All {} observations were filtered as outliers, using unfiltered set", observations.size());
            filtered = observations;
        }
        return computeResult(filtered, query);
    }

    /**
     * Tukey fences on price: keeps observations inside [Q1 - k*IQR, Q3 + k*IQR], in ascending price order.
     * Returns the input unchanged below the configured minimum count.
     */
    List<NormalizedObservation> removeOutliers(List<NormalizedObservation> observations) {
        if (observations.size() < properties.getMinObservationsForOutlierRemoval()) {
            return observations;
        }
        List<NormalizedObservation> sorted = new ArrayList<>(observations);
        sorted.sort(Comparator.comparingDouble(NormalizedObservation::priceUsd));
        double[] prices = sorted.stream().mapToDouble(NormalizedObservation::priceUsd).toArray();

        double q1 = PriceStatistics.percentile(prices, 25);
        double q3 = PriceStatistics.percentile(prices, 75);
        double iqr = q3 - q1;
        double lowerBound = q1 - properties.getIqrMultiplier() * iqr;
        double upperBound = q3 + properties.getIqrMultiplier() * iqr;

        List<NormalizedObservation> kept = sorted.stream()
                .filter(o -> o.priceUsd() >= lowerBound && o.priceUsd() <= upperBound)
                .toList();
        int removed = observations.size() - kept.size();
        if (removed > 0) {
            log.info("Removed {} outliers using IQR (bounds [{}, {}], {} -> {} observations)",
                    removed, lowerBound, upperBound, observations.size(), kept.size());
        }
        return kept;
    }

    private ValuationResult computeResult(List<NormalizedObservation> observations, PriceQuery query) {
        double[] prices = observations.stream()
                .mapToDouble(NormalizedObservation::priceUsd)
                .sorted()
                .toArray();
        TreeSet<String> sources = new TreeSet<>();
        for (NormalizedObservation o : observations) {
            if (o.source() != null) {
                sources.add(o.source());
            }
        }
        return new ValuationResult(
                PriceStatistics.percentile(prices, LOW_PERCENTILE),
                PriceStatistics.percentile(prices, MEDIAN_PERCENTILE),
                PriceStatistics.percentile(prices, HIGH_PERCENTILE),
                prices.length,
                query.windowDays(),
                sources,
                confidence(prices),
                PriceStatistics.coefficientOfVariation(prices));
    }

    /**
     * weightN * min(n / saturation, 1) + weightCv * max(0, 1 - cv), clamped to [0, 1].
     */
    double confidence(double[] prices) {
        if (prices.length == 0) {
            return 0.0;
        }
        double sampleSizeFactor = Math.min((double) prices.length / Math.max(1, properties.getSampleSizeSaturation()), 1.0);
        double mean = PriceStatistics.mean(prices);
        double cv = mean > 0 ? PriceStatistics.standardDeviation(prices, mean) / mean : 1.0;
        double dispersionFactor = Math.max(0.0, 1.0 - cv);
        double confidence = properties.getSampleSizeWeight() * sampleSizeFactor
                + properties.getDispersionWeight() * dispersionFactor;
        return Math.max(0.0, Math.min(1.0, confidence));
    }
}
