package com.valuationradar.valuation;

import com.valuationradar.domain.NormalizedObservation;
import com.valuationradar.domain.PriceQuery;
import com.valuationradar.domain.StandardCondition;
import com.valuationradar.domain.ValuationResult;
import com.valuationradar.valuation.config.FusionProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class ValuationFusionEngineTest {

    private static final Instant SOLD = Instant.parse("2025-03-01T10:00:00Z");
    private static final PriceQuery QUERY = PriceQuery.of("Charizard");

    private FusionProperties properties;
    private ValuationFusionEngine engine;

    @BeforeEach
    void setUp() {
        properties = new FusionProperties();
        engine = new ValuationFusionEngine(properties);
    }

    @Test
    @DisplayName("three-source scenario: the $500 outlier is excluded and the median is about $51")
    void threeSourceScenario() {
        List<NormalizedObservation> observations = new ArrayList<>();
        observations.addAll(obs("SourceA", 46, 47, 48, 49, 50, 50, 51, 52, 53, 54));
        observations.addAll(obs("SourceB", 48, 49, 50, 50, 51, 51, 52, 52, 52, 53, 53, 54, 54, 55, 56));
        observations.addAll(obs("SourceC", 500));

        ValuationResult result = engine.fuse(observations, QUERY);

        assertThat(result.observationCount()).isEqualTo(25);
        assertThat(result.valueMedian()).isCloseTo(51.0, within(0.5));
        assertThat(result.valueHigh()).isLessThan(500.0);
        assertThat(result.sources()).containsExactly("SourceA", "SourceB");
        assertThat(result.windowDays()).isEqualTo(PriceQuery.DEFAULT_WINDOW_DAYS);
    }

    @Test
    @DisplayName("low, median and high are the interpolated 10th, 50th and 90th percentiles")
    void percentiles() {
        ValuationResult result = engine.fuse(obs("A", 10, 20, 30, 40, 50, 60, 70, 80, 90, 100, 110), QUERY);

        assertThat(result.valueLow()).isCloseTo(20.0, within(1e-9));
        assertThat(result.valueMedian()).isCloseTo(60.0, within(1e-9));
        assertThat(result.valueHigh()).isCloseTo(100.0, within(1e-9));
    }

    @Test
    @DisplayName("outlier removal is skipped below four observations")
    void noOutlierRemovalForSmallSets() {
        ValuationResult result = engine.fuse(obs("A", 10, 11, 1000), QUERY);

        assertThat(result.observationCount()).isEqualTo(3);
        assertThat(result.valueHigh()).isGreaterThan(500.0);
    }

    @Test
    @DisplayName("single observation yields equal low, median and high")
    void singleObservation() {
        ValuationResult result = engine.fuse(obs("A", 42), QUERY);

        assertThat(result.valueLow()).isEqualTo(42.0);
        assertThat(result.valueMedian()).isEqualTo(42.0);
        assertThat(result.valueHigh()).isEqualTo(42.0);
        assertThat(result.volatility()).isZero();
        assertThat(result.confidence()).isCloseTo(0.6 * (1.0 / 50) + 0.4, within(1e-12));
    }

    @Test
    @DisplayName("falls back to the unfiltered set when removal would empty it")
    void fallbackWhenAllRemoved() {
        properties.setIqrMultiplier(-10);

        ValuationResult result = engine.fuse(obs("A", 10, 20, 30, 40, 50), QUERY);

        assertThat(result.observationCount()).isEqualTo(5);
    }

    @Test
    @DisplayName("confidence uses sample size and dispersion with the configured weights")
    void confidenceFormula() {
        double[] identical = new double[50];
        java.util.Arrays.fill(identical, 25.0);
        assertThat(engine.confidence(identical)).isEqualTo(1.0);

        double[] spread = {2, 4, 4, 4, 5, 5, 7, 9}; // cv 0.4
        assertThat(engine.confidence(spread)).isCloseTo(0.6 * 8 / 50 + 0.4 * 0.6, within(1e-12));
    }

    @Test
    @DisplayName("a single-provider run has lower confidence than a multi-source run with equal per-source counts")
    void singleProviderLowerConfidence() {
        double[] prices = {48, 49, 50, 50, 51, 51, 52, 52, 53, 54};
        List<NormalizedObservation> single = obs("A", prices);
        List<NormalizedObservation> multi = new ArrayList<>();
        multi.addAll(obs("A", prices));
        multi.addAll(obs("B", prices));
        multi.addAll(obs("C", prices));

        ValuationResult singleResult = engine.fuse(single, QUERY);
        ValuationResult multiResult = engine.fuse(multi, QUERY);

        assertThat(singleResult.confidence()).isLessThan(multiResult.confidence());
        assertThat(singleResult.volatility()).isCloseTo(multiResult.volatility(), within(1e-12));
    }

    @Test
    @DisplayName("empty input is NO_DATA_AVAILABLE")
    void emptyInput() {
        assertThatThrownBy(() -> engine.fuse(List.of(), QUERY))
                .isInstanceOf(ValuationException.class)
                .extracting(e -> ((ValuationException) e).getKind())
                .isEqualTo(ValuationException.Kind.NO_DATA_AVAILABLE);
    }

    @Test
    @DisplayName("holds ordering, range and removal-size properties over random inputs, and is idempotent")
    void propertiesOverRandomInputs() {
        Random random = new Random(20250315L);
        for (int run = 0; run < 200; run++) {
            int n = 1 + random.nextInt(60);
            List<NormalizedObservation> observations = new ArrayList<>();
            for (int i = 0; i < n; i++) {
                double price = random.nextInt(10) == 0
                        ? 1 + random.nextDouble() * 5000
                        : 40 + random.nextGaussian() * 8;
                observations.add(new NormalizedObservation("S" + random.nextInt(3), Math.max(0.01, price),
                        StandardCondition.NEAR_MINT, SOLD, null));
            }

            assertThat(engine.removeOutliers(observations).size()).isLessThanOrEqualTo(observations.size());
            ValuationResult result = engine.fuse(observations, QUERY);
            assertThat(result.valueLow()).isLessThanOrEqualTo(result.valueMedian());
            assertThat(result.valueMedian()).isLessThanOrEqualTo(result.valueHigh());
            assertThat(result.confidence()).isBetween(0.0, 1.0);
            assertThat(result.volatility()).isGreaterThanOrEqualTo(0.0);
            assertThat(result.observationCount()).isBetween(1, n);
            assertThat(engine.fuse(observations, QUERY)).isEqualTo(result);
        }
    }

    private static List<NormalizedObservation> obs(String source, double... prices) {
        List<NormalizedObservation> list = new ArrayList<>();
        for (double p : prices) {
            list.add(new NormalizedObservation(source, p, StandardCondition.NEAR_MINT, SOLD, null));
        }
        return list;
    }
}
