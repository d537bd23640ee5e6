package com.valuationradar.orchestration;

import com.valuationradar.cache.CacheStoreException;
import com.valuationradar.cache.MongoValuationCacheStore;
import com.valuationradar.cache.ValuationCacheStore;
import com.valuationradar.cache.config.CacheProperties;
import com.valuationradar.domain.CallerIdentity;
import com.valuationradar.domain.PriceQuery;
import com.valuationradar.domain.RawObservation;
import com.valuationradar.domain.ValuationSnapshotRepository;
import com.valuationradar.domain.ValuationResult;
import com.valuationradar.provider.PriceProvider;
import com.valuationradar.provider.ProviderStatus;
import com.valuationradar.resilience.BreakerState;
import com.valuationradar.valuation.ConditionClassifier;
import com.valuationradar.valuation.CurrencyConverter;
import com.valuationradar.valuation.ObservationNormalizer;
import com.valuationradar.valuation.ValuationException;
import com.valuationradar.valuation.ValuationFusionEngine;
import com.valuationradar.valuation.config.FusionProperties;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.data.mapping.MappingException;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.TreeSet;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class ValuationOrchestratorTest {

    private static final Instant SOLD = Instant.parse("2025-03-01T10:00:00Z");
    private static final PriceQuery QUERY = PriceQuery.of("Charizard");
    private static final CallerIdentity IDENTITY = new CallerIdentity("user-1", "item-9");

    @Mock
    ValuationCacheStore cacheStore;
    @Mock
    ApplicationEventPublisher eventPublisher;

    private PriceProvider ebay;
    private PriceProvider tcg;
    private PriceProvider pricecharting;
    private CacheProperties cacheProperties;
    private ExecutorService executor;

    @BeforeEach
    void setUp() {
        ebay = provider("eBay");
        tcg = provider("TCGPlayer");
        pricecharting = provider("PriceCharting");
        cacheProperties = new CacheProperties();
        executor = Executors.newFixedThreadPool(4);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    @DisplayName("fuses observations from every available provider and caches under the identity")
    void fetchesFusesAndCaches() {
        when(ebay.fetchComparables(QUERY)).thenReturn(observations("eBay", 50, 51, 52, 53));
        when(tcg.fetchComparables(QUERY)).thenReturn(observations("TCGPlayer", 49, 50, 51));
        when(pricecharting.fetchComparables(QUERY)).thenReturn(List.of());
        when(cacheStore.get(IDENTITY.cacheKey())).thenReturn(Optional.empty());

        ValuationResult result = orchestrator(ebay, tcg, pricecharting).fetchValuation(QUERY, IDENTITY, false);

        assertThat(result.observationCount()).isEqualTo(7);
        assertThat(result.sources()).containsExactly("TCGPlayer", "eBay");
        verify(cacheStore).put(IDENTITY.cacheKey(), result, 300L);
    }

    @Test
    @DisplayName("cache hit returns the stored result without invoking providers")
    void cacheHit() {
        ValuationResult cached = new ValuationResult(1, 2, 3, 4, 14, new TreeSet<>(List.of("eBay")), 0.5, 0.1);
        when(cacheStore.get(IDENTITY.cacheKey())).thenReturn(Optional.of(cached));

        ValuationResult result = orchestrator(ebay, tcg).fetchValuation(QUERY, IDENTITY, false);

        assertThat(result).isSameAs(cached);
        verify(ebay, never()).fetchComparables(any());
        verify(ebay, never()).isAvailable();
        verify(cacheStore, never()).put(anyString(), any(), anyLong());
    }

    @Test
    @DisplayName("forceRefresh bypasses the cache read but still writes")
    void forceRefresh() {
        when(ebay.fetchComparables(QUERY)).thenReturn(observations("eBay", 10, 11));

        ValuationResult result = orchestrator(ebay).fetchValuation(QUERY, IDENTITY, true);

        verify(cacheStore, never()).get(anyString());
        verify(cacheStore).put(IDENTITY.cacheKey(), result, 300L);
    }

    @Test
    @DisplayName("absent identity disables caching")
    void noIdentityNoCaching() {
        when(ebay.fetchComparables(QUERY)).thenReturn(observations("eBay", 10, 11));

        orchestrator(ebay).fetchValuation(QUERY, null, false);

        verify(cacheStore, never()).get(anyString());
        verify(cacheStore, never()).put(anyString(), any(), anyLong());
    }

    @Test
    @DisplayName("cache read failure is treated as a miss")
    void cacheReadFailureIsMiss() {
        when(cacheStore.get(anyString())).thenThrow(new CacheStoreException("down", new RuntimeException()));
        when(ebay.fetchComparables(QUERY)).thenReturn(observations("eBay", 10, 11));

        ValuationResult result = orchestrator(ebay).fetchValuation(QUERY, IDENTITY, false);

        assertThat(result.observationCount()).isEqualTo(2);
    }

    @Test
    @DisplayName("an unreadable snapshot in the Mongo store is treated as a miss")
    void unmappableSnapshotIsMiss() {
        ValuationSnapshotRepository repository = mock(ValuationSnapshotRepository.class);
        when(repository.findById(anyString())).thenThrow(new MappingException("stale snapshot schema"));
        when(ebay.fetchComparables(QUERY)).thenReturn(observations("eBay", 10, 11));
        ValuationOrchestrator orchestrator = orchestrator(
                new MongoValuationCacheStore(repository, Clock.systemUTC()), ebay);

        ValuationResult result = orchestrator.fetchValuation(QUERY, IDENTITY, false);

        assertThat(result.observationCount()).isEqualTo(2);
        verify(repository).save(any());
    }

    @Test
    @DisplayName("unexpected runtime failures from the store never escape")
    void unexpectedStoreFailuresAbsorbed() {
        when(cacheStore.get(anyString())).thenThrow(new IllegalStateException("codec"));
        doThrow(new IllegalStateException("codec")).when(cacheStore).put(anyString(), any(), anyLong());
        doThrow(new IllegalStateException("codec")).when(cacheStore).evict(anyString());
        when(ebay.fetchComparables(QUERY)).thenReturn(observations("eBay", 10, 11));
        ValuationOrchestrator orchestrator = orchestrator(ebay);

        ValuationResult result = orchestrator.fetchValuation(QUERY, IDENTITY, false);
        orchestrator.invalidate(IDENTITY);

        assertThat(result.observationCount()).isEqualTo(2);
        ArgumentCaptor<ValuationCacheWriteFailedEvent> event = ArgumentCaptor.forClass(ValuationCacheWriteFailedEvent.class);
        verify(eventPublisher).publishEvent(event.capture());
        assertThat(event.getValue().reason()).isEqualTo("codec");
    }

    @Test
    @DisplayName("a saturated provider pool counts as provider failure, not a new error kind")
    void saturatedPoolIsProviderFailure() {
        Executor rejecting = task -> {
            throw new RejectedExecutionException("pool full");
        };
        when(ebay.fetchComparables(QUERY)).thenReturn(observations("eBay", 10, 11));
        ValuationOrchestrator orchestrator = new ValuationOrchestrator(List.of(ebay, tcg), normalizer(),
                new ValuationFusionEngine(new FusionProperties()), cacheStore, cacheProperties, eventPublisher, rejecting);

        assertThatThrownBy(() -> orchestrator.fetchValuation(QUERY, null, false))
                .isInstanceOf(ValuationException.class)
                .extracting(e -> ((ValuationException) e).getKind())
                .isEqualTo(ValuationException.Kind.NO_DATA_AVAILABLE);
        verify(ebay).isAvailable();
        verify(ebay, never()).fetchComparables(any());
    }

    @Test
    @DisplayName("cache write failure still returns the result and publishes an event")
    void cacheWriteFailurePublishesEvent() {
        when(cacheStore.get(anyString())).thenReturn(Optional.empty());
        doThrow(new CacheStoreException("write refused", new RuntimeException()))
                .when(cacheStore).put(anyString(), any(), anyLong());
        when(ebay.fetchComparables(QUERY)).thenReturn(observations("eBay", 10, 11));

        ValuationResult result = orchestrator(ebay).fetchValuation(QUERY, IDENTITY, false);

        assertThat(result.observationCount()).isEqualTo(2);
        ArgumentCaptor<ValuationCacheWriteFailedEvent> event = ArgumentCaptor.forClass(ValuationCacheWriteFailedEvent.class);
        verify(eventPublisher).publishEvent(event.capture());
        assertThat(event.getValue().cacheKey()).isEqualTo("user-1#item-9");
        assertThat(event.getValue().reason()).isEqualTo("write refused");
    }

    @Test
    @DisplayName("every breaker open is NO_PROVIDERS_AVAILABLE and no provider is called")
    void allUnavailable() {
        when(ebay.isAvailable()).thenReturn(false);
        when(tcg.isAvailable()).thenReturn(false);

        assertThatThrownBy(() -> orchestrator(ebay, tcg).fetchValuation(QUERY, null, false))
                .isInstanceOf(ValuationException.class)
                .extracting(e -> ((ValuationException) e).getKind())
                .isEqualTo(ValuationException.Kind.NO_PROVIDERS_AVAILABLE);
        verify(ebay, never()).fetchComparables(any());
    }

    @Test
    @DisplayName("unavailable providers are excluded from the fan-out")
    void unavailableExcluded() {
        when(ebay.isAvailable()).thenReturn(false);
        when(tcg.fetchComparables(QUERY)).thenReturn(observations("TCGPlayer", 20, 21));

        ValuationResult result = orchestrator(ebay, tcg).fetchValuation(QUERY, null, false);

        assertThat(result.sources()).containsExactly("TCGPlayer");
        verify(ebay, never()).fetchComparables(any());
    }

    @Test
    @DisplayName("closed breakers with empty fetches is NO_DATA_AVAILABLE")
    void allEmpty() {
        when(ebay.fetchComparables(QUERY)).thenReturn(List.of());
        when(tcg.fetchComparables(QUERY)).thenReturn(List.of());

        assertThatThrownBy(() -> orchestrator(ebay, tcg).fetchValuation(QUERY, IDENTITY, true))
                .isInstanceOf(ValuationException.class)
                .extracting(e -> ((ValuationException) e).getKind())
                .isEqualTo(ValuationException.Kind.NO_DATA_AVAILABLE);
        verify(cacheStore, never()).put(anyString(), any(), anyLong());
    }

    @Test
    @DisplayName("only unusable prices is NO_DATA_AVAILABLE")
    void onlyUnusablePrices() {
        when(ebay.fetchComparables(QUERY)).thenReturn(observations("eBay", 0, -1));

        assertThatThrownBy(() -> orchestrator(ebay).fetchValuation(QUERY, null, false))
                .isInstanceOf(ValuationException.class)
                .extracting(e -> ((ValuationException) e).getKind())
                .isEqualTo(ValuationException.Kind.NO_DATA_AVAILABLE);
    }

    @Test
    @DisplayName("a provider that throws contributes nothing and the others still count")
    void throwingProviderIsolated() {
        when(ebay.fetchComparables(QUERY)).thenThrow(new IllegalStateException("boom"));
        when(tcg.fetchComparables(QUERY)).thenReturn(observations("TCGPlayer", 20, 21));

        ValuationResult result = orchestrator(ebay, tcg).fetchValuation(QUERY, null, false);

        assertThat(result.sources()).containsExactly("TCGPlayer");
    }

    @Test
    @DisplayName("single available provider gives lower confidence than several with equal counts")
    void singleProviderLowerConfidence() {
        when(ebay.fetchComparables(QUERY)).thenReturn(observations("eBay", 48, 49, 50, 51, 52, 53, 50, 51, 52, 49));
        when(tcg.fetchComparables(QUERY)).thenReturn(observations("TCGPlayer", 48, 49, 50, 51, 52, 53, 50, 51, 52, 49));
        when(pricecharting.fetchComparables(QUERY)).thenReturn(observations("PriceCharting", 48, 49, 50, 51, 52, 53, 50, 51, 52, 49));

        ValuationResult all = orchestrator(ebay, tcg, pricecharting).fetchValuation(QUERY, null, false);
        when(tcg.isAvailable()).thenReturn(false);
        when(pricecharting.isAvailable()).thenReturn(false);
        ValuationResult single = orchestrator(ebay, tcg, pricecharting).fetchValuation(QUERY, null, false);

        assertThat(single.sources()).containsExactly("eBay");
        assertThat(single.confidence()).isLessThan(all.confidence());
    }

    @Test
    @DisplayName("provider statuses report every registered provider")
    void providerStatuses() {
        when(tcg.getStatus()).thenReturn(new ProviderStatus("TCGPlayer", false, BreakerState.OPEN, 5, SOLD));

        List<ProviderStatus> statuses = orchestrator(ebay, tcg).getProviderStatuses();

        assertThat(statuses).extracting(ProviderStatus::name).containsExactly("eBay", "TCGPlayer");
        assertThat(statuses.get(1).breakerState()).isEqualTo(BreakerState.OPEN);
    }

    @Test
    @DisplayName("invalidate evicts the identity key and absorbs store failures")
    void invalidate() {
        ValuationOrchestrator orchestrator = orchestrator(ebay);
        orchestrator.invalidate(IDENTITY);
        verify(cacheStore).evict(eq("user-1#item-9"));

        doThrow(new CacheStoreException("down", new RuntimeException())).when(cacheStore).evict(anyString());
        orchestrator.invalidate(IDENTITY);
    }

    private ValuationOrchestrator orchestrator(PriceProvider... providers) {
        return orchestrator(cacheStore, providers);
    }

    private ValuationOrchestrator orchestrator(ValuationCacheStore store, PriceProvider... providers) {
        Executor pool = executor;
        return new ValuationOrchestrator(List.of(providers), normalizer(), new ValuationFusionEngine(new FusionProperties()),
                store, cacheProperties, eventPublisher, pool);
    }

    private static ObservationNormalizer normalizer() {
        return new ObservationNormalizer(new CurrencyConverter(new FusionProperties()), new ConditionClassifier());
    }

    private static PriceProvider provider(String name) {
        PriceProvider provider = mock(PriceProvider.class);
        when(provider.getName()).thenReturn(name);
        when(provider.isAvailable()).thenReturn(true);
        when(provider.getStatus()).thenReturn(new ProviderStatus(name, true, BreakerState.CLOSED, 0, null));
        return provider;
    }

    private static List<RawObservation> observations(String source, double... prices) {
        List<RawObservation> list = new ArrayList<>();
        for (double p : prices) {
            list.add(new RawObservation(source, p, "USD", "Near Mint", SOLD, null));
        }
        return list;
    }
}
