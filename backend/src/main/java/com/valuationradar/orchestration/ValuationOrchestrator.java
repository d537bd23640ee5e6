package com.valuationradar.orchestration;

import com.valuationradar.cache.ValuationCacheStore;
import com.valuationradar.cache.config.CacheProperties;
import com.valuationradar.config.AsyncConfig;
import com.valuationradar.domain.CallerIdentity;
import com.valuationradar.domain.NormalizedObservation;
import com.valuationradar.domain.PriceQuery;
import com.valuationradar.domain.RawObservation;
import com.valuationradar.domain.ValuationResult;
import com.valuationradar.provider.PriceProvider;
import com.valuationradar.provider.ProviderStatus;
import com.valuationradar.valuation.ObservationNormalizer;
import com.valuationradar.valuation.ValuationException;
import com.valuationradar.valuation.ValuationFusionEngine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Supplier;

/**
 * Entry point for valuations: cache check, availability probe, concurrent fetch across providers, normalize,
 * fuse, best-effort cache write. Only {@link ValuationException} escapes: cache store failures of any kind
 * degrade to a miss or a skipped write, and a saturated provider pool counts as that provider failing.
 */
@Service
@Slf4j
public class ValuationOrchestrator {

    private final List<PriceProvider> providers;
    private final ObservationNormalizer normalizer;
    private final ValuationFusionEngine fusionEngine;
    private final ValuationCacheStore cacheStore;
    private final CacheProperties cacheProperties;
    private final ApplicationEventPublisher eventPublisher;
    private final Executor providerExecutor;

    public ValuationOrchestrator(List<PriceProvider> providers,
                                 ObservationNormalizer normalizer,
                                 ValuationFusionEngine fusionEngine,
                                 ValuationCacheStore cacheStore,
                                 CacheProperties cacheProperties,
                                 ApplicationEventPublisher eventPublisher,
                                 @Qualifier(AsyncConfig.PROVIDER_EXECUTOR) Executor providerExecutor) {
        this.providers = List.copyOf(providers);
        this.normalizer = normalizer;
        this.fusionEngine = fusionEngine;
        this.cacheStore = cacheStore;
        this.cacheProperties = cacheProperties;
        this.eventPublisher = eventPublisher;
        this.providerExecutor = providerExecutor;
    }

    /**
     * Valuation for the query.
     *
     * @param identity     caller+item the result is cached under; null disables caching for this call
     * @param forceRefresh skip the cache read (the fresh result is still written)
     * @throws ValuationException NO_PROVIDERS_AVAILABLE when every breaker is open, NO_DATA_AVAILABLE when the
     *                            fetch yields no usable observation
     */
    public ValuationResult fetchValuation(PriceQuery query, CallerIdentity identity, boolean forceRefresh) {
        if (identity != null && !forceRefresh) {
            Optional<ValuationResult> cached = readCache(identity);
            if (cached.isPresent()) {
                log.info("Returning cached valuation for {}", identity.cacheKey());
                return cached.get();
            }
        }

        List<PriceProvider> available = probeAvailability();
        if (available.isEmpty()) {
            log.error("No pricing providers available for \"{}\"", query.keywords());
            throw ValuationException.noProvidersAvailable("All pricing providers are unavailable");
        }
        log.info("Fetching \"{}\" from {} providers: {}", query.keywords(), available.size(),
                available.stream().map(PriceProvider::getName).toList());

        List<RawObservation> raw = fetchAll(available, query);
        if (raw.isEmpty()) {
            throw ValuationException.noDataAvailable("No pricing data available from any provider");
        }
        List<NormalizedObservation> normalized = normalizer.normalize(raw);
        if (normalized.isEmpty()) {
            throw ValuationException.noDataAvailable("No usable pricing data after normalization");
        }
        ValuationResult result = fusionEngine.fuse(normalized, query);
        log.info("Valuation for \"{}\": median {} from {} observations, sources {}, confidence {}",
                query.keywords(), result.valueMedian(), result.observationCount(), result.sources(), result.confidence());

        if (identity != null) {
            writeCache(identity, result);
        }
        return result;
    }

    /** Availability and breaker state of every registered provider. */
    public List<ProviderStatus> getProviderStatuses() {
        return providers.stream().map(PriceProvider::getStatus).toList();
    }

    /**
     * Drops the cached valuation for this caller+item. Best-effort: store failures are logged.
     */
    public void invalidate(CallerIdentity identity) {
        try {
            cacheStore.evict(identity.cacheKey());
            log.info("Invalidated cached valuation for {}", identity.cacheKey());
        } catch (RuntimeException e) {
            log.warn("Failed to invalidate cached valuation for {}: {}", identity.cacheKey(), e.getMessage());
        }
    }

    private Optional<ValuationResult> readCache(CallerIdentity identity) {
        try {
            return cacheStore.get(identity.cacheKey());
        } catch (RuntimeException e) {
            log.warn("Cache read failed for {}, treating as miss: {}", identity.cacheKey(), e.getMessage());
            return Optional.empty();
        }
    }

    private void writeCache(CallerIdentity identity, ValuationResult result) {
        String key = identity.cacheKey();
        try {
            cacheStore.put(key, result, cacheProperties.getTtlSeconds());
            log.info("Cached valuation for {} (ttl {}s)", key, cacheProperties.getTtlSeconds());
        } catch (RuntimeException e) {
            log.error("Failed to cache valuation for {}", key, e);
            eventPublisher.publishEvent(new ValuationCacheWriteFailedEvent(key, e.getMessage()));
        }
    }

    private List<PriceProvider> probeAvailability() {
        List<CompletableFuture<Boolean>> checks = providers.stream()
                .map(p -> submit(p, p::isAvailable)
                        .exceptionally(e -> {
                            if (e instanceof RejectedExecutionException) {
                                return p.isAvailable();
                            }
                            log.warn("Availability check failed for {}: {}", p.getName(), e.getMessage());
                            return false;
                        }))
                .toList();
        List<PriceProvider> available = new ArrayList<>();
        for (int i = 0; i < providers.size(); i++) {
            if (checks.get(i).join()) {
                available.add(providers.get(i));
            }
        }
        return available;
    }

    /** Fans out to every provider and waits for all to settle; merge order follows registration order. */
    private List<RawObservation> fetchAll(List<PriceProvider> available, PriceQuery query) {
        List<CompletableFuture<List<RawObservation>>> fetches = available.stream()
                .map(p -> submit(p, () -> p.fetchComparables(query)))
                .toList();
        CompletableFuture.allOf(fetches.toArray(CompletableFuture[]::new))
                .exceptionally(e -> null)
                .join();

        List<RawObservation> merged = new ArrayList<>();
        List<String> failed = new ArrayList<>();
        for (int i = 0; i < available.size(); i++) {
            PriceProvider provider = available.get(i);
            try {
                List<RawObservation> observations = fetches.get(i).join();
                merged.addAll(observations);
                log.debug("{} contributed {} observations", provider.getName(), observations.size());
            } catch (CompletionException e) {
                failed.add(provider.getName());
                log.error("{} failed to fetch observations", provider.getName(), e.getCause());
            }
        }
        if (!failed.isEmpty()) {
            log.warn("{} providers failed: {}; {} succeeded", failed.size(), failed, available.size() - failed.size());
        }
        return merged;
    }

    /** Schedules on the provider pool; a saturated pool yields a failed future instead of throwing. */
    private <T> CompletableFuture<T> submit(PriceProvider provider, Supplier<T> task) {
        try {
            return CompletableFuture.supplyAsync(task, providerExecutor);
        } catch (RejectedExecutionException e) {
            log.error("Provider pool saturated, {} not scheduled: {}", provider.getName(), e.getMessage());
            return CompletableFuture.failedFuture(e);
        }
    }
}
