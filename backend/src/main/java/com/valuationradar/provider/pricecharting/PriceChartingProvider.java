package com.valuationradar.provider.pricecharting;

import com.fasterxml.jackson.databind.JsonNode;
import com.valuationradar.domain.PriceQuery;
import com.valuationradar.domain.RawObservation;
import com.valuationradar.domain.StandardCondition;
import com.valuationradar.provider.AbstractPriceProvider;
import com.valuationradar.provider.ProviderException;
import com.valuationradar.provider.config.ProviderProperties;
import com.valuationradar.resilience.ResilienceGuardFactory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.util.UriComponentsBuilder;
import org.springframework.web.util.UriUtils;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Current and historical prices from the PriceCharting API. Each product carries one price per grade column;
 * history is fetched only for windows longer than the configured threshold.
 */
@Component
@ConditionalOnProperty(prefix = "valuationradar.providers.pricecharting", name = "enabled", havingValue = "true", matchIfMissing = true)
@Slf4j
public class PriceChartingProvider extends AbstractPriceProvider {

    public static final String NAME = "PriceCharting";

    static final String SUCCESS = "success";

    /** Price column to standard grade, in emission order. */
    static final List<Map.Entry<String, StandardCondition>> PRICE_COLUMNS = List.of(
            Map.entry("new-price", StandardCondition.MINT),
            Map.entry("graded-price", StandardCondition.MINT),
            Map.entry("cib-price", StandardCondition.NEAR_MINT),
            Map.entry("loose-price", StandardCondition.GOOD));

    private final ProviderProperties.PriceCharting settings;
    private final Duration requestTimeout;
    private final WebClient.Builder webClientBuilder;
    private final Clock clock;

    public PriceChartingProvider(ProviderProperties properties, ResilienceGuardFactory guardFactory,
                                 WebClient.Builder webClientBuilder, Clock clock) {
        super(NAME, guardFactory.create(NAME, properties.getPricecharting().getMaxRequestsPerWindow()));
        this.settings = properties.getPricecharting();
        this.requestTimeout = Duration.ofSeconds(properties.getRequestTimeoutSeconds());
        this.webClientBuilder = webClientBuilder;
        this.clock = clock;
    }

    @Override
    protected List<RawObservation> fetchInternal(PriceQuery query) {
        WebClient client = webClientBuilder.build();
        JsonNode search = get(client, UriComponentsBuilder.fromUriString(settings.getBaseUrl())
                .path("/api/products")
                .queryParam("t", settings.getApiKey())
                .queryParam("q", searchTerm(query))
                .queryParam("type", settings.getProductType())
                .build()
                .encode()
                .toUri());
        String status = firstText(search.path("status"));
        if (!SUCCESS.equals(status)) {
            throw new ProviderException("PriceCharting search returned status " + status);
        }
        JsonNode products = search.path("products");
        if (!products.isArray() || products.isEmpty()) {
            log.info("No PriceCharting products found for \"{}\"", query.keywords());
            return List.of();
        }
        Instant now = clock.instant();
        Instant cutoff = now.minus(query.windowDays(), ChronoUnit.DAYS);
        boolean withHistory = query.windowDays() > settings.getHistoryThresholdDays();
        List<RawObservation> observations = new ArrayList<>();
        int limit = Math.min(settings.getProductLimit(), products.size());
        for (int i = 0; i < limit; i++) {
            JsonNode product = products.get(i);
            String productUrl = productUrl(firstText(product.path("product-name")));
            observations.addAll(extractPrices(product, query.condition(), now, productUrl));
            String id = firstText(product.path("id"));
            if (withHistory && id != null) {
                observations.addAll(fetchHistory(client, id, query.condition(), cutoff));
            }
        }
        return observations;
    }

    /** Name, set and "#number", space separated. */
    static String searchTerm(PriceQuery query) {
        StringBuilder term = new StringBuilder(query.itemName().strip());
        if (query.set() != null && !query.set().isBlank()) {
            term.append(' ').append(query.set().strip());
        }
        if (query.number() != null && !query.number().isBlank()) {
            term.append(" #").append(query.number().strip());
        }
        return term.toString();
    }

    private List<RawObservation> fetchHistory(WebClient client, String productId, StandardCondition conditionFilter,
                                              Instant cutoff) {
        try {
            JsonNode history = get(client, UriComponentsBuilder.fromUriString(settings.getBaseUrl())
                    .path("/api/product")
                    .queryParam("t", settings.getApiKey())
                    .queryParam("id", productId)
                    .build()
                    .encode()
                    .toUri());
            if (!SUCCESS.equals(firstText(history.path("status")))) {
                return List.of();
            }
            return parseHistory(history, conditionFilter, cutoff, productUrl(firstText(history.path("product-name"))));
        } catch (ProviderException e) {
            log.warn("PriceCharting history unavailable for product {}: {}", productId, e.getMessage());
            return List.of();
        }
    }

    private JsonNode get(WebClient client, URI uri) {
        String body = awaitBody(client.get()
                .uri(uri)
                .accept(MediaType.APPLICATION_JSON)
                .retrieve()
                .bodyToMono(String.class), requestTimeout, "PriceCharting " + uri.getPath());
        return readTree(body, NAME);
    }

    private String productUrl(String productName) {
        if (productName == null) {
            return null;
        }
        return settings.getBaseUrl() + "/game/" + settings.getProductType() + "/"
                + UriUtils.encodePathSegment(productName, StandardCharsets.UTF_8);
    }

    /** Current prices of one search result, dated {@code now}. */
    static List<RawObservation> extractPrices(JsonNode product, StandardCondition conditionFilter, Instant now,
                                              String productUrl) {
        List<RawObservation> observations = new ArrayList<>();
        addColumns(product, conditionFilter, now, productUrl, observations);
        return observations;
    }

    /**
     * Dated price points no older than {@code cutoff}. Dates are ISO dates or instants; unparseable points are skipped.
     */
    static List<RawObservation> parseHistory(JsonNode history, StandardCondition conditionFilter, Instant cutoff,
                                             String productUrl) {
        JsonNode prices = history.path("prices");
        if (!prices.isArray()) {
            return List.of();
        }
        List<RawObservation> observations = new ArrayList<>();
        for (JsonNode point : prices) {
            Instant date = parseDate(firstText(point.path("date")));
            if (date == null || date.isBefore(cutoff)) {
                continue;
            }
            addColumns(point, conditionFilter, date, productUrl, observations);
        }
        return observations;
    }

    private static void addColumns(JsonNode node, StandardCondition conditionFilter, Instant observed, String url,
                                   List<RawObservation> out) {
        for (Map.Entry<String, StandardCondition> column : PRICE_COLUMNS) {
            double price = node.path(column.getKey()).asDouble(0);
            if (price <= 0) {
                continue;
            }
            if (conditionFilter != null && column.getValue() != conditionFilter) {
                continue;
            }
            out.add(new RawObservation(NAME, price, "USD", column.getValue().getLabel(), observed, url));
        }
    }

    static Instant parseDate(String text) {
        if (text == null) {
            return null;
        }
        try {
            return text.length() <= 10
                    ? LocalDate.parse(text).atStartOfDay(ZoneOffset.UTC).toInstant()
                    : Instant.parse(text);
        } catch (DateTimeParseException e) {
            log.debug("Skipping PriceCharting price point with malformed date {}", text);
            return null;
        }
    }
}
