package com.valuationradar.provider.ebay;

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
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Sold listings from the eBay Finding API (findCompletedItems). Pages through results until a short page
 * or the page cap, keeping only listings that ended with a sale.
 */
@Component
@ConditionalOnProperty(prefix = "valuationradar.providers.ebay", name = "enabled", havingValue = "true", matchIfMissing = true)
@Slf4j
public class EbayProvider extends AbstractPriceProvider {

    public static final String NAME = "eBay";

    static final String SOLD_STATE = "EndedWithSales";

    /** eBay item condition ids used in the Condition item filter. */
    static final Map<StandardCondition, String> CONDITION_IDS = Map.of(
            StandardCondition.MINT, "1000",
            StandardCondition.NEAR_MINT, "2750",
            StandardCondition.EXCELLENT, "4000",
            StandardCondition.GOOD, "5000",
            StandardCondition.POOR, "6000");

    private final ProviderProperties.Ebay settings;
    private final Duration requestTimeout;
    private final WebClient.Builder webClientBuilder;
    private final Clock clock;

    public EbayProvider(ProviderProperties properties, ResilienceGuardFactory guardFactory,
                        WebClient.Builder webClientBuilder, Clock clock) {
        super(NAME, guardFactory.create(NAME, properties.getEbay().getMaxRequestsPerWindow()));
        this.settings = properties.getEbay();
        this.requestTimeout = Duration.ofSeconds(properties.getRequestTimeoutSeconds());
        this.webClientBuilder = webClientBuilder;
        this.clock = clock;
    }

    @Override
    protected List<RawObservation> fetchInternal(PriceQuery query) {
        Instant now = clock.instant();
        Instant endTimeFrom = now.minus(query.windowDays(), ChronoUnit.DAYS);
        WebClient client = webClientBuilder.build();
        List<RawObservation> all = new ArrayList<>();
        for (int page = 1; page <= settings.getMaxPages(); page++) {
            URI uri = buildUri(query, endTimeFrom, page);
            String body = awaitBody(client.get()
                    .uri(uri)
                    .retrieve()
                    .bodyToMono(String.class), requestTimeout, "eBay Finding API");
            EbayPage result = parsePage(readTree(body, NAME), now);
            all.addAll(result.observations());
            if (result.itemCount() < settings.getEntriesPerPage()) {
                break;
            }
        }
        return all;
    }

    URI buildUri(PriceQuery query, Instant endTimeFrom, int page) {
        UriComponentsBuilder builder = UriComponentsBuilder.fromUriString(settings.getBaseUrl())
                .queryParam("OPERATION-NAME", "findCompletedItems")
                .queryParam("SERVICE-VERSION", "1.13.0")
                .queryParam("SECURITY-APPNAME", settings.getAppId())
                .queryParam("RESPONSE-DATA-FORMAT", "JSON")
                .queryParam("keywords", query.keywords())
                .queryParam("categoryId", settings.getCategoryId())
                .queryParam("itemFilter(0).name", "SoldItemsOnly")
                .queryParam("itemFilter(0).value", "true")
                .queryParam("itemFilter(1).name", "EndTimeFrom")
                .queryParam("itemFilter(1).value", endTimeFrom.truncatedTo(ChronoUnit.SECONDS).toString());
        if (query.condition() != null) {
            builder.queryParam("itemFilter(2).name", "Condition")
                    .queryParam("itemFilter(2).value", CONDITION_IDS.get(query.condition()));
        }
        return builder.queryParam("paginationInput.entriesPerPage", settings.getEntriesPerPage())
                .queryParam("paginationInput.pageNumber", page)
                .build()
                .encode()
                .toUri();
    }

    /**
     * Parses one findCompletedItems page. Every field in this API is wrapped in a single-element array.
     *
     * @param now stamped on sold items without an end time
     * @throws ProviderException when the response acknowledges a failure or lacks the response envelope
     */
    static EbayPage parsePage(JsonNode root, Instant now) {
        JsonNode response = root.path("findCompletedItemsResponse").path(0);
        if (response.isMissingNode()) {
            throw new ProviderException("eBay response has no findCompletedItemsResponse");
        }
        String ack = firstText(response.path("ack"));
        if ("Failure".equalsIgnoreCase(ack)) {
            String message = firstText(response.path("errorMessage").path(0).path("error").path(0).path("message"));
            throw new ProviderException("eBay acknowledged failure: " + (message != null ? message : "no detail"));
        }
        JsonNode items = response.path("searchResult").path(0).path("item");
        if (!items.isArray()) {
            return new EbayPage(List.of(), 0);
        }
        List<RawObservation> observations = new ArrayList<>();
        for (JsonNode item : items) {
            JsonNode sellingStatus = item.path("sellingStatus").path(0);
            if (!SOLD_STATE.equals(firstText(sellingStatus.path("sellingState")))) {
                continue;
            }
            parseItem(item, sellingStatus, now).ifPresent(observations::add);
        }
        return new EbayPage(observations, items.size());
    }

    private static Optional<RawObservation> parseItem(JsonNode item, JsonNode sellingStatus, Instant now) {
        JsonNode price = sellingStatus.path("currentPrice").path(0);
        String value = firstText(price.path("__value__"));
        if (value == null) {
            return Optional.empty();
        }
        double amount;
        try {
            amount = Double.parseDouble(value);
        } catch (NumberFormatException e) {
            log.debug("Skipping eBay item with unparseable price {}", value);
            return Optional.empty();
        }
        String currency = firstText(price.path("@currencyId"));
        String endTime = firstText(item.path("listingInfo").path(0).path("endTime"));
        Instant observed = now;
        if (endTime != null) {
            try {
                observed = Instant.parse(endTime);
            } catch (DateTimeParseException e) {
                log.debug("Skipping eBay item with malformed end time {}", endTime);
                return Optional.empty();
            }
        }
        String condition = firstText(item.path("condition").path(0).path("conditionDisplayName"));
        String url = firstText(item.path("viewItemURL"));
        return Optional.of(new RawObservation(NAME, amount, currency != null ? currency : "USD",
                condition != null ? condition : "", observed, url));
    }

    /** One parsed page: the sold observations plus the raw item count that drives pagination. */
    record EbayPage(List<RawObservation> observations, int itemCount) {
    }
}
