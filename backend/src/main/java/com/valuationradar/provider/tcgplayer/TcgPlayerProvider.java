package com.valuationradar.provider.tcgplayer;

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
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Market prices from the TCGPlayer catalog and pricing API. Authenticates with client credentials, searches
 * the catalog, then prices the best matching products. A product whose pricing call fails is skipped.
 */
@Component
@ConditionalOnProperty(prefix = "valuationradar.providers.tcgplayer", name = "enabled", havingValue = "true", matchIfMissing = true)
@Slf4j
public class TcgPlayerProvider extends AbstractPriceProvider {

    public static final String NAME = "TCGPlayer";

    /** Tokens are refreshed this long before the server-side expiry. */
    static final Duration TOKEN_REFRESH_MARGIN = Duration.ofMinutes(1);

    private static final Pattern LIGHTLY_PLAYED = Pattern.compile("lightly played|excellent|\\blp\\b");
    private static final Pattern MODERATELY_PLAYED = Pattern.compile("moderately played|good|\\bmp\\b");
    private static final Pattern HEAVILY_PLAYED = Pattern.compile("heavily played|poor|damaged|\\bhp\\b");

    private final ProviderProperties.TcgPlayer settings;
    private final Duration requestTimeout;
    private final WebClient.Builder webClientBuilder;
    private final Clock clock;

    private String accessToken;
    private Instant tokenExpiresAt = Instant.EPOCH;

    public TcgPlayerProvider(ProviderProperties properties, ResilienceGuardFactory guardFactory,
                             WebClient.Builder webClientBuilder, Clock clock) {
        super(NAME, guardFactory.create(NAME, properties.getTcgplayer().getMaxRequestsPerWindow()));
        this.settings = properties.getTcgplayer();
        this.requestTimeout = Duration.ofSeconds(properties.getRequestTimeoutSeconds());
        this.webClientBuilder = webClientBuilder;
        this.clock = clock;
    }

    @Override
    protected List<RawObservation> fetchInternal(PriceQuery query) {
        WebClient client = webClientBuilder.build();
        String token = ensureAccessToken(client);
        List<TcgProduct> products = searchProducts(client, token, query);
        if (products.isEmpty()) {
            log.info("No TCGPlayer products found for \"{}\"", query.keywords());
            return List.of();
        }
        Instant now = clock.instant();
        List<RawObservation> observations = new ArrayList<>();
        for (TcgProduct product : products.subList(0, Math.min(settings.getProductLimit(), products.size()))) {
            observations.addAll(fetchProductPricing(client, token, product, query.condition(), now));
        }
        return observations;
    }

    synchronized String ensureAccessToken(WebClient client) {
        Instant now = clock.instant();
        if (accessToken != null && now.isBefore(tokenExpiresAt)) {
            return accessToken;
        }
        String body = awaitBody(client.post()
                .uri(settings.getBaseUrl() + "/token")
                .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                .body(BodyInserters.fromFormData("grant_type", "client_credentials")
                        .with("client_id", settings.getClientId())
                        .with("client_secret", settings.getClientSecret()))
                .retrieve()
                .bodyToMono(String.class), requestTimeout, "TCGPlayer authentication");
        JsonNode root = readTree(body, NAME);
        String token = firstText(root.path("access_token"));
        if (token == null) {
            throw new ProviderException("TCGPlayer token response has no access_token");
        }
        long expiresIn = root.path("expires_in").asLong(0);
        accessToken = token;
        tokenExpiresAt = now.plusSeconds(expiresIn).minus(TOKEN_REFRESH_MARGIN);
        log.info("TCGPlayer access token refreshed, valid until {}", tokenExpiresAt);
        return token;
    }

    private synchronized void invalidateToken() {
        accessToken = null;
        tokenExpiresAt = Instant.EPOCH;
    }

    private List<TcgProduct> searchProducts(WebClient client, String token, PriceQuery query) {
        URI uri = UriComponentsBuilder.fromUriString(settings.getBaseUrl())
                .path("/catalog/products")
                .queryParam("categoryId", settings.getCategoryId())
                .queryParam("productName", query.keywords())
                .queryParam("limit", settings.getSearchLimit())
                .build()
                .encode()
                .toUri();
        String body;
        try {
            body = awaitBody(client.get()
                    .uri(uri)
                    .headers(h -> h.setBearerAuth(token))
                    .accept(MediaType.APPLICATION_JSON)
                    .retrieve()
                    .bodyToMono(String.class), requestTimeout, "TCGPlayer catalog search");
        } catch (ProviderException e) {
            if (statusOf(e) == HttpStatus.UNAUTHORIZED.value()) {
                invalidateToken();
            }
            throw e;
        }
        return parseProducts(readTree(body, NAME));
    }

    private List<RawObservation> fetchProductPricing(WebClient client, String token, TcgProduct product,
                                                     StandardCondition conditionFilter, Instant now) {
        try {
            String body = awaitBody(client.get()
                    .uri(settings.getBaseUrl() + "/pricing/product/" + product.productId() + "?getExtendedFields=true")
                    .headers(h -> h.setBearerAuth(token))
                    .accept(MediaType.APPLICATION_JSON)
                    .retrieve()
                    .bodyToMono(String.class), requestTimeout, "TCGPlayer pricing");
            return parsePricing(readTree(body, NAME), product, conditionFilter, now);
        } catch (ProviderException e) {
            log.warn("TCGPlayer pricing skipped for product {}: {}", product.productId(), e.getMessage());
            return List.of();
        }
    }

    static List<TcgProduct> parseProducts(JsonNode root) {
        JsonNode results = root.path("results");
        if (!results.isArray()) {
            return List.of();
        }
        List<TcgProduct> products = new ArrayList<>();
        for (JsonNode node : results) {
            JsonNode id = node.path("productId");
            if (!id.canConvertToLong()) {
                continue;
            }
            products.add(new TcgProduct(id.asLong(), firstText(node.path("name")), firstText(node.path("url"))));
        }
        return products;
    }

    /**
     * One row per printing/condition. Market (else mid), low and high (when it differs from low) each become
     * an observation dated {@code now}, since the API carries no sale dates.
     */
    static List<RawObservation> parsePricing(JsonNode root, TcgProduct product, StandardCondition conditionFilter,
                                             Instant now) {
        JsonNode results = root.path("results");
        if (!results.isArray()) {
            return List.of();
        }
        List<RawObservation> observations = new ArrayList<>();
        for (JsonNode row : results) {
            String label = firstText(row.path("conditionName"));
            if (label == null) {
                label = firstText(row.path("subTypeName"));
            }
            StandardCondition condition = mapCondition(label);
            if (conditionFilter != null && condition != conditionFilter) {
                continue;
            }
            double market = row.path("marketPrice").asDouble(0);
            double mid = row.path("midPrice").asDouble(0);
            double low = row.path("lowPrice").asDouble(0);
            double high = row.path("highPrice").asDouble(0);
            double headline = market > 0 ? market : mid;
            if (headline > 0) {
                observations.add(observation(headline, condition, now, product));
            }
            if (low > 0) {
                observations.add(observation(low, condition, now, product));
            }
            if (high > 0 && high != low) {
                observations.add(observation(high, condition, now, product));
            }
        }
        return observations;
    }

    /**
     * TCGPlayer condition or printing label to a standard grade. Sealed, factory and graded product count as Mint;
     * printing labels such as "Normal" or "Holofoil" default to Near Mint.
     */
    static StandardCondition mapCondition(String label) {
        if (label == null) {
            return StandardCondition.NEAR_MINT;
        }
        String normalized = label.toLowerCase(Locale.ROOT);
        if (normalized.contains("sealed") || normalized.contains("factory") || normalized.contains("graded")) {
            return StandardCondition.MINT;
        }
        if (normalized.contains("near mint")) {
            return StandardCondition.NEAR_MINT;
        }
        if (normalized.contains("mint")) {
            return StandardCondition.MINT;
        }
        if (LIGHTLY_PLAYED.matcher(normalized).find()) {
            return StandardCondition.EXCELLENT;
        }
        if (MODERATELY_PLAYED.matcher(normalized).find()) {
            return StandardCondition.GOOD;
        }
        if (HEAVILY_PLAYED.matcher(normalized).find()) {
            return StandardCondition.POOR;
        }
        return StandardCondition.NEAR_MINT;
    }

    private static RawObservation observation(double price, StandardCondition condition, Instant now, TcgProduct product) {
        return new RawObservation(NAME, price, "USD", condition.getLabel(), now, product.url());
    }

    record TcgProduct(long productId, String name, String url) {
    }
}
