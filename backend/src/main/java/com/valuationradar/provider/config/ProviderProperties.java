package com.valuationradar.provider.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Per-provider settings. Documented in application.yml under valuationradar.providers.
 * Credentials are plain values here; how they are provisioned is outside this service.
 */
@ConfigurationProperties(prefix = "valuationradar.providers")
@NoArgsConstructor
@Getter
@Setter
public class ProviderProperties {

    /** Upper bound in seconds for a single HTTP exchange. */
    private int requestTimeoutSeconds = 15;

    private Ebay ebay = new Ebay();
    private TcgPlayer tcgplayer = new TcgPlayer();
    private PriceCharting pricecharting = new PriceCharting();

    @NoArgsConstructor
    @Getter
    @Setter
    public static class Ebay {
        private boolean enabled = true;
        private String baseUrl = "https://svcs.ebay.com/services/search/FindingService/v1";
        private String appId = "";
        /** Category filter for completed-item searches. */
        private String categoryId = "183454";
        private int maxRequestsPerWindow = 20;
        private int maxPages = 3;
        private int entriesPerPage = 100;
    }

    @NoArgsConstructor
    @Getter
    @Setter
    public static class TcgPlayer {
        private boolean enabled = true;
        private String baseUrl = "https://api.tcgplayer.com";
        private String clientId = "";
        private String clientSecret = "";
        private int categoryId = 3;
        private int maxRequestsPerWindow = 30;
        /** Catalog search page size. */
        private int searchLimit = 10;
        /** Products priced per query, best matches first. */
        private int productLimit = 5;
    }

    @NoArgsConstructor
    @Getter
    @Setter
    public static class PriceCharting {
        private boolean enabled = true;
        private String baseUrl = "https://www.pricecharting.com";
        private String apiKey = "";
        private String productType = "pokemon-card";
        private int maxRequestsPerWindow = 10;
        private int productLimit = 3;
        /** History is consulted only when the query window exceeds this many days. */
        private int historyThresholdDays = 7;
    }
}
