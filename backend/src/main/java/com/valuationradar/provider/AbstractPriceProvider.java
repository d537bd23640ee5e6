package com.valuationradar.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.valuationradar.domain.PriceQuery;
import com.valuationradar.domain.RawObservation;
import com.valuationradar.resilience.CircuitBreakerSnapshot;
import com.valuationradar.resilience.ResilienceGuard;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.reactive.function.client.WebClientException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;

/**
 * Base for HTTP providers: owns this provider's {@link ResilienceGuard} and runs
 * {@link #fetchInternal(PriceQuery)} through it. Subclasses throw {@link ProviderException} on failure and
 * skip malformed records while parsing.
 */
@Slf4j
public abstract class AbstractPriceProvider implements PriceProvider {

    protected static final ObjectMapper MAPPER = new ObjectMapper();

    private final String name;
    private final ResilienceGuard guard;

    protected AbstractPriceProvider(String name, ResilienceGuard guard) {
        this.name = name;
        this.guard = guard;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public List<RawObservation> fetchComparables(PriceQuery query) {
        List<RawObservation> observations = guard.execute(() -> fetchInternal(query));
        log.info("{} returned {} observations for \"{}\"", name, observations.size(), query.keywords());
        return observations;
    }

    @Override
    public boolean isAvailable() {
        return guard.isAvailable();
    }

    @Override
    public ProviderStatus getStatus() {
        CircuitBreakerSnapshot snapshot = guard.breakerSnapshot();
        return new ProviderStatus(name, guard.isAvailable(), snapshot.state(), snapshot.failureCount(), snapshot.lastFailureTime());
    }

    /**
     * One attempt against the source. Called once per retry attempt.
     *
     * @throws ProviderException on HTTP, transport or response-shape failure
     */
    protected abstract List<RawObservation> fetchInternal(PriceQuery query);

    /**
     * Blocks for a response body. HTTP status, transport and timeout failures all surface as
     * {@link ProviderException} with the original error as cause.
     *
     * @param call what was requested, used in the exception message
     */
    protected static String awaitBody(Mono<String> body, Duration timeout, String call) {
        try {
            return body.block(timeout);
        } catch (WebClientResponseException e) {
            throw new ProviderException(call + " returned " + e.getStatusCode().value(), e);
        } catch (WebClientException e) {
            throw new ProviderException(call + " request failed: " + e.getMessage(), e);
        } catch (IllegalStateException e) {
            throw new ProviderException(call + " timed out after " + timeout.toMillis() + "ms", e);
        }
    }

    /** HTTP status of the response behind a {@link ProviderException}, or -1 when there was none. */
    protected static int statusOf(ProviderException e) {
        if (e.getCause() instanceof WebClientResponseException) {
            return ((WebClientResponseException) e.getCause()).getStatusCode().value();
        }
        return -1;
    }

    protected static JsonNode readTree(String json, String sourceName) {
        if (json == null || json.isBlank()) {
            throw new ProviderException(sourceName + " returned an empty body");
        }
        try {
            return MAPPER.readTree(json);
        } catch (Exception e) {
            throw new ProviderException(sourceName + " returned malformed JSON", e);
        }
    }

    /** Text of the first element when the node is an array, else the node's own text; null when missing. */
    protected static String firstText(JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull()) {
            return null;
        }
        JsonNode value = node.isArray() ? node.path(0) : node;
        if (value.isMissingNode() || value.isNull() || value.isContainerNode()) {
            return null;
        }
        String text = value.asText();
        return text.isBlank() ? null : text;
    }
}
