package com.valuationradar.api.controller;

import com.valuationradar.api.dto.ErrorBody;
import com.valuationradar.api.dto.ValuationRequest;
import com.valuationradar.domain.CallerIdentity;
import com.valuationradar.domain.ValuationResult;
import com.valuationradar.orchestration.ValuationOrchestrator;
import com.valuationradar.provider.ProviderStatus;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;

/**
 * POST /valuations, GET /valuations/providers, DELETE /valuations/cache.
 * Orchestration blocks on provider I/O, so it runs on the bounded elastic scheduler.
 */
@RestController
@RequestMapping("/api/v1/valuations")
@RequiredArgsConstructor
public class ValuationController {

    private final ValuationOrchestrator orchestrator;

    @PostMapping
    public Mono<ValuationResult> valuate(@Valid @RequestBody ValuationRequest request) {
        return Mono.fromCallable(() -> orchestrator.fetchValuation(
                        request.toQuery(), request.identity(), request.forceRefreshOrDefault()))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @GetMapping("/providers")
    public Mono<List<ProviderStatus>> providers() {
        return Mono.fromCallable(orchestrator::getProviderStatuses)
                .subscribeOn(Schedulers.boundedElastic());
    }

    @DeleteMapping("/cache")
    public Mono<ResponseEntity<?>> invalidate(@RequestParam String userId, @RequestParam String itemId) {
        if (userId.isBlank() || itemId.isBlank()) {
            return Mono.just(ResponseEntity.badRequest()
                    .body(ErrorBody.of("VALIDATION_ERROR", "userId and itemId are required")));
        }
        CallerIdentity identity = new CallerIdentity(userId.strip(), itemId.strip());
        ResponseEntity<?> noContent = ResponseEntity.noContent().build();
        return Mono.fromRunnable(() -> orchestrator.invalidate(identity))
                .subscribeOn(Schedulers.boundedElastic())
                .then(Mono.just(noContent));
    }
}
