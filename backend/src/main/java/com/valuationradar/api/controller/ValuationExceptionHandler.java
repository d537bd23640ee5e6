package com.valuationradar.api.controller;

import com.valuationradar.api.dto.ErrorBody;
import com.valuationradar.valuation.ValuationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps fatal valuation outcomes: NO_PROVIDERS_AVAILABLE to 503, NO_DATA_AVAILABLE to 404.
 */
@RestControllerAdvice
@Slf4j
public class ValuationExceptionHandler {

    @ExceptionHandler(ValuationException.class)
    public ResponseEntity<ErrorBody> handleValuation(ValuationException ex) {
        HttpStatus status = switch (ex.getKind()) {
            case NO_PROVIDERS_AVAILABLE -> HttpStatus.SERVICE_UNAVAILABLE;
            case NO_DATA_AVAILABLE -> HttpStatus.NOT_FOUND;
        };
        log.info("Valuation failed with {}: {}", ex.getKind(), ex.getMessage());
        return ResponseEntity.status(status).body(ErrorBody.of(ex.getKind().name(), ex.getMessage()));
    }
}
