package com.updownbacktest.backtester.controller;

import com.updownbacktest.backtester.controller.dto.ErrorResponse;
import com.updownbacktest.backtester.service.BacktestFailedException;
import com.updownbacktest.backtester.service.HistoricalDataUnavailableException;
import com.updownbacktest.backtester.service.NoMarketsFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.stream.Collectors;

/**
 * Maps run failures to error responses.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(HistoricalDataUnavailableException.class)
    public ResponseEntity<ErrorResponse> handleDataUnavailable(HistoricalDataUnavailableException e) {
        return respond(HttpStatus.SERVICE_UNAVAILABLE, e.getMessage());
    }

    @ExceptionHandler(NoMarketsFoundException.class)
    public ResponseEntity<ErrorResponse> handleNoMarkets(NoMarketsFoundException e) {
        return respond(HttpStatus.NOT_FOUND, e.getMessage());
    }

    @ExceptionHandler(BacktestFailedException.class)
    public ResponseEntity<ErrorResponse> handleBacktestFailed(BacktestFailedException e) {
        return respond(HttpStatus.UNPROCESSABLE_ENTITY, e.getMessage());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(IllegalArgumentException e) {
        return respond(HttpStatus.BAD_REQUEST, e.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidation(MethodArgumentNotValidException e) {
        String message = e.getBindingResult().getFieldErrors().stream()
                .map(FieldError::getDefaultMessage)
                .collect(Collectors.joining("; "));
        return respond(HttpStatus.BAD_REQUEST, message);
    }

    private ResponseEntity<ErrorResponse> respond(HttpStatus status, String message) {
        log.warn("Request failed with {}: {}", status.value(), message);
        return ResponseEntity.status(status).body(ErrorResponse.of(message));
    }
}
