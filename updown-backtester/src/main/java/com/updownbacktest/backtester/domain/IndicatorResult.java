package com.updownbacktest.backtester.domain;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;
import java.util.Optional;

/**
 * One indicator value at one timestamp: an optional scalar plus named sub-values
 * (for example {@code macd}, {@code signal}, {@code histogram}).
 */
@Value
@Builder
public class IndicatorResult {

    long timestamp;
    Double value;

    @Singular
    Map<String, Double> fields;

    /**
     * Resolves a named field, or the scalar when {@code field} is null.
     */
    public Optional<Double> resolve(String field) {
        if (field == null || field.isEmpty()) {
            return Optional.ofNullable(value).filter(v -> !v.isNaN());
        }
        return Optional.ofNullable(fields.get(field)).filter(v -> !v.isNaN());
    }
}
