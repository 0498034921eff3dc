package com.updownbacktest.backtester.domain;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Comparison operators of the condition DSL. Crossovers are stateful: they also
 * look at the previous candle.
 */
@Getter
@RequiredArgsConstructor
public enum ConditionOperator {
    GREATER_THAN(">"),
    LESS_THAN("<"),
    GREATER_EQUAL(">="),
    LESS_EQUAL("<="),
    EQUALS("=="),
    BETWEEN("between"),
    CROSSES_ABOVE("crosses_above"),
    CROSSES_BELOW("crosses_below");

    private final String symbol;

    public boolean isCrossover() {
        return this == CROSSES_ABOVE || this == CROSSES_BELOW;
    }

    /**
     * Accepts symbols and word forms regardless of case, spacing, dashes or underscores.
     */
    public static ConditionOperator fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Condition operator is required");
        }
        String normalized = raw.trim().toLowerCase().replaceAll("[\\s-]+", "_");
        return switch (normalized) {
            case ">", "greater_than", "gt" -> GREATER_THAN;
            case "<", "less_than", "lt" -> LESS_THAN;
            case ">=", "greater_equal", "greater_than_or_equal", "gte" -> GREATER_EQUAL;
            case "<=", "less_equal", "less_than_or_equal", "lte" -> LESS_EQUAL;
            case "==", "=", "equals", "equal", "eq" -> EQUALS;
            case "between" -> BETWEEN;
            case "crosses_above", "cross_above", "crossover" -> CROSSES_ABOVE;
            case "crosses_below", "cross_below", "crossunder" -> CROSSES_BELOW;
            default -> throw new IllegalArgumentException("Unknown condition operator: " + raw);
        };
    }
}
