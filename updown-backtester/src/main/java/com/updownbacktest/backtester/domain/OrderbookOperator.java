package com.updownbacktest.backtester.domain;

public enum OrderbookOperator {
    GREATER_THAN,
    LESS_THAN,
    EQUALS,
    BETWEEN;

    public static OrderbookOperator fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Orderbook rule operator is required");
        }
        String normalized = raw.trim().toLowerCase().replaceAll("[\\s-]+", "_");
        return switch (normalized) {
            case ">", "greater_than", "above" -> GREATER_THAN;
            case "<", "less_than", "below" -> LESS_THAN;
            case "=", "==", "equals", "equal" -> EQUALS;
            case "between" -> BETWEEN;
            default -> throw new IllegalArgumentException("Unknown orderbook operator: " + raw);
        };
    }
}
