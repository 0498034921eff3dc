package com.updownbacktest.backtester.domain;

/**
 * Side of an up/down market a strategy trades.
 * UP reads the yes-price, DOWN reads the no-price.
 */
public enum TradeDirection {
    UP,
    DOWN;

    public static TradeDirection fromString(String raw) {
        if (raw == null) {
            return UP;
        }
        return switch (raw.trim().toUpperCase()) {
            case "DOWN", "NO" -> DOWN;
            default -> UP;
        };
    }
}
