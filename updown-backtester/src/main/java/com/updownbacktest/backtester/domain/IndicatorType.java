package com.updownbacktest.backtester.domain;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Technical indicators the calculator and the cache know about.
 */
@Getter
@RequiredArgsConstructor
public enum IndicatorType {
    RSI("RSI"),
    MACD("MACD"),
    SMA("SMA"),
    EMA("EMA"),
    BOLLINGER_BANDS("Bollinger Bands"),
    STOCHASTIC("Stochastic"),
    ATR("ATR"),
    VWAP("VWAP"),
    ROLLING_UP_PERCENT("Rolling Up %");

    private final String displayName;

    public static IndicatorType fromString(String raw) {
        if (raw == null) {
            throw new IllegalArgumentException("Indicator type is required");
        }
        String normalized = raw.trim();
        for (IndicatorType type : values()) {
            if (type.displayName.equalsIgnoreCase(normalized) || type.name().equalsIgnoreCase(normalized)) {
                return type;
            }
        }
        String compact = normalized.replaceAll("[\\s_%-]", "").toUpperCase();
        return switch (compact) {
            case "BOLLINGER", "BOLLINGERBANDS", "BB" -> BOLLINGER_BANDS;
            case "ROLLINGUP", "ROLLINGUPPERCENT" -> ROLLING_UP_PERCENT;
            case "STOCH" -> STOCHASTIC;
            default -> throw new IllegalArgumentException("Unknown indicator type: " + raw);
        };
    }
}
