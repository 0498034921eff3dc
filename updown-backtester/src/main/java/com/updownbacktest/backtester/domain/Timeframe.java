package com.updownbacktest.backtester.domain;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Candle / market-window durations understood by the engine.
 */
@Getter
@RequiredArgsConstructor
public enum Timeframe {
    ONE_MINUTE("1m", 1),
    FIVE_MINUTES("5m", 5),
    FIFTEEN_MINUTES("15m", 15),
    ONE_HOUR("1h", 60),
    FOUR_HOURS("4h", 240),
    ONE_DAY("1d", 1440);

    private final String label;
    private final int minutes;

    public long getDurationMs() {
        return minutes * 60_000L;
    }

    /**
     * Unknown labels fall back to 15m.
     */
    public static Timeframe fromLabel(String label) {
        if (label == null) {
            return FIFTEEN_MINUTES;
        }
        String normalized = label.trim().toLowerCase();
        if ("hourly".equals(normalized)) {
            return ONE_HOUR;
        }
        for (Timeframe timeframe : values()) {
            if (timeframe.label.equals(normalized)) {
                return timeframe;
            }
        }
        return FIFTEEN_MINUTES;
    }
}
