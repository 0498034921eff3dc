package com.updownbacktest.backtester.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.HashMap;
import java.util.Map;

/**
 * A technical indicator attached to a strategy.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Indicator {

    private String id;
    private IndicatorType type;
    private Timeframe timeframe;

    @Builder.Default
    private Map<String, Double> parameters = new HashMap<>();

    @Builder.Default
    private boolean useInConditions = true;

    public int intParameter(String name, int defaultValue) {
        Double value = parameters == null ? null : parameters.get(name);
        if (value == null || value <= 0) {
            return defaultValue;
        }
        return value.intValue();
    }

    public double doubleParameter(String name, double defaultValue) {
        Double value = parameters == null ? null : parameters.get(name);
        if (value == null || value <= 0) {
            return defaultValue;
        }
        return value;
    }

    /**
     * Minimum number of candles before this indicator yields a value.
     */
    public int requiredCandles() {
        return switch (type) {
            case RSI, ATR -> intParameter("length", 14) + 1;
            case MACD -> intParameter("slow", 26) + intParameter("signal", 9);
            case SMA, EMA -> intParameter("length", 20);
            case BOLLINGER_BANDS -> intParameter("length", 20);
            case STOCHASTIC -> intParameter("k", 14) + intParameter("d", 3);
            case VWAP -> 1;
            case ROLLING_UP_PERCENT -> intParameter("length", 50);
        };
    }
}
