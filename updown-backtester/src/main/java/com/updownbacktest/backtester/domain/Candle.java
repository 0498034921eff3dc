package com.updownbacktest.backtester.domain;

import lombok.Builder;
import lombok.Value;

/**
 * OHLCV bucket. Market candles carry prices in [0, 1] and tick counts as volume;
 * asset-feed candles carry quote prices and traded volume.
 */
@Value
@Builder(toBuilder = true)
public class Candle {

    long timestamp;
    double open;
    double high;
    double low;
    double close;
    long volume;
    boolean closed;
}
