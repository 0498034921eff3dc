package com.updownbacktest.backtester.engine;

import com.updownbacktest.backtester.domain.Candle;
import com.updownbacktest.backtester.domain.Prices;
import com.updownbacktest.backtester.domain.Tick;
import com.updownbacktest.backtester.domain.Timeframe;
import com.updownbacktest.backtester.domain.TradeDirection;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Aggregates market ticks into fixed-interval OHLC candles for one trade direction.
 * Volume is the tick count of the bucket.
 */
@Slf4j
public class CandleBuilder {

    /**
     * Build candles from chronologically ordered ticks. Zero prices are treated as
     * missing data. The last candle is returned with {@code closed = false}.
     */
    public List<Candle> build(List<Tick> ticks, Timeframe timeframe, TradeDirection direction) {
        if (ticks == null || ticks.isEmpty()) {
            return Collections.emptyList();
        }

        long intervalMs = timeframe.getDurationMs();
        List<Candle> candles = new ArrayList<>();

        long bucketStart = -1;
        double open = 0;
        double high = 0;
        double low = 0;
        double close = 0;
        long volume = 0;

        for (Tick tick : ticks) {
            int cents = tick.priceFor(direction);
            if (cents == 0) {
                continue;
            }
            double price = Prices.toUnit(cents);
            long tickBucket = Math.floorDiv(tick.getTimestamp(), intervalMs) * intervalMs;

            if (volume > 0 && tickBucket >= bucketStart + intervalMs) {
                candles.add(candle(bucketStart, open, high, low, close, volume, true));
                volume = 0;
            }

            if (volume == 0) {
                bucketStart = tickBucket;
                open = price;
                high = price;
                low = price;
                close = price;
                volume = 1;
            } else {
                high = Math.max(high, price);
                low = Math.min(low, price);
                close = price;
                volume++;
            }
        }

        if (volume > 0) {
            candles.add(candle(bucketStart, open, high, low, close, volume, false));
        }

        log.debug("Built {} {} candles from {} ticks", candles.size(), timeframe.getLabel(), ticks.size());
        return candles;
    }

    private Candle candle(long timestamp, double open, double high, double low, double close,
                          long volume, boolean closed) {
        return Candle.builder()
                .timestamp(timestamp)
                .open(open)
                .high(high)
                .low(low)
                .close(close)
                .volume(volume)
                .closed(closed)
                .build();
    }
}
