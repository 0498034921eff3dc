package com.updownbacktest.backtester.engine;

import com.updownbacktest.backtester.domain.Candle;
import com.updownbacktest.backtester.domain.Tick;
import com.updownbacktest.backtester.domain.Timeframe;
import com.updownbacktest.backtester.domain.TradeDirection;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for CandleBuilder bucketing.
 */
class CandleBuilderTest {

    private static final long MINUTE = 60_000L;

    private final CandleBuilder candleBuilder = new CandleBuilder();

    @Test
    void testBuild_BucketsTicksIntoCandles() {
        // Arrange
        List<Tick> ticks = List.of(
                tick(0, 50, 50),
                tick(20_000, 55, 45),
                tick(40_000, 48, 52),
                tick(MINUTE + 5_000, 60, 40),
                tick(MINUTE + 30_000, 62, 38));

        // Act
        List<Candle> candles = candleBuilder.build(ticks, Timeframe.ONE_MINUTE, TradeDirection.UP);

        // Assert
        assertEquals(2, candles.size());
        Candle first = candles.get(0);
        assertEquals(0L, first.getTimestamp());
        assertEquals(0.50, first.getOpen(), 1e-9);
        assertEquals(0.55, first.getHigh(), 1e-9);
        assertEquals(0.48, first.getLow(), 1e-9);
        assertEquals(0.48, first.getClose(), 1e-9);
        assertEquals(3L, first.getVolume(), "Volume should be the tick count");
        assertTrue(first.isClosed());

        Candle last = candles.get(1);
        assertEquals(MINUTE, last.getTimestamp());
        assertEquals(0.62, last.getClose(), 1e-9);
        assertFalse(last.isClosed(), "Last candle should be marked as open");
    }

    @Test
    void testBuild_DownDirectionUsesNoPrice() {
        // Arrange
        List<Tick> ticks = List.of(tick(0, 50, 50), tick(10_000, 70, 30));

        // Act
        List<Candle> candles = candleBuilder.build(ticks, Timeframe.ONE_MINUTE, TradeDirection.DOWN);

        // Assert
        assertEquals(1, candles.size());
        assertEquals(0.50, candles.get(0).getOpen(), 1e-9);
        assertEquals(0.30, candles.get(0).getClose(), 1e-9);
    }

    @Test
    void testBuild_SkipsZeroPrices() {
        // Arrange
        List<Tick> ticks = List.of(tick(0, 0, 0), tick(10_000, 40, 60), tick(20_000, 0, 0));

        // Act
        List<Candle> candles = candleBuilder.build(ticks, Timeframe.ONE_MINUTE, TradeDirection.UP);

        // Assert
        assertEquals(1, candles.size());
        assertEquals(1L, candles.get(0).getVolume());
        assertEquals(0.40, candles.get(0).getLow(), 1e-9);
    }

    @Test
    void testBuild_GapStartsNewAlignedBucket() {
        // Arrange
        List<Tick> ticks = List.of(tick(10_000, 50, 50), tick(5 * MINUTE + 1_000, 52, 48));

        // Act
        List<Candle> candles = candleBuilder.build(ticks, Timeframe.ONE_MINUTE, TradeDirection.UP);

        // Assert
        assertEquals(2, candles.size());
        assertEquals(0L, candles.get(0).getTimestamp());
        assertEquals(5 * MINUTE, candles.get(1).getTimestamp());
    }

    @Test
    void testBuild_EmptyInput() {
        // Act & Assert
        assertTrue(candleBuilder.build(List.of(), Timeframe.FIFTEEN_MINUTES, TradeDirection.UP).isEmpty());
        assertTrue(candleBuilder.build(null, Timeframe.FIFTEEN_MINUTES, TradeDirection.UP).isEmpty());
    }

    private Tick tick(long timestamp, int yesBid, int noBid) {
        return Tick.builder()
                .timestamp(timestamp)
                .yesBid(yesBid)
                .yesAsk(Math.min(yesBid + 1, 100))
                .noBid(noBid)
                .noAsk(Math.min(noBid + 1, 100))
                .build();
    }
}
