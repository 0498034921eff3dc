package com.updownbacktest.backtester.client;

import com.updownbacktest.backtester.domain.Candle;
import com.updownbacktest.backtester.domain.Timeframe;

import java.util.List;

/**
 * Continuous OHLCV history of an underlying asset.
 */
public interface AssetCandleFeed {

    /**
     * Closed candles only, oldest first.
     */
    List<Candle> getCandleHistory(String asset, Timeframe timeframe, int count);
}
