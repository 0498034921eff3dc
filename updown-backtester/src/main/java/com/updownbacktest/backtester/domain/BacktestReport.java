package com.updownbacktest.backtester.domain;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.util.List;

/**
 * Full report for one backtest run. Times are taken from the data, never from the clock.
 */
@Value
@Builder
@Jacksonized
public class BacktestReport {

    String strategyId;
    String strategyName;
    long startTime;
    long endTime;
    BigDecimal initialBalance;
    BigDecimal finalBalance;
    BigDecimal totalPnl;
    BigDecimal totalPnlPercent;
    int totalTrades;
    int winningTrades;
    int losingTrades;
    BigDecimal winRate;
    BigDecimal avgWin;
    BigDecimal avgLoss;
    BigDecimal profitFactor;
    BigDecimal maxDrawdown;
    BigDecimal maxDrawdownPercent;
    BigDecimal sharpeRatio;
    List<BacktestTrade> trades;
    int candlesProcessed;
    int conditionsTriggered;
    int marketsProcessed;
    int marketsSkipped;
}
