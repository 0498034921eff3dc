package com.updownbacktest.backtester.service;

import com.updownbacktest.backtester.controller.dto.QuickCheckResponse;
import com.updownbacktest.backtester.domain.BacktestOptions;
import com.updownbacktest.backtester.domain.BacktestReport;
import com.updownbacktest.backtester.domain.BacktestStrategy;

import java.math.BigDecimal;

/**
 * Service interface for running backtests.
 */
public interface BacktestService {

    /**
     * Replay historical data through a strategy.
     *
     * @param initialBalance starting balance, or null for the configured default
     * @return the full report
     * @throws NoMarketsFoundException            when no candidate market exists
     * @throws BacktestFailedException            when no market could be processed
     * @throws HistoricalDataUnavailableException when the price store is unreachable
     */
    BacktestReport runBacktest(BacktestStrategy strategy, BigDecimal initialBalance, BacktestOptions options);

    /**
     * Backtest the recent past and report whether the strategy made money. Never
     * throws for run failures; they count as unprofitable.
     */
    QuickCheckResponse quickCheck(BacktestStrategy strategy, String marketId, int lookbackDays);
}
