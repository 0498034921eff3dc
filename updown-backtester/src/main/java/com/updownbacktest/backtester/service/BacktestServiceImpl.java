package com.updownbacktest.backtester.service;

import com.updownbacktest.backtester.client.AssetCandleFeed;
import com.updownbacktest.backtester.config.BacktestProperties;
import com.updownbacktest.backtester.controller.dto.QuickCheckResponse;
import com.updownbacktest.backtester.domain.BacktestOptions;
import com.updownbacktest.backtester.domain.BacktestReport;
import com.updownbacktest.backtester.domain.BacktestStrategy;
import com.updownbacktest.backtester.domain.Candle;
import com.updownbacktest.backtester.domain.MarketWindow;
import com.updownbacktest.backtester.domain.SettlementMode;
import com.updownbacktest.backtester.domain.Tick;
import com.updownbacktest.backtester.engine.BacktestLedger;
import com.updownbacktest.backtester.engine.CandleBuilder;
import com.updownbacktest.backtester.engine.IndicatorSeries;
import com.updownbacktest.backtester.engine.MarketSelector;
import com.updownbacktest.backtester.engine.MarketSimulator;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Backtest orchestrator. Resolves the market set of a run, replays each market in
 * order and aggregates the ledger into a report. A run is sequential and owns its
 * ledger, so concurrent runs share nothing but the data stores.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BacktestServiceImpl implements BacktestService {

    private final MarketDataService marketDataService;
    private final IndicatorService indicatorService;
    private final MarketVerificationService marketVerificationService;
    private final AssetCandleFeed assetCandleFeed;
    private final CandleBuilder candleBuilder;
    private final MarketSelector marketSelector;
    private final MarketSimulator marketSimulator;
    private final BacktestProperties properties;
    private final BacktestMetricsService metricsService;
    private final Clock clock;

    @Override
    public BacktestReport runBacktest(BacktestStrategy strategy, BigDecimal initialBalance, BacktestOptions options) {
        MDC.put("strategy", strategy.getName());
        long startTime = System.currentTimeMillis();
        metricsService.recordRunStarted();

        try {
            BacktestReport report = execute(strategy, initialBalance,
                    options != null ? options : new BacktestOptions());

            metricsService.recordRunCompleted(report.getMarketsProcessed(), report.getMarketsSkipped(),
                    System.currentTimeMillis() - startTime);
            log.info("Backtest completed - Markets: {} processed, {} skipped, Trades: {}, PnL: {} ({}%), " +
                            "Win Rate: {}%, Max DD: {}%, Sharpe: {}",
                    report.getMarketsProcessed(), report.getMarketsSkipped(), report.getTotalTrades(),
                    report.getTotalPnl(), report.getTotalPnlPercent(), report.getWinRate(),
                    report.getMaxDrawdownPercent(), report.getSharpeRatio());
            log.debug("{}", metricsService.getMetricsSummary());
            return report;
        } catch (BacktestException | IllegalArgumentException e) {
            metricsService.recordRunFailed();
            log.error("Backtest failed: {}", e.getMessage(), e);
            throw e;
        } finally {
            MDC.remove("strategy");
        }
    }

    @Override
    public QuickCheckResponse quickCheck(BacktestStrategy strategy, String marketId, int lookbackDays) {
        long now = clock.millis();
        BacktestOptions options = BacktestOptions.builder()
                .marketId(marketId)
                .startTime(now - Duration.ofDays(lookbackDays).toMillis())
                .endTime(now)
                .build();

        try {
            BacktestReport report = runBacktest(strategy, null, options);
            return QuickCheckResponse.builder()
                    .profitable(report.getTotalPnl().signum() > 0)
                    .pnlPercent(report.getTotalPnlPercent())
                    .winRate(report.getWinRate())
                    .build();
        } catch (BacktestException | IllegalArgumentException e) {
            log.warn("Quick check of {} reported unprofitable: {}", strategy.getName(), e.getMessage());
            return QuickCheckResponse.builder()
                    .profitable(false)
                    .pnlPercent(BigDecimal.ZERO)
                    .winRate(BigDecimal.ZERO)
                    .build();
        }
    }

    private BacktestReport execute(BacktestStrategy strategy, BigDecimal initialBalance, BacktestOptions options) {
        BigDecimal balance = initialBalance != null ? initialBalance : properties.getDefaultInitialBalance();
        if (balance.signum() <= 0) {
            throw new IllegalArgumentException("Initial balance must be positive");
        }
        if (strategy.getOrderLadder() == null || strategy.getOrderLadder().isEmpty()) {
            throw new IllegalArgumentException("Strategy has no order ladder");
        }

        int marketCount = options.getMarketCount() != null
                ? options.getMarketCount() : properties.getDefaultMarketCount();
        marketCount = Math.max(1, Math.min(marketCount, properties.getMaxMarketCount()));
        SettlementMode settlementMode = options.getOrderbookSettlement() != null
                ? options.getOrderbookSettlement() : properties.getSettlement().getOrderbookWithoutExit();

        BacktestLedger ledger = new BacktestLedger(balance);
        List<PlannedMarket> plan = planMarkets(strategy, options, marketCount, ledger);
        log.info("Starting backtest - Strategy: {}, Markets: {}, Balance: {}", strategy.getName(), plan.size(), balance);

        for (PlannedMarket planned : plan) {
            runMarket(strategy, planned, options, settlementMode, ledger);
        }

        if (ledger.getMarketsProcessed() == 0) {
            throw new BacktestFailedException("No markets could be processed ("
                    + plan.size() + " planned, " + ledger.getMarketsSkipped() + " skipped)");
        }
        return ledger.toReport(strategy, properties.getProfitFactorCap());
    }

    private List<PlannedMarket> planMarkets(BacktestStrategy strategy, BacktestOptions options, int marketCount,
                                            BacktestLedger ledger) {
        String marketId = options.getMarketId() != null ? options.getMarketId() : strategy.getMarketId();
        if (marketId != null && !marketId.isBlank()) {
            log.info("Single-market backtest on {}", marketId);
            MarketWindow market = MarketWindow.builder().marketId(marketId).build();
            return Collections.singletonList(new PlannedMarket(market, null, null));
        }
        if (strategy.isIndicatorTriggered()) {
            return planSignalMarkets(strategy, options, marketCount, ledger);
        }
        return planHighVarianceMarkets(strategy, options, marketCount);
    }

    /**
     * Indicators run once over the continuous asset feed; each confirmed signal
     * trades the next market of the strategy's timeframe.
     */
    private List<PlannedMarket> planSignalMarkets(BacktestStrategy strategy, BacktestOptions options,
                                                  int marketCount, BacktestLedger ledger) {
        if (strategy.getAsset() == null) {
            throw new IllegalArgumentException("Multi-market backtests need a strategy asset");
        }

        List<MarketWindow> markets = marketDataService.findCompletedMarkets(MarketFilter.builder()
                .timeframe(strategy.getTimeframe())
                .startTime(options.getStartTime())
                .endTime(options.getEndTime())
                .build());
        if (markets.isEmpty()) {
            throw new NoMarketsFoundException("No completed " + strategy.getTimeframe().getLabel()
                    + " markets found for " + strategy.getAsset());
        }

        List<Candle> candles;
        try {
            candles = assetCandleFeed.getCandleHistory(strategy.getAsset(), strategy.getTimeframe(),
                    properties.getAssetCandleCount());
        } catch (RestClientException e) {
            throw new HistoricalDataUnavailableException("Asset candle feed unavailable: " + e.getMessage(), e);
        }

        int warmup = Math.max(strategy.requiredWarmupCandles(), 2);
        if (candles.size() < warmup) {
            throw new BacktestFailedException("Asset feed returned " + candles.size()
                    + " candles, indicators need " + warmup);
        }

        Map<String, IndicatorSeries> series = indicatorService.calculateAll(strategy.getAsset(),
                strategy.getTimeframe(), candles, strategy.conditionIndicators());

        MarketSelector.Selection selection = marketSelector.select(MarketSelector.SelectionRequest.builder()
                        .candles(candles)
                        .conditions(strategy.getConditions())
                        .logic(strategy.getConditionLogic())
                        .series(series)
                        .markets(markets)
                        .candleDurationMs(strategy.getTimeframe().getDurationMs())
                        .executionLagCandles(properties.getExecutionLagCandles())
                        .maxMarkets(marketCount)
                        .build(),
                marketVerificationService.openSession(strategy.getAsset(), strategy.getTimeframe()));
        ledger.recordConditionsTriggered(selection.getTriggerCount());

        return selection.getMarkets().stream()
                .map(selected -> new PlannedMarket(selected.getMarket(), selected, null))
                .collect(Collectors.toList());
    }

    /**
     * Orderbook-only strategies are tested on the completed markets whose direction
     * price moved the most.
     */
    private List<PlannedMarket> planHighVarianceMarkets(BacktestStrategy strategy, BacktestOptions options,
                                                        int marketCount) {
        List<MarketWindow> candidates = marketDataService.findCompletedMarkets(MarketFilter.builder()
                .timeframe(strategy.getTimeframe())
                .startTime(options.getStartTime())
                .endTime(options.getEndTime())
                .limit(properties.getVarianceCandidatePool())
                .build());
        if (candidates.isEmpty()) {
            throw new NoMarketsFoundException("No completed " + strategy.getTimeframe().getLabel()
                    + " markets found");
        }

        List<RankedMarket> ranked = new ArrayList<>();
        for (MarketWindow market : candidates) {
            List<Tick> ticks = marketDataService.loadMarketTicks(market.getMarketId());
            ranked.add(new RankedMarket(market, ticks, priceVariance(ticks, strategy)));
        }

        return ranked.stream()
                .sorted(Comparator.comparingDouble(RankedMarket::getVariance).reversed()
                        .thenComparing(r -> r.getMarket().getMarketId()))
                .limit(marketCount)
                .sorted(Comparator.comparingLong((RankedMarket r) -> r.getMarket().getEventStartMs())
                        .thenComparing(r -> r.getMarket().getMarketId()))
                .map(r -> new PlannedMarket(r.getMarket(), null, r.getTicks()))
                .collect(Collectors.toList());
    }

    private void runMarket(BacktestStrategy strategy, PlannedMarket planned, BacktestOptions options,
                           SettlementMode settlementMode, BacktestLedger ledger) {
        String marketId = planned.getMarket().getMarketId();
        MDC.put("market", marketId);
        try {
            List<Tick> ticks = withinRange(planned.getTicks() != null
                    ? planned.getTicks() : marketDataService.loadMarketTicks(marketId), options);
            if (ticks.isEmpty()) {
                log.warn("Market {} has no price history in the requested range, skipping", marketId);
                ledger.recordMarketSkipped();
                return;
            }

            List<Candle> candles = candleBuilder.build(ticks, strategy.getTimeframe(), strategy.getDirection());
            Map<String, IndicatorSeries> series = Collections.emptyMap();
            if (strategy.isIndicatorTriggered() && planned.getSignal() == null) {
                int warmup = strategy.requiredWarmupCandles();
                if (candles.size() < warmup) {
                    log.warn("Market {} has {} candles, indicators need {}, skipping",
                            marketId, candles.size(), warmup);
                    ledger.recordMarketSkipped();
                    return;
                }
                series = indicatorService.calculateAll(null, strategy.getTimeframe(), candles,
                        strategy.conditionIndicators());
            }

            MarketSimulator.MarketRun.MarketRunBuilder run = MarketSimulator.MarketRun.builder()
                    .strategy(strategy)
                    .marketId(marketId)
                    .marketStartMs(planned.getMarket().getEventStartMs())
                    .ticks(ticks)
                    .candles(candles)
                    .series(series)
                    .exitPriceCents(options.hasExitPrice() ? options.getExitPriceCents() : null)
                    .orderbookSettlement(settlementMode);
            if (planned.getSignal() != null) {
                run.signalTimestamp(planned.getSignal().getTriggerTimestamp())
                        .signalReason(planned.getSignal().getReason());
            }

            marketSimulator.run(run.build(), ledger);
            ledger.recordMarketProcessed();
            log.info("Market {} done - {} ticks, {} candles, balance {}",
                    marketId, ticks.size(), candles.size(), ledger.getBalance());
        } finally {
            MDC.remove("market");
        }
    }

    private List<Tick> withinRange(List<Tick> ticks, BacktestOptions options) {
        if (options.getStartTime() == null && options.getEndTime() == null) {
            return ticks;
        }
        long start = options.getStartTime() != null ? options.getStartTime() : Long.MIN_VALUE;
        long end = options.getEndTime() != null ? options.getEndTime() : Long.MAX_VALUE;
        return ticks.stream()
                .filter(tick -> tick.getTimestamp() >= start && tick.getTimestamp() <= end)
                .collect(Collectors.toList());
    }

    private double priceVariance(List<Tick> ticks, BacktestStrategy strategy) {
        List<Integer> prices = ticks.stream()
                .map(tick -> tick.priceFor(strategy.getDirection()))
                .filter(cents -> cents > 0)
                .collect(Collectors.toList());
        if (prices.size() < 2) {
            return 0;
        }
        double mean = prices.stream().mapToInt(Integer::intValue).average().orElse(0);
        return prices.stream().mapToDouble(p -> (p - mean) * (p - mean)).sum() / prices.size();
    }

    @Getter
    @AllArgsConstructor
    private static class PlannedMarket {
        private final MarketWindow market;
        private final MarketSelector.SelectedMarket signal;
        /** Ticks already loaded while planning, if any. */
        private final List<Tick> ticks;
    }

    @Getter
    @AllArgsConstructor
    private static class RankedMarket {
        private final MarketWindow market;
        private final List<Tick> ticks;
        private final double variance;
    }
}
