package com.updownbacktest.backtester.engine;

import com.updownbacktest.backtester.domain.ActiveTrade;
import com.updownbacktest.backtester.domain.BacktestReport;
import com.updownbacktest.backtester.domain.BacktestStrategy;
import com.updownbacktest.backtester.domain.BacktestTrade;
import com.updownbacktest.backtester.domain.OrderLadderItem;
import com.updownbacktest.backtester.domain.PerformanceMetrics;
import com.updownbacktest.backtester.domain.TradeSide;
import lombok.Getter;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Balance, trade log, per-trade returns and drawdown of a single run. Owned by
 * one run and never shared between threads.
 */
@Getter
public class BacktestLedger {

    private final BigDecimal initialBalance;
    private BigDecimal balance;
    private final List<BacktestTrade> trades = new ArrayList<>();
    private final List<BigDecimal> returns = new ArrayList<>();

    private BigDecimal peakEquity;
    private BigDecimal maxDrawdown = BigDecimal.ZERO;
    private BigDecimal maxDrawdownPercent = BigDecimal.ZERO;

    private Long firstTimestamp;
    private Long lastTimestamp;

    private int candlesProcessed;
    private int conditionsTriggered;
    private int marketsProcessed;
    private int marketsSkipped;

    public BacktestLedger(BigDecimal initialBalance) {
        this.initialBalance = initialBalance;
        this.balance = initialBalance;
        this.peakEquity = initialBalance;
    }

    public boolean canAfford(BigDecimal cost) {
        return balance.compareTo(cost) >= 0;
    }

    /**
     * Fill a ladder order and open the market's position. Returns null when the
     * balance does not cover the order.
     */
    public ActiveTrade open(String marketId, long timestamp, OrderLadderItem order, String reason) {
        BigDecimal cost = order.getCost();
        if (!canAfford(cost)) {
            return null;
        }

        balance = balance.subtract(cost);
        trades.add(BacktestTrade.builder()
                .marketId(marketId)
                .timestamp(timestamp)
                .side(TradeSide.BUY)
                .price(order.getPrice())
                .shares(order.getShares())
                .value(cost)
                .balance(balance)
                .triggerReason(reason)
                .build());

        return ActiveTrade.builder()
                .marketId(marketId)
                .entryTimestamp(timestamp)
                .entryPriceCents(order.getPriceCents())
                .shares(order.getShares())
                .cost(cost)
                .maxPriceCents(order.getPriceCents())
                .build();
    }

    /**
     * Close a position at {@code pricePerShare} and record its realized return.
     */
    public BacktestTrade close(ActiveTrade position, long timestamp, TradeSide side, BigDecimal pricePerShare,
                               String reason) {
        BigDecimal value = pricePerShare.multiply(BigDecimal.valueOf(position.getShares()));
        BigDecimal pnl = value.subtract(position.getCost());
        balance = balance.add(value);

        if (position.getCost().compareTo(BigDecimal.ZERO) > 0) {
            returns.add(pnl.divide(position.getCost(), 10, RoundingMode.HALF_UP));
        }

        BacktestTrade trade = BacktestTrade.builder()
                .marketId(position.getMarketId())
                .timestamp(timestamp)
                .side(side)
                .price(pricePerShare)
                .shares(position.getShares())
                .value(value)
                .pnl(pnl)
                .balance(balance)
                .triggerReason(reason)
                .build();
        trades.add(trade);
        return trade;
    }

    /**
     * Record equity at a tick, including the unrealized value of an open position.
     */
    public void markEquity(long timestamp, ActiveTrade openPosition, int priceCents) {
        if (firstTimestamp == null) {
            firstTimestamp = timestamp;
        }
        lastTimestamp = timestamp;

        BigDecimal equity = openPosition == null ? balance : balance.add(openPosition.valueAt(priceCents));
        if (equity.compareTo(peakEquity) > 0) {
            peakEquity = equity;
        }

        BigDecimal drawdown = peakEquity.subtract(equity);
        if (drawdown.compareTo(maxDrawdown) > 0) {
            maxDrawdown = drawdown;
        }
        if (peakEquity.compareTo(BigDecimal.ZERO) > 0) {
            BigDecimal percent = drawdown
                    .divide(peakEquity, 6, RoundingMode.HALF_UP)
                    .multiply(BigDecimal.valueOf(100))
                    .setScale(4, RoundingMode.HALF_UP);
            if (percent.compareTo(maxDrawdownPercent) > 0) {
                maxDrawdownPercent = percent;
            }
        }
    }

    /**
     * Compute the run's statistics. Only closing trades with a non-zero P&L count
     * as wins or losses.
     */
    public BacktestReport toReport(BacktestStrategy strategy, BigDecimal profitFactorCap) {
        List<BigDecimal> wins = new ArrayList<>();
        List<BigDecimal> losses = new ArrayList<>();
        for (BacktestTrade trade : trades) {
            if (trade.getPnl() == null) {
                continue;
            }
            int sign = trade.getPnl().signum();
            if (sign > 0) {
                wins.add(trade.getPnl());
            } else if (sign < 0) {
                losses.add(trade.getPnl().abs());
            }
        }

        BigDecimal grossProfit = wins.stream().reduce(BigDecimal.ZERO, BigDecimal::add);
        BigDecimal grossLoss = losses.stream().reduce(BigDecimal.ZERO, BigDecimal::add);

        return BacktestReport.builder()
                .strategyId(strategy.getId() != null ? strategy.getId() : "unknown")
                .strategyName(strategy.getName())
                .startTime(firstTimestamp != null ? firstTimestamp : 0L)
                .endTime(lastTimestamp != null ? lastTimestamp : 0L)
                .initialBalance(initialBalance)
                .finalBalance(balance)
                .totalPnl(balance.subtract(initialBalance))
                .totalPnlPercent(PerformanceMetrics.calculateTotalReturn(initialBalance, balance))
                .totalTrades(trades.size())
                .winningTrades(wins.size())
                .losingTrades(losses.size())
                .winRate(PerformanceMetrics.calculateWinRate(wins.size(), wins.size() + losses.size()))
                .avgWin(PerformanceMetrics.calculateAverage(wins))
                .avgLoss(PerformanceMetrics.calculateAverage(losses))
                .profitFactor(PerformanceMetrics.calculateProfitFactor(grossProfit, grossLoss, profitFactorCap))
                .maxDrawdown(maxDrawdown)
                .maxDrawdownPercent(maxDrawdownPercent)
                .sharpeRatio(PerformanceMetrics.calculateSharpeRatio(returns))
                .trades(List.copyOf(trades))
                .candlesProcessed(candlesProcessed)
                .conditionsTriggered(conditionsTriggered)
                .marketsProcessed(marketsProcessed)
                .marketsSkipped(marketsSkipped)
                .build();
    }

    public void recordCandles(int count) {
        candlesProcessed += count;
    }

    public void recordConditionTriggered() {
        conditionsTriggered++;
    }

    public void recordConditionsTriggered(int count) {
        conditionsTriggered += count;
    }

    public void recordMarketProcessed() {
        marketsProcessed++;
    }

    public void recordMarketSkipped() {
        marketsSkipped++;
    }

    public List<BacktestTrade> getTrades() {
        return Collections.unmodifiableList(trades);
    }
}
