package com.updownbacktest.backtester.engine;

import com.updownbacktest.backtester.domain.ActiveTrade;
import com.updownbacktest.backtester.domain.BacktestStrategy;
import com.updownbacktest.backtester.domain.BacktestTrade;
import com.updownbacktest.backtester.domain.Candle;
import com.updownbacktest.backtester.domain.OrderbookRule;
import com.updownbacktest.backtester.domain.PositionState;
import com.updownbacktest.backtester.domain.SettlementMode;
import com.updownbacktest.backtester.domain.Tick;
import com.updownbacktest.backtester.domain.TradeDirection;
import lombok.Builder;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Replays one market's ticks through a strategy. A market opens at most one
 * position: NO_POSITION to OPEN on the first fill, OPEN to CLOSED on exit or at
 * market end, and never re-enters.
 */
@Slf4j
@RequiredArgsConstructor
public class MarketSimulator {

    private final ConditionEvaluator conditionEvaluator;
    private final OrderbookRuleEvaluator orderbookRuleEvaluator;
    private final OrderLadderExecutor orderLadderExecutor;
    private final PositionSettlement positionSettlement;

    /**
     * Run one market and fold its trades into {@code ledger}.
     *
     * @return the final position state of the market
     */
    public PositionState run(MarketRun run, BacktestLedger ledger) {
        BacktestStrategy strategy = run.getStrategy();
        TradeDirection direction = strategy.getDirection();
        List<Candle> candles = run.getCandles() == null ? Collections.emptyList() : run.getCandles();
        Map<String, IndicatorSeries> series = run.getSeries() == null ? Collections.emptyMap() : run.getSeries();
        long candleMs = strategy.getTimeframe().getDurationMs();
        boolean evaluateCandles = strategy.isIndicatorTriggered() && run.getSignalTimestamp() == null;
        String ruleReason = strategy.hasOrderbookRules() ? "Orderbook: " + strategy.getOrderbookRules().stream()
                .map(OrderbookRule::describe)
                .collect(Collectors.joining(", ")) : null;

        PositionState state = PositionState.NO_POSITION;
        ActiveTrade position = null;
        String pendingSignal = null;
        int nextCandle = 0;
        Integer previousCents = null;
        Integer lastCents = null;
        long lastTimestamp = 0;

        for (Tick tick : run.getTicks()) {
            int cents = tick.priceFor(direction);
            if (cents == 0) {
                continue;
            }
            long now = tick.getTimestamp();

            // candles are evaluated once their close time has passed
            while (evaluateCandles && nextCandle < candles.size()
                    && candles.get(nextCandle).getTimestamp() + candleMs <= now) {
                if (state == PositionState.NO_POSITION && pendingSignal == null) {
                    ConditionEvaluator.Outcome outcome = conditionEvaluator.evaluate(strategy.getConditions(),
                            strategy.getConditionLogic(), candles, nextCandle, series);
                    if (outcome.isTriggered()) {
                        ledger.recordConditionTriggered();
                        pendingSignal = outcome.describe();
                    }
                }
                nextCandle++;
            }

            if (state == PositionState.NO_POSITION) {
                position = tryEnter(run, ledger, tick, cents, previousCents, pendingSignal, ruleReason);
                if (position != null) {
                    state = PositionState.OPEN;
                }
            } else if (state == PositionState.OPEN) {
                BacktestTrade exit = positionSettlement.checkExit(ledger, position, now, cents,
                        run.getExitPriceCents());
                if (exit != null) {
                    state = PositionState.CLOSED;
                    position = null;
                }
            }

            ledger.markEquity(now, position, cents);
            previousCents = cents;
            lastCents = cents;
            lastTimestamp = now;
        }
        ledger.recordCandles(candles.size());

        if (state == PositionState.OPEN) {
            positionSettlement.settleAtMarketEnd(ledger, position, lastTimestamp, lastCents,
                    strategy.isIndicatorTriggered(), run.getExitPriceCents(), run.getOrderbookSettlement());
            ledger.markEquity(lastTimestamp, null, lastCents);
            state = PositionState.CLOSED;
        }
        return state;
    }

    private ActiveTrade tryEnter(MarketRun run, BacktestLedger ledger, Tick tick, int cents,
                                 Integer previousCents, String pendingSignal, String ruleReason) {
        BacktestStrategy strategy = run.getStrategy();
        long now = tick.getTimestamp();
        ActiveTrade position = null;

        if (run.getSignalTimestamp() != null
                && now >= Math.max(run.getSignalTimestamp(), run.getMarketStartMs())) {
            position = orderLadderExecutor.fillImmediately(ledger, run.getMarketId(), now,
                    strategy.getOrderLadder(), run.getSignalReason());
        } else if (pendingSignal != null) {
            position = orderLadderExecutor.fillImmediately(ledger, run.getMarketId(), now,
                    strategy.getOrderLadder(), pendingSignal);
        }

        if (position == null && ruleReason != null && previousCents != null
                && orderbookRuleEvaluator.evaluate(strategy.getOrderbookRules(), strategy.getConditionLogic(),
                tick, strategy.getDirection())) {
            position = orderLadderExecutor.fillOnCross(ledger, run.getMarketId(), now,
                    strategy.getOrderLadder(), previousCents, cents, ruleReason);
        }
        return position;
    }

    /**
     * Everything needed to replay one market.
     */
    @Value
    @Builder
    public static class MarketRun {
        BacktestStrategy strategy;
        String marketId;
        long marketStartMs;
        List<Tick> ticks;
        List<Candle> candles;
        Map<String, IndicatorSeries> series;
        /** Close time of the asset-feed signal that selected this market, if any. */
        Long signalTimestamp;
        String signalReason;
        Integer exitPriceCents;
        SettlementMode orderbookSettlement;
    }
}
