package com.updownbacktest.backtester.engine;

import com.updownbacktest.backtester.domain.Candle;
import com.updownbacktest.backtester.domain.ConditionLogic;
import com.updownbacktest.backtester.domain.Condition;
import com.updownbacktest.backtester.domain.MarketWindow;
import lombok.Builder;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Maps condition signals computed on a continuous asset feed to the discrete market
 * windows they should trade. A signal is known only once its candle has closed, so
 * it is matched to the next market starting at or after the close, never the one in
 * progress.
 */
@Slf4j
@RequiredArgsConstructor
public class MarketSelector {

    private final ConditionEvaluator conditionEvaluator;

    /**
     * Select up to {@code request.maxMarkets} markets, newest signals first, and
     * return them in chronological order.
     *
     * @param acceptable extra check a candidate must pass (metadata verification)
     */
    public Selection select(SelectionRequest request, Predicate<MarketWindow> acceptable) {
        List<Candle> candles = request.getCandles();
        long candleMs = request.getCandleDurationMs();
        long windowMs = candleMs * Math.max(request.getExecutionLagCandles(), 0);

        List<MarketWindow> markets = new ArrayList<>(request.getMarkets());
        markets.sort(Comparator.comparingLong(MarketWindow::getEventStartMs)
                .thenComparing(MarketWindow::getMarketId));

        List<SelectedMarket> selected = new ArrayList<>();
        Set<String> selectedIds = new HashSet<>();
        int triggers = 0;
        int unmatched = 0;

        for (int i = candles.size() - 1; i >= 1 && selected.size() < request.getMaxMarkets(); i--) {
            ConditionEvaluator.Outcome outcome = conditionEvaluator.evaluate(
                    request.getConditions(), request.getLogic(), candles, i, request.getSeries());
            if (!outcome.isTriggered()) {
                continue;
            }
            triggers++;

            long triggerTime = candles.get(i).getTimestamp() + candleMs;
            MarketWindow match = firstAcceptable(markets, triggerTime, windowMs, acceptable);
            if (match == null) {
                unmatched++;
                log.warn("No market starts within {}ms after trigger at {}, dropping signal", windowMs, triggerTime);
                continue;
            }
            if (!selectedIds.add(match.getMarketId())) {
                log.debug("Trigger at {} resolves to already selected market {}", triggerTime, match.getMarketId());
                continue;
            }
            selected.add(new SelectedMarket(match, triggerTime, outcome.describe()));
        }

        List<SelectedMarket> chronological = selected.stream()
                .sorted(Comparator.comparingLong((SelectedMarket s) -> s.getMarket().getEventStartMs())
                        .thenComparing(s -> s.getMarket().getMarketId()))
                .collect(Collectors.toList());

        log.info("Selected {} markets from {} triggers ({} without a matching market)",
                chronological.size(), triggers, unmatched);
        return new Selection(chronological, triggers, unmatched);
    }

    private MarketWindow firstAcceptable(List<MarketWindow> markets, long triggerTime, long windowMs,
                                         Predicate<MarketWindow> acceptable) {
        // markets are sorted by start, so the first acceptable one in range is the closest
        for (MarketWindow market : markets) {
            long start = market.getEventStartMs();
            if (start < triggerTime) {
                continue;
            }
            if (start > triggerTime + windowMs) {
                break;
            }
            if (acceptable.test(market)) {
                return market;
            }
        }
        return null;
    }

    /**
     * Inputs of one selection pass.
     */
    @Value
    @Builder
    public static class SelectionRequest {
        List<Candle> candles;
        List<Condition> conditions;
        ConditionLogic logic;
        Map<String, IndicatorSeries> series;
        List<MarketWindow> markets;
        long candleDurationMs;
        int executionLagCandles;
        int maxMarkets;
    }

    @Getter
    @RequiredArgsConstructor
    public static class SelectedMarket {
        private final MarketWindow market;
        private final long triggerTimestamp;
        private final String reason;
    }

    @Getter
    @RequiredArgsConstructor
    public static class Selection {
        private final List<SelectedMarket> markets;
        private final int triggerCount;
        private final int unmatchedTriggers;
    }
}
