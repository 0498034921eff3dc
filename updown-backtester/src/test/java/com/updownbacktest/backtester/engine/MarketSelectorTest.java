package com.updownbacktest.backtester.engine;

import com.updownbacktest.backtester.domain.Candle;
import com.updownbacktest.backtester.domain.Condition;
import com.updownbacktest.backtester.domain.ConditionLogic;
import com.updownbacktest.backtester.domain.ConditionOperator;
import com.updownbacktest.backtester.domain.MarketWindow;
import com.updownbacktest.backtester.domain.Operand;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for MarketSelector signal-to-market mapping.
 */
class MarketSelectorTest {

    private static final long CANDLE_MS = 15 * 60_000L;

    private final MarketSelector selector = new MarketSelector(new ConditionEvaluator());

    // closes above 0.5 at index 1 and 3, closing at 30m and 60m
    private final List<Candle> candles = candles(0.4, 0.6, 0.4, 0.6, 0.4);

    private final Condition priceAbove = Condition.builder()
            .sourceA(Operand.price())
            .operator(ConditionOperator.GREATER_THAN)
            .sourceB(Operand.value())
            .value(0.5)
            .build();

    @Test
    void testSelect_MatchesNextMarketAfterCandleClose() {
        // Arrange
        List<MarketWindow> markets = List.of(market("m45", 3), market("m60", 4), market("m30", 2),
                market("m15", 1));

        // Act
        MarketSelector.Selection selection = selector.select(request(markets, 10), m -> true);

        // Assert
        assertEquals(List.of("m30", "m60"), ids(selection));
        assertEquals(2, selection.getTriggerCount());
        assertEquals(0, selection.getUnmatchedTriggers());
        assertEquals(2 * CANDLE_MS, selection.getMarkets().get(0).getTriggerTimestamp());
        assertEquals("price > 0.5", selection.getMarkets().get(0).getReason());
    }

    @Test
    void testSelect_NeverPicksMarketInProgressAtSignal() {
        // Arrange - only markets already running when each signal candle closes
        List<MarketWindow> markets = List.of(market("m15", 1), market("m45", 3));
        MarketSelector.SelectionRequest request = MarketSelector.SelectionRequest.builder()
                .candles(candles)
                .conditions(List.of(priceAbove))
                .logic(ConditionLogic.ALL)
                .series(Map.of())
                .markets(markets)
                .candleDurationMs(CANDLE_MS)
                .executionLagCandles(0)
                .maxMarkets(10)
                .build();

        // Act
        MarketSelector.Selection selection = selector.select(request, m -> true);

        // Assert
        assertTrue(selection.getMarkets().isEmpty());
        assertEquals(2, selection.getUnmatchedTriggers());
    }

    @Test
    void testSelect_CapKeepsNewestSignals() {
        // Arrange
        List<MarketWindow> markets = List.of(market("m30", 2), market("m60", 4));

        // Act
        MarketSelector.Selection selection = selector.select(request(markets, 1), m -> true);

        // Assert
        assertEquals(List.of("m60"), ids(selection));
    }

    @Test
    void testSelect_RejectedCandidateFallsThroughToNextInWindow() {
        // Arrange
        List<MarketWindow> markets = List.of(market("m60", 4), market("m75", 5));
        Predicate<MarketWindow> rejectM60 = m -> !"m60".equals(m.getMarketId());

        // Act
        MarketSelector.Selection selection = selector.select(request(markets, 10), rejectM60);

        // Assert
        assertEquals(List.of("m75"), ids(selection));
    }

    @Test
    void testSelect_DuplicateMarketsDropped() {
        // Arrange - a single market reachable from both signals through a wide lag
        List<MarketWindow> markets = List.of(market("m60", 4));
        MarketSelector.SelectionRequest request = MarketSelector.SelectionRequest.builder()
                .candles(candles)
                .conditions(List.of(priceAbove))
                .logic(ConditionLogic.ALL)
                .series(Map.of())
                .markets(markets)
                .candleDurationMs(CANDLE_MS)
                .executionLagCandles(4)
                .maxMarkets(10)
                .build();

        // Act
        MarketSelector.Selection selection = selector.select(request, m -> true);

        // Assert
        assertEquals(List.of("m60"), ids(selection));
        assertEquals(2, selection.getTriggerCount());
    }

    private MarketSelector.SelectionRequest request(List<MarketWindow> markets, int maxMarkets) {
        return MarketSelector.SelectionRequest.builder()
                .candles(candles)
                .conditions(List.of(priceAbove))
                .logic(ConditionLogic.ALL)
                .series(Map.of())
                .markets(markets)
                .candleDurationMs(CANDLE_MS)
                .executionLagCandles(1)
                .maxMarkets(maxMarkets)
                .build();
    }

    private MarketWindow market(String id, int startCandle) {
        return MarketWindow.builder()
                .marketId(id)
                .eventStartMs(startCandle * CANDLE_MS)
                .eventEndMs((startCandle + 1) * CANDLE_MS)
                .tickCount(10)
                .build();
    }

    private List<String> ids(MarketSelector.Selection selection) {
        return selection.getMarkets().stream()
                .map(s -> s.getMarket().getMarketId())
                .collect(Collectors.toList());
    }

    private static List<Candle> candles(double... closes) {
        List<Candle> candles = new ArrayList<>();
        for (int i = 0; i < closes.length; i++) {
            candles.add(Candle.builder()
                    .timestamp(i * CANDLE_MS)
                    .open(closes[i])
                    .high(closes[i])
                    .low(closes[i])
                    .close(closes[i])
                    .volume(100)
                    .closed(true)
                    .build());
        }
        return candles;
    }
}
