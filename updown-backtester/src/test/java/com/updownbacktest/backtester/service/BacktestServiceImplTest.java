package com.updownbacktest.backtester.service;

import com.updownbacktest.backtester.client.AssetCandleFeed;
import com.updownbacktest.backtester.client.MarketMetadataResolver;
import com.updownbacktest.backtester.config.BacktestProperties;
import com.updownbacktest.backtester.controller.dto.QuickCheckResponse;
import com.updownbacktest.backtester.domain.BacktestOptions;
import com.updownbacktest.backtester.domain.BacktestReport;
import com.updownbacktest.backtester.domain.BacktestStrategy;
import com.updownbacktest.backtester.domain.Candle;
import com.updownbacktest.backtester.domain.Condition;
import com.updownbacktest.backtester.domain.ConditionOperator;
import com.updownbacktest.backtester.domain.Indicator;
import com.updownbacktest.backtester.domain.IndicatorResult;
import com.updownbacktest.backtester.domain.IndicatorType;
import com.updownbacktest.backtester.domain.MarketWindow;
import com.updownbacktest.backtester.domain.Operand;
import com.updownbacktest.backtester.domain.OrderLadderItem;
import com.updownbacktest.backtester.domain.OrderbookField;
import com.updownbacktest.backtester.domain.OrderbookOperator;
import com.updownbacktest.backtester.domain.OrderbookRule;
import com.updownbacktest.backtester.domain.SettlementMode;
import com.updownbacktest.backtester.domain.Tick;
import com.updownbacktest.backtester.domain.Timeframe;
import com.updownbacktest.backtester.domain.TradeSide;
import com.updownbacktest.backtester.engine.CandleBuilder;
import com.updownbacktest.backtester.engine.ConditionEvaluator;
import com.updownbacktest.backtester.engine.IndicatorSeries;
import com.updownbacktest.backtester.engine.MarketSelector;
import com.updownbacktest.backtester.engine.MarketSimulator;
import com.updownbacktest.backtester.engine.OrderLadderExecutor;
import com.updownbacktest.backtester.engine.OrderbookRuleEvaluator;
import com.updownbacktest.backtester.engine.PositionSettlement;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.web.client.ResourceAccessException;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Unit tests for BacktestServiceImpl market planning, aggregation and failure paths.
 */
@ExtendWith(MockitoExtension.class)
class BacktestServiceImplTest {

    private static final long QUARTER = 15 * 60_000L;
    private static final long SECOND = 1000L;

    @Mock
    private MarketDataService marketDataService;

    @Mock
    private IndicatorService indicatorService;

    @Mock
    private MarketMetadataResolver marketMetadataResolver;

    @Mock
    private AssetCandleFeed assetCandleFeed;

    @Mock
    private BacktestMetricsService metricsService;

    private BacktestProperties properties;
    private BacktestServiceImpl backtestService;

    @BeforeEach
    void setUp() {
        properties = new BacktestProperties();
        properties.getVerification().setEnabled(false);

        ConditionEvaluator conditionEvaluator = new ConditionEvaluator();
        MarketSimulator simulator = new MarketSimulator(conditionEvaluator, new OrderbookRuleEvaluator(),
                new OrderLadderExecutor(), new PositionSettlement());
        backtestService = new BacktestServiceImpl(
                marketDataService,
                indicatorService,
                new MarketVerificationService(marketMetadataResolver, properties),
                assetCandleFeed,
                new CandleBuilder(),
                new MarketSelector(conditionEvaluator),
                simulator,
                properties,
                metricsService,
                Clock.fixed(Instant.ofEpochMilli(1000 * QUARTER), ZoneOffset.UTC));
    }

    @Test
    void testRunBacktest_SingleMarketBinaryWin() {
        // Arrange
        when(marketDataService.loadMarketTicks("m1")).thenReturn(ticks(0, 50, 45, 35, 50, 60));
        BacktestOptions options = BacktestOptions.builder()
                .marketId("m1")
                .orderbookSettlement(SettlementMode.BINARY)
                .build();

        // Act
        BacktestReport report = backtestService.runBacktest(dipBuyer(), new BigDecimal("1000"), options);

        // Assert
        assertEquals(1, report.getMarketsProcessed());
        assertEquals(2, report.getTotalTrades());
        assertEquals(TradeSide.SELL, report.getTrades().get(1).getSide());
        assertEquals(0, new BigDecimal("60").compareTo(report.getTotalPnl()));
        assertEquals(0, new BigDecimal("1060").compareTo(report.getFinalBalance()));
        assertEquals(1, report.getWinningTrades());
        verify(metricsService).recordRunStarted();
        verify(metricsService).recordRunCompleted(eq(1), eq(0), anyLong());
    }

    @Test
    void testRunBacktest_SingleMarketDefaultsToMarkToMarket() {
        // Arrange
        when(marketDataService.loadMarketTicks("m1")).thenReturn(ticks(0, 50, 45, 35, 50, 60));

        // Act
        BacktestReport report = backtestService.runBacktest(dipBuyer(), null,
                BacktestOptions.builder().marketId("m1").build());

        // Assert
        assertEquals(0, new BigDecimal("1000").compareTo(report.getInitialBalance()));
        assertEquals(0, new BigDecimal("20").compareTo(report.getTotalPnl()));
    }

    @Test
    void testRunBacktest_SingleMarketTimeRangeExcludesTicks() {
        // Arrange
        when(marketDataService.loadMarketTicks("m1")).thenReturn(ticks(0, 50, 45, 35, 50, 60));
        BacktestOptions options = BacktestOptions.builder()
                .marketId("m1")
                .startTime(500 * QUARTER)
                .endTime(1000 * QUARTER)
                .build();

        // Act & Assert
        assertThrows(BacktestFailedException.class, () -> backtestService.runBacktest(dipBuyer(),
                new BigDecimal("1000"), options));
    }

    @Test
    void testRunBacktest_SingleMarketTimeRangeTrimsTicks() {
        // Arrange - the dip at 35c falls before the range
        when(marketDataService.loadMarketTicks("m1")).thenReturn(ticks(0, 50, 45, 35, 50, 60, 38, 65));
        BacktestOptions options = BacktestOptions.builder()
                .marketId("m1")
                .startTime(4 * SECOND)
                .endTime(7 * SECOND)
                .build();

        // Act
        BacktestReport report = backtestService.runBacktest(dipBuyer(), new BigDecimal("1000"), options);

        // Assert
        assertEquals(1, report.getMarketsProcessed());
        assertEquals(2, report.getTotalTrades());
        assertEquals(6 * SECOND, report.getTrades().get(0).getTimestamp());
        assertEquals(0, new BigDecimal("25").compareTo(report.getTotalPnl()));
    }

    @Test
    void testRunBacktest_Idempotent() {
        // Arrange
        when(marketDataService.loadMarketTicks("m1")).thenReturn(ticks(0, 50, 45, 35, 50, 60, 38, 65));
        BacktestOptions options = BacktestOptions.builder().marketId("m1").build();

        // Act
        BacktestReport first = backtestService.runBacktest(dipBuyer(), new BigDecimal("500"), options);
        BacktestReport second = backtestService.runBacktest(dipBuyer(), new BigDecimal("500"), options);

        // Assert
        assertEquals(first, second);
    }

    @Test
    void testRunBacktest_SignalMarketsFewerThanRequested() {
        // Arrange - crossovers at candles 10, 20 and 30; only two have a next market
        List<Candle> assetCandles = assetCandles(40);
        when(marketDataService.findCompletedMarkets(any())).thenReturn(List.of(
                window("m11", 11), window("m25", 25), window("m31", 31)));
        when(assetCandleFeed.getCandleHistory("BTC", Timeframe.FIFTEEN_MINUTES, 500)).thenReturn(assetCandles);
        when(indicatorService.calculateAll(eq("BTC"), eq(Timeframe.FIFTEEN_MINUTES), eq(assetCandles), any()))
                .thenReturn(Map.of("macd", macdSeries(40, 10, 20, 30)));
        when(marketDataService.loadMarketTicks("m11")).thenReturn(ticks(11 * QUARTER, 50, 55, 60));
        when(marketDataService.loadMarketTicks("m31")).thenReturn(ticks(31 * QUARTER, 50, 55, 60));

        // Act
        BacktestReport report = backtestService.runBacktest(macdStrategy(), new BigDecimal("1000"),
                BacktestOptions.builder().marketCount(3).build());

        // Assert
        assertEquals(2, report.getMarketsProcessed());
        assertEquals(0, report.getMarketsSkipped());
        assertEquals(3, report.getConditionsTriggered());
        assertEquals(List.of("m11", "m11", "m31", "m31"),
                report.getTrades().stream().map(t -> t.getMarketId()).collect(Collectors.toList()));
        assertEquals(0, new BigDecimal("10").compareTo(report.getTotalPnl()));
        verify(marketDataService, never()).loadMarketTicks("m25");
    }

    @Test
    void testRunBacktest_SignalModeNoMarkets() {
        // Arrange
        when(marketDataService.findCompletedMarkets(any())).thenReturn(List.of());

        // Act & Assert
        assertThrows(NoMarketsFoundException.class, () -> backtestService.runBacktest(macdStrategy(),
                new BigDecimal("1000"), BacktestOptions.builder().marketCount(3).build()));
        verify(metricsService).recordRunFailed();
        verifyNoInteractions(assetCandleFeed);
    }

    @Test
    void testRunBacktest_AssetFeedUnavailable() {
        // Arrange
        when(marketDataService.findCompletedMarkets(any())).thenReturn(List.of(window("m11", 11)));
        when(assetCandleFeed.getCandleHistory(any(), any(), anyInt()))
                .thenThrow(new ResourceAccessException("connect timed out"));

        // Act & Assert
        assertThrows(HistoricalDataUnavailableException.class, () -> backtestService.runBacktest(macdStrategy(),
                new BigDecimal("1000"), BacktestOptions.builder().build()));
    }

    @Test
    void testRunBacktest_HighVarianceMarketsInChronologicalOrder() {
        // Arrange
        when(marketDataService.findCompletedMarkets(any())).thenReturn(List.of(
                window("m1", 1), window("m2", 2), window("m3", 3)));
        when(marketDataService.loadMarketTicks("m1")).thenReturn(ticks(QUARTER, 50, 50, 50));
        when(marketDataService.loadMarketTicks("m2")).thenReturn(ticks(2 * QUARTER, 30, 70, 30, 70));
        when(marketDataService.loadMarketTicks("m3")).thenReturn(ticks(3 * QUARTER, 40, 60));
        BacktestStrategy strategy = dipBuyer();
        strategy.setOrderLadder(List.of(OrderLadderItem.builder().priceCents(40).shares(10).build()));

        // Act
        BacktestReport report = backtestService.runBacktest(strategy, new BigDecimal("100"),
                BacktestOptions.builder().marketCount(2).build());

        // Assert
        assertEquals(2, report.getMarketsProcessed());
        assertEquals(2, report.getTotalTrades());
        assertEquals("m2", report.getTrades().get(0).getMarketId());
        assertEquals(0, new BigDecimal("3").compareTo(report.getTotalPnl()));
        verify(marketDataService, times(1)).loadMarketTicks("m2");
    }

    @Test
    void testRunBacktest_ZeroMarketsProcessedFails() {
        // Arrange
        when(marketDataService.loadMarketTicks("m1")).thenReturn(List.of());

        // Act & Assert
        BacktestFailedException e = assertThrows(BacktestFailedException.class, () -> backtestService.runBacktest(
                dipBuyer(), new BigDecimal("1000"), BacktestOptions.builder().marketId("m1").build()));
        assertTrue(e.getMessage().contains("1 skipped"));
        verify(metricsService).recordRunFailed();
    }

    @Test
    void testRunBacktest_SingleMarketWarmupSkip() {
        // Arrange - a handful of 15m candles cannot warm up MACD
        when(marketDataService.loadMarketTicks("m1")).thenReturn(ticks(0, 50, 55, 60));

        // Act & Assert
        assertThrows(BacktestFailedException.class, () -> backtestService.runBacktest(macdStrategy(),
                new BigDecimal("1000"), BacktestOptions.builder().marketId("m1").build()));
        verifyNoInteractions(indicatorService);
    }

    @Test
    void testRunBacktest_EmptyLadderRejected() {
        // Arrange
        BacktestStrategy strategy = dipBuyer();
        strategy.setOrderLadder(new ArrayList<>());

        // Act & Assert
        assertThrows(IllegalArgumentException.class, () -> backtestService.runBacktest(strategy,
                new BigDecimal("1000"), BacktestOptions.builder().marketId("m1").build()));
        verifyNoInteractions(marketDataService);
    }

    @Test
    void testQuickCheck_Profitable() {
        // Arrange
        when(marketDataService.loadMarketTicks("m1")).thenReturn(ticks(999 * QUARTER, 50, 45, 35, 50, 60));

        // Act
        QuickCheckResponse response = backtestService.quickCheck(dipBuyer(), "m1", 7);

        // Assert
        assertTrue(response.isProfitable());
        assertEquals(0, new BigDecimal("2").compareTo(response.getPnlPercent()));
        assertEquals(0, new BigDecimal("100").compareTo(response.getWinRate()));
    }

    @Test
    void testQuickCheck_LookbackExcludesOlderTicks() {
        // Arrange - every tick is about ten days older than the clock
        when(marketDataService.loadMarketTicks("m1")).thenReturn(ticks(0, 50, 45, 35, 50, 60));

        // Act
        QuickCheckResponse response = backtestService.quickCheck(dipBuyer(), "m1", 1);

        // Assert
        assertFalse(response.isProfitable());
        assertEquals(0, BigDecimal.ZERO.compareTo(response.getPnlPercent()));
    }

    @Test
    void testQuickCheck_FailureReportedAsUnprofitable() {
        // Arrange
        when(marketDataService.loadMarketTicks("m1")).thenReturn(List.of());

        // Act
        QuickCheckResponse response = backtestService.quickCheck(dipBuyer(), "m1", 7);

        // Assert
        assertFalse(response.isProfitable());
        assertEquals(0, BigDecimal.ZERO.compareTo(response.getPnlPercent()));
    }

    private BacktestStrategy dipBuyer() {
        return BacktestStrategy.builder()
                .id("dip")
                .name("Dip buyer")
                .asset("BTC")
                .orderbookRules(List.of(OrderbookRule.builder()
                        .field(OrderbookField.YES_BID)
                        .operator(OrderbookOperator.LESS_THAN)
                        .value(40)
                        .build()))
                .orderLadder(List.of(OrderLadderItem.builder().priceCents(40).shares(100).build()))
                .build();
    }

    private BacktestStrategy macdStrategy() {
        return BacktestStrategy.builder()
                .id("macd")
                .name("MACD cross")
                .asset("BTC")
                .indicators(List.of(Indicator.builder()
                        .id("macd")
                        .type(IndicatorType.MACD)
                        .timeframe(Timeframe.FIFTEEN_MINUTES)
                        .build()))
                .conditions(List.of(Condition.builder()
                        .sourceA(Operand.indicator("macd", "macd"))
                        .operator(ConditionOperator.CROSSES_ABOVE)
                        .sourceB(Operand.indicator("macd", "signal"))
                        .build()))
                .orderLadder(List.of(OrderLadderItem.builder().priceCents(50).shares(10).build()))
                .build();
    }

    private List<Candle> assetCandles(int count) {
        List<Candle> candles = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            candles.add(Candle.builder()
                    .timestamp(i * QUARTER)
                    .open(100).high(101).low(99).close(100)
                    .volume(10)
                    .closed(true)
                    .build());
        }
        return candles;
    }

    private IndicatorSeries macdSeries(int count, int... crossIndices) {
        List<IndicatorResult> results = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            boolean above = false;
            for (int cross : crossIndices) {
                above |= cross == i;
            }
            results.add(IndicatorResult.builder()
                    .timestamp(i * QUARTER)
                    .field("macd", above ? 1.0 : -1.0)
                    .field("signal", 0.0)
                    .build());
        }
        return new IndicatorSeries(results, 1000, 300_000);
    }

    private MarketWindow window(String id, int startQuarter) {
        return MarketWindow.builder()
                .marketId(id)
                .eventStartMs(startQuarter * QUARTER)
                .eventEndMs((startQuarter + 1) * QUARTER)
                .tickCount(10)
                .build();
    }

    private List<Tick> ticks(long startMs, int... yesBids) {
        List<Tick> ticks = new ArrayList<>();
        for (int i = 0; i < yesBids.length; i++) {
            ticks.add(Tick.builder()
                    .timestamp(startMs + (i + 1) * SECOND)
                    .yesBid(yesBids[i])
                    .yesAsk(yesBids[i] + 1)
                    .noBid(99 - yesBids[i])
                    .noAsk(100 - yesBids[i])
                    .build());
        }
        return ticks;
    }
}
