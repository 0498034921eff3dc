package com.updownbacktest.backtester.service;

import com.updownbacktest.backtester.controller.dto.BacktestRequest;
import com.updownbacktest.backtester.controller.dto.StrategyRequest;
import com.updownbacktest.backtester.domain.BacktestOptions;
import com.updownbacktest.backtester.domain.BacktestStrategy;
import com.updownbacktest.backtester.domain.CandleOffset;
import com.updownbacktest.backtester.domain.Condition;
import com.updownbacktest.backtester.domain.ConditionLogic;
import com.updownbacktest.backtester.domain.ConditionOperator;
import com.updownbacktest.backtester.domain.IndicatorType;
import com.updownbacktest.backtester.domain.Operand;
import com.updownbacktest.backtester.domain.OrderbookField;
import com.updownbacktest.backtester.domain.OrderbookOperator;
import com.updownbacktest.backtester.domain.SettlementMode;
import com.updownbacktest.backtester.domain.Timeframe;
import com.updownbacktest.backtester.domain.TradeDirection;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for StrategyMapper normalization.
 */
class StrategyMapperTest {

    private final StrategyMapper mapper = new StrategyMapper();

    @Test
    void testToDomain_IndicatorStrategy() {
        // Arrange
        StrategyRequest request = StrategyRequest.builder()
                .name("MACD cross")
                .asset(" eth ")
                .direction("down")
                .timeframe("hourly")
                .conditionLogic("any")
                .indicators(List.of(StrategyRequest.IndicatorRequest.builder()
                        .id("macd_1")
                        .type("macd")
                        .parameters(Map.of("fast", 8.0))
                        .build()))
                .conditions(List.of(
                        StrategyRequest.ConditionRequest.builder()
                                .sourceA("indicator_macd_1.macd")
                                .operator("Crosses Above")
                                .sourceB("macd_1.signal")
                                .build(),
                        StrategyRequest.ConditionRequest.builder()
                                .id("price_check")
                                .sourceA("close")
                                .operator("<=")
                                .value(0.6)
                                .candle("previous")
                                .build()))
                .orderLadder(List.of(new StrategyRequest.OrderLadderItemRequest(45, 10)))
                .build();

        // Act
        BacktestStrategy strategy = mapper.toDomain(request);

        // Assert
        assertEquals("ETH", strategy.getAsset());
        assertEquals(TradeDirection.DOWN, strategy.getDirection());
        assertEquals(Timeframe.ONE_HOUR, strategy.getTimeframe());
        assertEquals(ConditionLogic.ANY, strategy.getConditionLogic());
        assertEquals(IndicatorType.MACD, strategy.getIndicators().get(0).getType());
        assertEquals(Timeframe.ONE_HOUR, strategy.getIndicators().get(0).getTimeframe());
        assertTrue(strategy.getIndicators().get(0).isUseInConditions());
        assertTrue(strategy.isIndicatorTriggered());

        Condition cross = strategy.getConditions().get(0);
        assertEquals("condition_1", cross.getId());
        assertEquals(ConditionOperator.CROSSES_ABOVE, cross.getOperator());
        assertEquals(Operand.indicator("macd_1", "macd"), cross.getSourceA());
        assertEquals(Operand.indicator("macd_1", "signal"), cross.getSourceB());

        Condition priceCheck = strategy.getConditions().get(1);
        assertEquals("price_check", priceCheck.getId());
        assertEquals(Operand.price(), priceCheck.getSourceA());
        assertEquals(Operand.value(), priceCheck.getSourceB());
        assertEquals(CandleOffset.PREVIOUS, priceCheck.getCandle());

        assertEquals(45, strategy.getOrderLadder().get(0).getPriceCents());
        assertEquals(35, strategy.requiredWarmupCandles(), "MACD needs slow + signal candles");
    }

    @Test
    void testToDomain_OrderbookStrategy() {
        // Arrange
        StrategyRequest request = StrategyRequest.builder()
                .name("Dip buyer")
                .orderbookRules(List.of(StrategyRequest.OrderbookRuleRequest.builder()
                        .field("yes bid")
                        .operator("below")
                        .value(40.0)
                        .build()))
                .orderLadder(List.of(new StrategyRequest.OrderLadderItemRequest(40, 100)))
                .market("512")
                .build();

        // Act
        BacktestStrategy strategy = mapper.toDomain(request);

        // Assert
        assertFalse(strategy.isIndicatorTriggered());
        assertEquals(OrderbookField.YES_BID, strategy.getOrderbookRules().get(0).getField());
        assertEquals(OrderbookOperator.LESS_THAN, strategy.getOrderbookRules().get(0).getOperator());
        assertEquals(TradeDirection.UP, strategy.getDirection());
        assertEquals(Timeframe.FIFTEEN_MINUTES, strategy.getTimeframe());
        assertEquals("512", strategy.getMarketId());
    }

    @Test
    void testToDomain_UnknownOperatorRejected() {
        // Arrange
        StrategyRequest request = StrategyRequest.builder()
                .name("Bad")
                .conditions(List.of(StrategyRequest.ConditionRequest.builder()
                        .sourceA("price")
                        .operator("approximately")
                        .value(0.5)
                        .build()))
                .build();

        // Act & Assert
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> mapper.toDomain(request));
        assertTrue(e.getMessage().contains("approximately"));
    }

    @Test
    void testToDomain_UnknownIndicatorReferenceRejected() {
        // Arrange
        StrategyRequest request = StrategyRequest.builder()
                .name("Bad")
                .conditions(List.of(StrategyRequest.ConditionRequest.builder()
                        .sourceA("rsi_missing")
                        .operator(">")
                        .value(70.0)
                        .build()))
                .build();

        // Act & Assert
        assertThrows(IllegalArgumentException.class, () -> mapper.toDomain(request));
    }

    @Test
    void testToDomain_DuplicateIndicatorIdsRejected() {
        // Arrange
        StrategyRequest.IndicatorRequest rsi = StrategyRequest.IndicatorRequest.builder()
                .id("rsi")
                .type("rsi")
                .build();
        StrategyRequest request = StrategyRequest.builder()
                .name("Bad")
                .indicators(List.of(rsi, rsi))
                .build();

        // Act & Assert
        assertThrows(IllegalArgumentException.class, () -> mapper.toDomain(request));
    }

    @Test
    void testToOptions() {
        // Arrange
        BacktestRequest request = BacktestRequest.builder()
                .numberOfMarkets(3)
                .exitPrice(70)
                .startTime(1000L)
                .settlementMode("binary")
                .build();

        // Act
        BacktestOptions options = mapper.toOptions(request);

        // Assert
        assertEquals(3, options.getMarketCount());
        assertEquals(70, options.getExitPriceCents());
        assertEquals(1000L, options.getStartTime());
        assertNull(options.getEndTime());
        assertEquals(SettlementMode.BINARY, options.getOrderbookSettlement());
    }

    @Test
    void testSettlementMode() {
        assertNull(mapper.settlementMode(" "));
        assertEquals(SettlementMode.MARK_TO_MARKET, mapper.settlementMode("mark-to-market"));
        assertThrows(IllegalArgumentException.class, () -> mapper.settlementMode("coin flip"));
    }
}
