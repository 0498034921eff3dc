package com.updownbacktest.backtester.service;

import com.updownbacktest.backtester.controller.dto.BacktestRequest;
import com.updownbacktest.backtester.controller.dto.StrategyRequest;
import com.updownbacktest.backtester.domain.BacktestOptions;
import com.updownbacktest.backtester.domain.BacktestStrategy;
import com.updownbacktest.backtester.domain.CandleOffset;
import com.updownbacktest.backtester.domain.Condition;
import com.updownbacktest.backtester.domain.ConditionLogic;
import com.updownbacktest.backtester.domain.ConditionOperator;
import com.updownbacktest.backtester.domain.Indicator;
import com.updownbacktest.backtester.domain.IndicatorType;
import com.updownbacktest.backtester.domain.Operand;
import com.updownbacktest.backtester.domain.OrderLadderItem;
import com.updownbacktest.backtester.domain.OrderbookField;
import com.updownbacktest.backtester.domain.OrderbookOperator;
import com.updownbacktest.backtester.domain.OrderbookRule;
import com.updownbacktest.backtester.domain.SettlementMode;
import com.updownbacktest.backtester.domain.Timeframe;
import com.updownbacktest.backtester.domain.TradeDirection;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Normalizes API strategies into engine types. Unknown operator, field or
 * indicator names are rejected with {@link IllegalArgumentException}.
 */
@Component
public class StrategyMapper {

    public BacktestStrategy toDomain(StrategyRequest request) {
        Timeframe timeframe = Timeframe.fromLabel(request.getTimeframe());

        List<Indicator> indicators = new ArrayList<>();
        Set<String> indicatorIds = new LinkedHashSet<>();
        for (StrategyRequest.IndicatorRequest source : nullSafe(request.getIndicators())) {
            if (!indicatorIds.add(source.getId())) {
                throw new IllegalArgumentException("Duplicate indicator id: " + source.getId());
            }
            indicators.add(Indicator.builder()
                    .id(source.getId())
                    .type(IndicatorType.fromString(source.getType()))
                    .timeframe(source.getTimeframe() != null ? Timeframe.fromLabel(source.getTimeframe()) : timeframe)
                    .parameters(source.getParameters() != null ? new HashMap<>(source.getParameters()) : new HashMap<>())
                    .useInConditions(source.getUseInConditions() == null || source.getUseInConditions())
                    .build());
        }

        List<Condition> conditions = new ArrayList<>();
        int conditionIndex = 0;
        for (StrategyRequest.ConditionRequest source : nullSafe(request.getConditions())) {
            conditionIndex++;
            conditions.add(Condition.builder()
                    .id(source.getId() != null ? source.getId() : "condition_" + conditionIndex)
                    .sourceA(Operand.parse(source.getSourceA(), indicatorIds))
                    .operator(ConditionOperator.fromString(source.getOperator()))
                    .sourceB(source.getSourceB() == null || source.getSourceB().isBlank()
                            ? Operand.value()
                            : Operand.parse(source.getSourceB(), indicatorIds))
                    .value(source.getValue())
                    .value2(source.getValue2())
                    .candle(CandleOffset.fromString(source.getCandle()))
                    .build());
        }

        List<OrderbookRule> rules = new ArrayList<>();
        for (StrategyRequest.OrderbookRuleRequest source : nullSafe(request.getOrderbookRules())) {
            rules.add(OrderbookRule.builder()
                    .id(source.getId())
                    .field(OrderbookField.fromString(source.getField()))
                    .operator(OrderbookOperator.fromString(source.getOperator()))
                    .value(source.getValue())
                    .value2(source.getValue2())
                    .build());
        }

        List<OrderLadderItem> ladder = new ArrayList<>();
        for (StrategyRequest.OrderLadderItemRequest source : nullSafe(request.getOrderLadder())) {
            ladder.add(new OrderLadderItem(source.getPrice(), source.getShares()));
        }

        return BacktestStrategy.builder()
                .id(request.getId())
                .name(request.getName())
                .asset(request.getAsset() != null ? request.getAsset().trim().toUpperCase(Locale.ROOT) : null)
                .direction(TradeDirection.fromString(request.getDirection()))
                .timeframe(timeframe)
                .indicators(indicators)
                .conditions(conditions)
                .conditionLogic(ConditionLogic.fromString(request.getConditionLogic()))
                .orderbookRules(rules)
                .orderLadder(ladder)
                .marketId(request.getMarket())
                .build();
    }

    public BacktestOptions toOptions(BacktestRequest request) {
        return BacktestOptions.builder()
                .marketId(request.getMarketId())
                .marketCount(request.getNumberOfMarkets())
                .exitPriceCents(request.getExitPrice())
                .startTime(request.getStartTime())
                .endTime(request.getEndTime())
                .orderbookSettlement(settlementMode(request.getSettlementMode()))
                .build();
    }

    SettlementMode settlementMode(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        String normalized = raw.trim().toUpperCase(Locale.ROOT).replaceAll("[\\s-]+", "_");
        try {
            return SettlementMode.valueOf(normalized);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown settlement mode: " + raw, e);
        }
    }

    private static <T> List<T> nullSafe(List<T> list) {
        return list != null ? list : new ArrayList<>();
    }
}
