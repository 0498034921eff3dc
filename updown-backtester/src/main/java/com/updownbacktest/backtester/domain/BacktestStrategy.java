package com.updownbacktest.backtester.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * A normalized strategy as the engine sees it. Enum-typed throughout; string
 * parsing happens once in {@code StrategyMapper}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BacktestStrategy {

    private String id;
    private String name;
    private String asset;

    @Builder.Default
    private TradeDirection direction = TradeDirection.UP;

    @Builder.Default
    private Timeframe timeframe = Timeframe.FIFTEEN_MINUTES;

    @Builder.Default
    private List<Indicator> indicators = new ArrayList<>();

    @Builder.Default
    private List<Condition> conditions = new ArrayList<>();

    @Builder.Default
    private ConditionLogic conditionLogic = ConditionLogic.ALL;

    @Builder.Default
    private List<OrderbookRule> orderbookRules = new ArrayList<>();

    @Builder.Default
    private List<OrderLadderItem> orderLadder = new ArrayList<>();

    /**
     * Market this strategy is pinned to, if any.
     */
    private String marketId;

    /**
     * Indicator-triggered strategies enter on condition signals and settle binary.
     */
    public boolean isIndicatorTriggered() {
        return conditions != null && !conditions.isEmpty();
    }

    public boolean hasOrderbookRules() {
        return orderbookRules != null && !orderbookRules.isEmpty();
    }

    public List<Indicator> conditionIndicators() {
        List<Indicator> used = new ArrayList<>();
        for (Indicator indicator : indicators) {
            if (indicator.isUseInConditions()) {
                used.add(indicator);
            }
        }
        return used;
    }

    /**
     * Candles needed before every indicator referenced by a condition is defined.
     */
    public int requiredWarmupCandles() {
        int required = 0;
        for (Indicator indicator : conditionIndicators()) {
            required = Math.max(required, indicator.requiredCandles());
        }
        return required;
    }
}
