package com.updownbacktest.backtester.engine;

import com.updownbacktest.backtester.domain.ConditionLogic;
import com.updownbacktest.backtester.domain.OrderbookRule;
import com.updownbacktest.backtester.domain.Tick;
import com.updownbacktest.backtester.domain.TradeDirection;

import java.util.List;

/**
 * Compares tick prices in cents against orderbook rule thresholds.
 */
public class OrderbookRuleEvaluator {

    static final double EQUALS_TOLERANCE_CENTS = 0.5;

    public boolean evaluate(List<OrderbookRule> rules, ConditionLogic logic, Tick tick, TradeDirection direction) {
        if (rules == null || rules.isEmpty()) {
            return false;
        }
        if (logic == ConditionLogic.ANY) {
            return rules.stream().anyMatch(rule -> matches(rule, tick, direction));
        }
        return rules.stream().allMatch(rule -> matches(rule, tick, direction));
    }

    public boolean matches(OrderbookRule rule, Tick tick, TradeDirection direction) {
        int cents = tick.fieldValue(rule.getField(), direction);
        return switch (rule.getOperator()) {
            case GREATER_THAN -> cents > rule.getValue();
            case LESS_THAN -> cents < rule.getValue();
            case EQUALS -> Math.abs(cents - rule.getValue()) <= EQUALS_TOLERANCE_CENTS;
            case BETWEEN -> rule.getValue2() != null
                    && cents >= Math.min(rule.getValue(), rule.getValue2())
                    && cents <= Math.max(rule.getValue(), rule.getValue2());
        };
    }
}
