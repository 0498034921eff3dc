package com.updownbacktest.backtester.engine;

import com.updownbacktest.backtester.domain.Candle;
import com.updownbacktest.backtester.domain.CandleOffset;
import com.updownbacktest.backtester.domain.Condition;
import com.updownbacktest.backtester.domain.ConditionLogic;
import com.updownbacktest.backtester.domain.ConditionOperator;
import com.updownbacktest.backtester.domain.IndicatorResult;
import com.updownbacktest.backtester.domain.Operand;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Evaluates strategy conditions at a candle close. Any operand that cannot be
 * resolved makes its condition false.
 */
public class ConditionEvaluator {

    static final double EQUALS_TOLERANCE = 1e-4;

    /**
     * Evaluate all conditions at {@code index}.
     *
     * @param series indicator series keyed by indicator id
     */
    public Outcome evaluate(List<Condition> conditions, ConditionLogic logic, List<Candle> candles,
                            int index, Map<String, IndicatorSeries> series) {
        if (conditions == null || conditions.isEmpty() || index < 0 || index >= candles.size()) {
            return Outcome.NOT_TRIGGERED;
        }

        List<String> reasons = new ArrayList<>();
        boolean any = false;
        boolean all = true;

        for (Condition condition : conditions) {
            boolean met = evaluate(condition, candles, index, series);
            if (met) {
                any = true;
                reasons.add(condition.describe());
            } else {
                all = false;
            }
        }

        boolean triggered = logic == ConditionLogic.ANY ? any : all;
        return triggered ? new Outcome(true, reasons) : Outcome.NOT_TRIGGERED;
    }

    public boolean evaluate(Condition condition, List<Candle> candles, int index,
                            Map<String, IndicatorSeries> series) {
        int at = condition.getCandle() == CandleOffset.PREVIOUS ? index - 1 : index;
        if (at < 0) {
            return false;
        }

        Double a = resolve(condition.getSourceA(), condition, candles, at, series);
        Double b = resolve(condition.getSourceB(), condition, candles, at, series);
        if (a == null || b == null) {
            return false;
        }

        ConditionOperator operator = condition.getOperator();
        if (operator.isCrossover()) {
            if (at < 1) {
                return false;
            }
            Double prevA = resolve(condition.getSourceA(), condition, candles, at - 1, series);
            Double prevB = resolve(condition.getSourceB(), condition, candles, at - 1, series);
            if (prevA == null || prevB == null) {
                return false;
            }
            if (operator == ConditionOperator.CROSSES_ABOVE) {
                return prevA <= prevB && a > b;
            }
            return prevA >= prevB && a < b;
        }

        return switch (operator) {
            case GREATER_THAN -> a > b;
            case LESS_THAN -> a < b;
            case GREATER_EQUAL -> a >= b;
            case LESS_EQUAL -> a <= b;
            case EQUALS -> Math.abs(a - b) < EQUALS_TOLERANCE;
            case BETWEEN -> between(a, b, condition.getValue2());
            default -> false;
        };
    }

    private boolean between(double a, double lower, Double upper) {
        if (upper == null) {
            return false;
        }
        return a >= Math.min(lower, upper) && a <= Math.max(lower, upper);
    }

    private Double resolve(Operand operand, Condition condition, List<Candle> candles, int index,
                           Map<String, IndicatorSeries> series) {
        if (operand == null) {
            return condition.getValue();
        }
        switch (operand.getKind()) {
            case PRICE:
                return candles.get(index).getClose();
            case VALUE:
                return condition.getValue();
            default:
                IndicatorSeries indicator = series.get(operand.getIndicatorId());
                if (indicator == null) {
                    return null;
                }
                IndicatorResult result = indicator.lookup(candles.get(index).getTimestamp(), index);
                return result == null ? null : result.resolve(operand.getField()).orElse(null);
        }
    }

    /**
     * Result of evaluating a strategy's conditions at one candle.
     */
    @Getter
    @RequiredArgsConstructor
    public static class Outcome {

        static final Outcome NOT_TRIGGERED = new Outcome(false, Collections.emptyList());

        private final boolean triggered;
        private final List<String> reasons;

        public String describe() {
            return String.join(" AND ", reasons);
        }
    }
}
