package com.updownbacktest.backtester.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One logical test of a strategy's trigger rule, already normalized.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Condition {

    private String id;
    private Operand sourceA;
    private ConditionOperator operator;
    private Operand sourceB;
    private Double value;
    private Double value2;

    @Builder.Default
    private CandleOffset candle = CandleOffset.CURRENT;

    public String describe() {
        String right = sourceB == null || sourceB.getKind() == Operand.Kind.VALUE
                ? String.valueOf(value)
                : sourceB.toString();
        if (operator == ConditionOperator.BETWEEN) {
            return sourceA + " between " + right + " and " + value2;
        }
        return sourceA + " " + operator.getSymbol() + " " + right;
    }
}
