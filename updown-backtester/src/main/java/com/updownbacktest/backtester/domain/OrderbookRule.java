package com.updownbacktest.backtester.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Raw-price threshold trigger. Thresholds are in cents.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class OrderbookRule {

    private String id;
    private OrderbookField field;
    private OrderbookOperator operator;
    private double value;
    private Double value2;

    public String describe() {
        String threshold = operator == OrderbookOperator.BETWEEN
                ? value + "-" + value2
                : String.valueOf(value);
        return field.name().toLowerCase() + " " + operator.name().toLowerCase() + " " + threshold;
    }
}
