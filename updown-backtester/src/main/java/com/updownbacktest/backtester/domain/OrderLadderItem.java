package com.updownbacktest.backtester.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * One simulated limit order: a price in cents and a share count.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class OrderLadderItem {

    private int priceCents;
    private int shares;

    public BigDecimal getPrice() {
        return Prices.toDecimal(priceCents);
    }

    public BigDecimal getCost() {
        return getPrice().multiply(BigDecimal.valueOf(shares));
    }
}
