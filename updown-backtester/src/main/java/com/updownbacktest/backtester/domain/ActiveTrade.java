package com.updownbacktest.backtester.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * The open position in one market. At most one exists per market.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ActiveTrade {

    private String marketId;
    private long entryTimestamp;
    private int entryPriceCents;
    private int shares;
    private BigDecimal cost;
    private int maxPriceCents;

    public void observe(int priceCents) {
        if (priceCents > maxPriceCents) {
            maxPriceCents = priceCents;
        }
    }

    public BigDecimal valueAt(int priceCents) {
        return Prices.toDecimal(priceCents).multiply(BigDecimal.valueOf(shares));
    }
}
