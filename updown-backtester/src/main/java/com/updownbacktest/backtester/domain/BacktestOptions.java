package com.updownbacktest.backtester.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Per-run options. Null fields fall back to configured defaults.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BacktestOptions {

    private String marketId;
    private Integer marketCount;
    private Integer exitPriceCents;
    private Long startTime;
    private Long endTime;
    private SettlementMode orderbookSettlement;

    public boolean hasExitPrice() {
        return exitPriceCents != null && exitPriceCents > 0;
    }
}
