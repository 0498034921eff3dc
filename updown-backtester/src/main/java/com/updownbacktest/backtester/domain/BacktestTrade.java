package com.updownbacktest.backtester.domain;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;

/**
 * One ledger event. {@code pnl} is null on BUY rows.
 */
@Value
@Builder
@Jacksonized
public class BacktestTrade {

    String marketId;
    long timestamp;
    TradeSide side;
    BigDecimal price;
    int shares;
    BigDecimal value;
    BigDecimal pnl;
    BigDecimal balance;
    String triggerReason;
}
