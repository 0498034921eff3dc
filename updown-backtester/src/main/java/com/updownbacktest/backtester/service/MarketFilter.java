package com.updownbacktest.backtester.service;

import com.updownbacktest.backtester.domain.Timeframe;
import lombok.Builder;
import lombok.Value;

/**
 * Selects completed markets. Null bounds are open.
 */
@Value
@Builder
public class MarketFilter {
    Timeframe timeframe;
    Long startTime;
    Long endTime;
    int limit;
}
