package com.updownbacktest.backtester.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One completed prediction-market event window.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class MarketWindow {

    private String marketId;
    private long eventStartMs;
    private long eventEndMs;
    private int tickCount;

    public long getDurationMs() {
        return eventEndMs - eventStartMs;
    }
}
