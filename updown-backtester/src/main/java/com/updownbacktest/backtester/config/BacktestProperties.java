package com.updownbacktest.backtester.config;

import com.updownbacktest.backtester.domain.SettlementMode;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.math.BigDecimal;

/**
 * Backtest engine settings, bound from {@code backtest.*}.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "backtest")
public class BacktestProperties {

    private BigDecimal defaultInitialBalance = new BigDecimal("1000");
    private int defaultMarketCount = 5;
    private int maxMarketCount = 50;

    /** Candles requested from the continuous asset feed. */
    private int assetCandleCount = 500;

    /** A signal matches a market starting within this many candle durations after it. */
    private int executionLagCandles = 1;

    /** Completed markets scanned when ranking orderbook-only candidates by variance. */
    private int varianceCandidatePool = 40;

    /** Returned as profit factor when there are profits and no losses. */
    private BigDecimal profitFactorCap = new BigDecimal("999");

    private Verification verification = new Verification();
    private Settlement settlement = new Settlement();
    private Lookup lookup = new Lookup();
    private Clients clients = new Clients();

    @Data
    public static class Verification {
        private boolean enabled = true;
        private long delayMs = 100;
        private int maxConsecutiveFailures = 3;
    }

    @Data
    public static class Settlement {
        private SettlementMode orderbookWithoutExit = SettlementMode.MARK_TO_MARKET;
    }

    @Data
    public static class Lookup {
        private long exactToleranceMs = 1000;
        private long nearestWindowMs = 300_000;
    }

    @Data
    public static class Clients {
        private String gammaBaseUrl = "https://gamma-api.polymarket.com";
        private String binanceBaseUrl = "https://api.binance.com";
        private long connectTimeoutMs = 3000;
        private long readTimeoutMs = 10000;
    }
}
