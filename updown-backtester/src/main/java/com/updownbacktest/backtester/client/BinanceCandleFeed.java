package com.updownbacktest.backtester.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.updownbacktest.backtester.domain.Candle;
import com.updownbacktest.backtester.domain.Timeframe;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Asset candles from the Binance klines endpoint.
 */
@Component
@Slf4j
public class BinanceCandleFeed implements AssetCandleFeed {

    private static final int MAX_LIMIT = 1000;

    private static final Map<String, String> SYMBOLS = Map.of(
            "BTC", "BTCUSDT",
            "ETH", "ETHUSDT",
            "SOL", "SOLUSDT",
            "XRP", "XRPUSDT");

    private final RestTemplate restTemplate;
    private final Clock clock;

    public BinanceCandleFeed(@Qualifier("binanceRestTemplate") RestTemplate restTemplate, Clock clock) {
        this.restTemplate = restTemplate;
        this.clock = clock;
    }

    @Override
    public List<Candle> getCandleHistory(String asset, Timeframe timeframe, int count) {
        String symbol = symbolFor(asset);
        int limit = Math.min(Math.max(count, 1), MAX_LIMIT);
        JsonNode rows = restTemplate.getForObject("/api/v3/klines?symbol={symbol}&interval={interval}&limit={limit}",
                JsonNode.class, symbol, timeframe.getLabel(), limit);

        List<Candle> candles = new ArrayList<>();
        if (rows == null || !rows.isArray()) {
            return candles;
        }

        long now = clock.millis();
        for (JsonNode row : rows) {
            long closeTime = row.get(6).asLong();
            // the newest kline is still forming
            if (closeTime >= now) {
                continue;
            }
            candles.add(Candle.builder()
                    .timestamp(row.get(0).asLong())
                    .open(row.get(1).asDouble())
                    .high(row.get(2).asDouble())
                    .low(row.get(3).asDouble())
                    .close(row.get(4).asDouble())
                    .volume(Math.round(row.get(5).asDouble()))
                    .closed(true)
                    .build());
        }
        log.info("Loaded {} closed {} candles for {}", candles.size(), timeframe.getLabel(), symbol);
        return candles;
    }

    static String symbolFor(String asset) {
        String key = asset == null ? "" : asset.trim().toUpperCase(Locale.ROOT);
        String symbol = SYMBOLS.get(key);
        if (symbol == null) {
            log.warn("No feed symbol for asset '{}', using BTCUSDT", asset);
            return "BTCUSDT";
        }
        return symbol;
    }
}
