package com.updownbacktest.backtester.client;

import com.updownbacktest.backtester.domain.Timeframe;

import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Slug formats of the up/down markets. 15-minute markets embed the start epoch
 * second, hourly markets a New York wall-clock label.
 */
public final class MarketSlugs {

    private static final ZoneId NEW_YORK = ZoneId.of("America/New_York");
    private static final DateTimeFormatter HOURLY_LABEL = DateTimeFormatter.ofPattern("MMMM-d-ha", Locale.US);

    private static final Map<String, String> PAIR_SLUGS = Map.of(
            "BTC", "btc",
            "ETH", "eth",
            "SOL", "sol",
            "XRP", "xrp");

    private static final Map<String, String> PAIR_FULL_NAMES = Map.of(
            "BTC", "bitcoin",
            "ETH", "ethereum",
            "SOL", "solana",
            "XRP", "xrp");

    private MarketSlugs() {
    }

    /**
     * @return the slug, or empty for assets or timeframes without a known format
     */
    public static Optional<String> forMarket(String asset, Timeframe timeframe, long eventStartMs) {
        if (asset == null) {
            return Optional.empty();
        }
        String key = asset.trim().toUpperCase(Locale.ROOT);
        if (timeframe == Timeframe.FIFTEEN_MINUTES && PAIR_SLUGS.containsKey(key)) {
            return Optional.of(PAIR_SLUGS.get(key) + "-updown-15m-" + eventStartMs / 1000);
        }
        if (timeframe == Timeframe.ONE_HOUR && PAIR_FULL_NAMES.containsKey(key)) {
            String label = HOURLY_LABEL.format(Instant.ofEpochMilli(eventStartMs).atZone(NEW_YORK))
                    .toLowerCase(Locale.ROOT);
            return Optional.of(PAIR_FULL_NAMES.get(key) + "-up-or-down-" + label + "-et");
        }
        return Optional.empty();
    }
}
