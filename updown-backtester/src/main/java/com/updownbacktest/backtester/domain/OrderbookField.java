package com.updownbacktest.backtester.domain;

/**
 * Tick field an orderbook rule reads. MARKET_PRICE is the direction price.
 */
public enum OrderbookField {
    YES_BID,
    YES_ASK,
    NO_BID,
    NO_ASK,
    MARKET_PRICE;

    public static OrderbookField fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Orderbook rule field is required");
        }
        String normalized = raw.trim().toLowerCase().replaceAll("[\\s-]+", "_");
        return switch (normalized) {
            case "yes_bid", "yesbid", "best_bid_yes" -> YES_BID;
            case "yes_ask", "yesask", "best_ask_yes" -> YES_ASK;
            case "no_bid", "nobid", "best_bid_no" -> NO_BID;
            case "no_ask", "noask", "best_ask_no" -> NO_ASK;
            case "market_price", "marketprice", "price" -> MARKET_PRICE;
            default -> throw new IllegalArgumentException("Unknown orderbook field: " + raw);
        };
    }
}
