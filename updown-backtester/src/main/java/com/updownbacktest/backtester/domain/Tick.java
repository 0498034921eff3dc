package com.updownbacktest.backtester.domain;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * One observed price sample for a market. All prices are integer cents (0-100).
 */
@Value
@Builder
@Jacksonized
public class Tick {

    long timestamp;
    int yesBid;
    int yesAsk;
    int noBid;
    int noAsk;

    /**
     * Price the strategy trades on: yes-bid for UP, no-bid for DOWN.
     */
    public int priceFor(TradeDirection direction) {
        return direction == TradeDirection.DOWN ? noBid : yesBid;
    }

    public int fieldValue(OrderbookField field, TradeDirection direction) {
        return switch (field) {
            case YES_BID -> yesBid;
            case YES_ASK -> yesAsk;
            case NO_BID -> noBid;
            case NO_ASK -> noAsk;
            case MARKET_PRICE -> priceFor(direction);
        };
    }
}
