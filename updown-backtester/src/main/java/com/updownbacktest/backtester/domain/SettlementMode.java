package com.updownbacktest.backtester.domain;

/**
 * How an open orderbook position without an exit price settles at market end.
 */
public enum SettlementMode {
    /** Sell at the last observed price. */
    MARK_TO_MARKET,
    /** $1 per share if the final price is above entry, else $0. */
    BINARY
}
