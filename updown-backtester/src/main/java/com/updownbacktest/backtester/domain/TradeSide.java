package com.updownbacktest.backtester.domain;

public enum TradeSide {
    BUY,
    SELL,
    LOSS;

    public boolean isClosing() {
        return this != BUY;
    }
}
