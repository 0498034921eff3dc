package com.updownbacktest.backtester.domain;

public enum CandleOffset {
    CURRENT,
    PREVIOUS;

    public static CandleOffset fromString(String raw) {
        return raw != null && raw.trim().equalsIgnoreCase("previous") ? PREVIOUS : CURRENT;
    }
}
