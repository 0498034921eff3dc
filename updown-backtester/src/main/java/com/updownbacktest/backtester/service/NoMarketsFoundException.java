package com.updownbacktest.backtester.service;

public class NoMarketsFoundException extends BacktestException {

    public NoMarketsFoundException(String message) {
        super(message);
    }
}
