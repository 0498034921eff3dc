package com.updownbacktest.backtester.service;

/**
 * The run could not process a single market.
 */
public class BacktestFailedException extends BacktestException {

    public BacktestFailedException(String message) {
        super(message);
    }
}
