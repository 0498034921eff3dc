package com.updownbacktest.backtester.service;

/**
 * Base class of the errors that end a backtest run.
 */
public class BacktestException extends RuntimeException {

    public BacktestException(String message) {
        super(message);
    }

    public BacktestException(String message, Throwable cause) {
        super(message, cause);
    }
}
