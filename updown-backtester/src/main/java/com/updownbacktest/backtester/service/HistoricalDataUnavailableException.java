package com.updownbacktest.backtester.service;

/**
 * The historical price store cannot be reached.
 */
public class HistoricalDataUnavailableException extends BacktestException {

    public HistoricalDataUnavailableException(String message) {
        super(message);
    }

    public HistoricalDataUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
