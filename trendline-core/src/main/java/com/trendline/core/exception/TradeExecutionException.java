package com.trendline.core.exception;

/**
 * Live order placement failure reported by an execution adapter.
 * The engine surfaces it and never retries; retry policy belongs to the adapter.
 */
public class TradeExecutionException extends Exception {

    public TradeExecutionException(String message) {
        super(message);
    }

    public TradeExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
