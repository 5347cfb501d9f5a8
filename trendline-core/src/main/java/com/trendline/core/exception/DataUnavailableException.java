package com.trendline.core.exception;

/**
 * The market data provider cannot serve the requested range.
 */
public class DataUnavailableException extends Exception {

    public DataUnavailableException(String message) {
        super(message);
    }

    public DataUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
