package com.trendline.core.exception;

/**
 * Base class for errors raised by the engine itself: invalid input, invalid
 * configuration and insufficient history.
 */
public class TrendlineException extends RuntimeException {

    public TrendlineException(String message) {
        super(message);
    }

    public TrendlineException(String message, Throwable cause) {
        super(message, cause);
    }
}
