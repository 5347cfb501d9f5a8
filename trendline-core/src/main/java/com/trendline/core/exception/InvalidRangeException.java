package com.trendline.core.exception;

/**
 * Malformed date range or non-increasing bar timestamps.
 */
public class InvalidRangeException extends TrendlineException {

    public InvalidRangeException(String message) {
        super(message);
    }
}
