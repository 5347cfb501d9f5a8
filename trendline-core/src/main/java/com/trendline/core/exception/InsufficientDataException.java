package com.trendline.core.exception;

import java.util.Locale;

/**
 * Not enough bars to seed the requested indicator periods or backtest.
 */
public class InsufficientDataException extends TrendlineException {

    private final int required;
    private final int available;

    public InsufficientDataException(int required, int available) {
        super(String.format(Locale.ROOT, "Insufficient data: %d bars required, %d available", required, available));
        this.required = required;
        this.available = available;
    }

    public int getRequired() {
        return required;
    }

    public int getAvailable() {
        return available;
    }
}
