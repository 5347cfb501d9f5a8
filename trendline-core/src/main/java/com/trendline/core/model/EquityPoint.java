package com.trendline.core.model;

/**
 * Account balance (cash plus open position marked at the close) after one bar.
 */
public record EquityPoint(long timestamp, double balance) {
}
