package com.trendline.core.model;

import java.util.Locale;

/**
 * OHLCV price bar. Timestamp is the bar open time in epoch milliseconds.
 * Stored as CSV in &lt;dataDir&gt;/SYMBOL/TIMEFRAME.csv
 */
public record Candle(
    long timestamp,
    double open,
    double high,
    double low,
    double close,
    double volume
) {
    /**
     * Parse a CSV line into a Candle.
     * Format: timestamp,open,high,low,close,volume
     */
    public static Candle fromCsv(String line) {
        String[] parts = line.split(",");
        if (parts.length < 6) {
            throw new IllegalArgumentException("Invalid CSV line: " + line);
        }

        long timestamp = Long.parseLong(parts[0].trim());
        double open = Double.parseDouble(parts[1].trim());
        double high = Double.parseDouble(parts[2].trim());
        double low = Double.parseDouble(parts[3].trim());
        double close = Double.parseDouble(parts[4].trim());
        double volume = Double.parseDouble(parts[5].trim());

        return new Candle(timestamp, open, high, low, close, volume);
    }

    /**
     * Convert to CSV format.
     */
    public String toCsv() {
        return String.format(Locale.ROOT, "%d,%.8f,%.8f,%.8f,%.8f,%.8f",
            timestamp, open, high, low, close, volume);
    }

    /**
     * Flat candle where open, high, low and close are all the same price.
     */
    public static Candle flat(long timestamp, double price) {
        return new Candle(timestamp, price, price, price, price, 0);
    }
}
