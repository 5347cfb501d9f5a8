package com.trendline.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.time.Duration;

/**
 * Bar resolution. Crypto markets trade around the clock, so bars per year
 * is computed over a full 365-day year.
 */
public enum Timeframe {
    M1("1m", Duration.ofMinutes(1)),
    M5("5m", Duration.ofMinutes(5)),
    M15("15m", Duration.ofMinutes(15)),
    M30("30m", Duration.ofMinutes(30)),
    H1("1h", Duration.ofHours(1)),
    H4("4h", Duration.ofHours(4)),
    D1("1d", Duration.ofDays(1)),
    W1("1w", Duration.ofDays(7));

    private static final long MILLIS_PER_YEAR = Duration.ofDays(365).toMillis();

    private final String code;
    private final Duration duration;

    Timeframe(String code, Duration duration) {
        this.code = code;
        this.duration = duration;
    }

    @JsonValue
    public String code() {
        return code;
    }

    public long millis() {
        return duration.toMillis();
    }

    /**
     * Number of bars of this timeframe in one year, used to annualize per-bar statistics.
     */
    public double barsPerYear() {
        return (double) MILLIS_PER_YEAR / duration.toMillis();
    }

    @JsonCreator
    public static Timeframe fromCode(String code) {
        if (code == null) {
            throw new IllegalArgumentException("Timeframe code is required");
        }
        String normalized = code.trim();
        for (Timeframe tf : values()) {
            if (tf.code.equalsIgnoreCase(normalized) || tf.name().equalsIgnoreCase(normalized)) {
                return tf;
            }
        }
        throw new IllegalArgumentException("Unknown timeframe: " + code);
    }

    @Override
    public String toString() {
        return code;
    }
}
