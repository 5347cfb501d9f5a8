package com.trendline.core.model;

/**
 * Indicator values for one bar, produced once the warm-up period is complete.
 * Also used as the indicator snapshot attached to a Signal.
 */
public record IndicatorPoint(
    long timestamp,
    double emaShort,
    double emaLong,
    double rsi
) {
    /**
     * Relative distance between the two averages: |emaShort - emaLong| / emaLong.
     */
    public double emaSpread() {
        return emaLong != 0 ? Math.abs(emaShort - emaLong) / emaLong : 0;
    }
}
