package com.trendline.core.indicators;

/**
 * Running state of a single-input indicator, advanced one close at a time.
 * Batch and incremental calculations share the same state classes so both
 * produce bit-identical values.
 */
public interface IndicatorState {

    /**
     * Feed the next close. Returns the indicator value for this bar,
     * or {@code Double.NaN} while still warming up.
     */
    double update(double close);

    /**
     * Whether the last update produced a defined value.
     */
    boolean isReady();

    /**
     * Number of closes needed before the first defined value.
     */
    int warmupBars();
}
