package com.trendline.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * Trade signal emitted on an EMA crossover bar.
 *
 * @param timestamp      bar timestamp the signal fired on
 * @param confidence     deterministic score in [0, 100]
 * @param referencePrice close of the signal bar
 * @param indicators     indicator values at the signal bar
 * @param message        human-readable description, not used downstream
 */
public record Signal(
    long timestamp,
    SignalDirection direction,
    SignalStrength strength,
    double confidence,
    double referencePrice,
    IndicatorPoint indicators,
    String message
) {
    @JsonIgnore
    public boolean isBuy() {
        return direction == SignalDirection.BUY;
    }

    @JsonIgnore
    public boolean isSell() {
        return direction == SignalDirection.SELL;
    }
}
