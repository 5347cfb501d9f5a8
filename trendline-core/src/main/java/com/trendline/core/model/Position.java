package com.trendline.core.model;

/**
 * An open long position. Immutable; closing it produces a {@link Trade}.
 *
 * @param openTime        entry bar timestamp
 * @param quantity        units of the base asset
 * @param entryCommission commission paid on the entry fill
 */
public record Position(
    long openTime,
    double entryPrice,
    double quantity,
    PositionSide side,
    double stopLossPrice,
    double takeProfitPrice,
    double entryCommission
) {
    /**
     * Notional value at entry.
     */
    public double entryValue() {
        return entryPrice * quantity;
    }

    /**
     * Mark-to-market value of the position at the given price.
     */
    public double marketValue(double price) {
        return price * quantity;
    }

    public boolean stopLossHit(Candle candle) {
        return candle.low() <= stopLossPrice;
    }

    public boolean takeProfitHit(Candle candle) {
        return candle.high() >= takeProfitPrice;
    }

    /**
     * Fill price for a stop-loss on this bar: the stop level, or the open when the bar gaps below it.
     */
    public double stopLossFillPrice(Candle candle) {
        return Math.min(candle.open(), stopLossPrice);
    }

    /**
     * Fill price for a take-profit on this bar: the target level, or the open when the bar gaps above it.
     */
    public double takeProfitFillPrice(Candle candle) {
        return Math.max(candle.open(), takeProfitPrice);
    }
}
