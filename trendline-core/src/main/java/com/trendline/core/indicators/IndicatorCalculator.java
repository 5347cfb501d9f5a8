package com.trendline.core.indicators;

import com.trendline.core.exception.InvalidRangeException;
import com.trendline.core.model.Candle;
import com.trendline.core.model.IndicatorPoint;
import com.trendline.core.model.StrategyConfig;

import java.util.Locale;
import java.util.Optional;

/**
 * Incremental EMA short / EMA long / RSI calculator for one strategy instance.
 * Each {@link #append(Candle)} is O(1); the values are bit-identical to the
 * batch calculation over the same candles.
 */
public class IndicatorCalculator {

    private final EMA.State emaShort;
    private final EMA.State emaLong;
    private final RSI.State rsi;
    private final int warmupBars;

    private long lastTimestamp = Long.MIN_VALUE;
    private int barCount;

    public IndicatorCalculator(StrategyConfig config) {
        this(config.emaShortPeriod(), config.emaLongPeriod(), config.rsiPeriod());
    }

    public IndicatorCalculator(int emaShortPeriod, int emaLongPeriod, int rsiPeriod) {
        this.emaShort = new EMA.State(emaShortPeriod);
        this.emaLong = new EMA.State(emaLongPeriod);
        this.rsi = new RSI.State(rsiPeriod);
        this.warmupBars = Math.max(Math.max(emaShort.warmupBars(), emaLong.warmupBars()), rsi.warmupBars());
    }

    /**
     * Append the next candle.
     *
     * @return the indicator point for this candle, empty while warming up
     * @throws InvalidRangeException if the timestamp does not increase
     */
    public Optional<IndicatorPoint> append(Candle candle) {
        if (barCount > 0 && candle.timestamp() <= lastTimestamp) {
            throw new InvalidRangeException(String.format(Locale.ROOT,
                "Bar timestamps must be strictly increasing: %d after %d", candle.timestamp(), lastTimestamp));
        }
        lastTimestamp = candle.timestamp();
        barCount++;

        double close = candle.close();
        double shortValue = emaShort.update(close);
        double longValue = emaLong.update(close);
        double rsiValue = rsi.update(close);

        if (!isWarm()) {
            return Optional.empty();
        }
        return Optional.of(new IndicatorPoint(candle.timestamp(), shortValue, longValue, rsiValue));
    }

    public boolean isWarm() {
        return emaShort.isReady() && emaLong.isReady() && rsi.isReady();
    }

    public int warmupBars() {
        return warmupBars;
    }

    public int barCount() {
        return barCount;
    }
}
