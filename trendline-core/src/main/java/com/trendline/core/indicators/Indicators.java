package com.trendline.core.indicators;

import com.trendline.core.exception.InsufficientDataException;
import com.trendline.core.model.Candle;
import com.trendline.core.model.IndicatorPoint;
import com.trendline.core.model.StrategyConfig;

import java.util.ArrayList;
import java.util.List;

/**
 * Facade for the indicator calculations used by the strategy.
 */
public final class Indicators {

    private Indicators() {} // Utility class

    /**
     * Indicator points for a whole candle list, one per bar once the strategy's warm-up is complete.
     *
     * @throws InsufficientDataException if the list is shorter than the warm-up
     */
    public static List<IndicatorPoint> points(List<Candle> candles, StrategyConfig config) {
        int warmup = config.warmupBars();
        if (candles.size() < warmup) {
            throw new InsufficientDataException(warmup, candles.size());
        }

        double[] emaShort = EMA.calculate(candles, config.emaShortPeriod());
        double[] emaLong = EMA.calculate(candles, config.emaLongPeriod());
        double[] rsi = RSI.calculate(candles, config.rsiPeriod());

        List<IndicatorPoint> points = new ArrayList<>(candles.size() - warmup + 1);
        for (int i = warmup - 1; i < candles.size(); i++) {
            points.add(new IndicatorPoint(candles.get(i).timestamp(), emaShort[i], emaLong[i], rsi[i]));
        }
        return points;
    }
}
