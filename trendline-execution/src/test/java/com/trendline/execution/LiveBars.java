package com.trendline.execution;

import com.trendline.core.model.Candle;
import com.trendline.core.model.StrategyConfig;

import java.util.ArrayList;
import java.util.List;

/**
 * Hourly bars whose EMA 2/3 cross upwards on bar 4 (close 100) and downwards on bar 5 (close 95).
 */
final class LiveBars {

    static final long HOUR = 3_600_000L;
    static final long T0 = 1_704_067_200_000L; // 2024-01-01T00:00Z

    private LiveBars() {}

    static Candle bar(int index, double open, double high, double low, double close) {
        return new Candle(T0 + index * HOUR, open, high, low, close, 1000);
    }

    static List<Candle> upThenDown() {
        return flatBars(100, 99, 98, 97, 100, 95, 95);
    }

    /**
     * As {@link #upThenDown()}, followed by a second upward cross on bar 8 (close 100).
     */
    static List<Candle> upDownUp() {
        return flatBars(100, 99, 98, 97, 100, 95, 95, 97, 100);
    }

    private static List<Candle> flatBars(double... closes) {
        List<Candle> candles = new ArrayList<>();
        for (int i = 0; i < closes.length; i++) {
            candles.add(bar(i, closes[i], closes[i], closes[i], closes[i]));
        }
        return candles;
    }

    static StrategyConfig config(boolean autoTrading) {
        return StrategyConfig.builder()
            .emaShortPeriod(2)
            .emaLongPeriod(3)
            .rsiPeriod(2)
            .minConfidence(0)
            .minTimeBetweenTrades(0)
            .stopLossPercent(50)
            .takeProfitPercent(50)
            .autoTradingEnabled(autoTrading)
            .build();
    }
}
