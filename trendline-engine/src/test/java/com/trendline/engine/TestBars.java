package com.trendline.engine;

import com.trendline.core.model.BacktestRequest;
import com.trendline.core.model.Candle;
import com.trendline.core.model.StrategyConfig;
import com.trendline.core.model.Timeframe;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Hourly bar fixtures.
 *
 * The entry prefix closes 100, 99, 98, 97, 100; with {@link #fastConfig()} (EMA 2/3, RSI 2)
 * the averages cross upwards on bar 4 and a long is opened at 100 with the stop at 98
 * and the target at 104.
 */
public final class TestBars {

    public static final long HOUR = 3_600_000L;
    public static final long T0 = 1_704_067_200_000L; // 2024-01-01T00:00Z

    private TestBars() {}

    public static Candle bar(int index, double open, double high, double low, double close) {
        return new Candle(T0 + index * HOUR, open, high, low, close, 1000);
    }

    public static Candle flat(int index, double price) {
        return bar(index, price, price, price, price);
    }

    public static List<Candle> closes(double... closes) {
        List<Candle> candles = new ArrayList<>();
        for (int i = 0; i < closes.length; i++) {
            candles.add(flat(i, closes[i]));
        }
        return candles;
    }

    /**
     * Entry prefix (bars 0-4) followed by the given bars, which must be indexed from 5.
     */
    public static List<Candle> entryThen(Candle... after) {
        List<Candle> candles = closes(100, 99, 98, 97, 100);
        candles.addAll(Arrays.asList(after));
        return candles;
    }

    public static List<Candle> wave(int count) {
        List<Candle> candles = new ArrayList<>();
        double previous = 100;
        for (int i = 0; i < count; i++) {
            double close = 100 + 10 * Math.sin(i / 6.0) + 4 * Math.sin(i / 2.3) + i * 0.05;
            double high = Math.max(previous, close) + 0.8;
            double low = Math.min(previous, close) - 0.8;
            candles.add(bar(i, previous, high, low, close));
            previous = close;
        }
        return candles;
    }

    public static StrategyConfig fastConfig() {
        return StrategyConfig.builder()
            .emaShortPeriod(2)
            .emaLongPeriod(3)
            .rsiPeriod(2)
            .minConfidence(0)
            .minTimeBetweenTrades(0)
            .tradeAmountPercent(10)
            .stopLossPercent(2)
            .takeProfitPercent(4)
            .build();
    }

    public static BacktestRequest request(List<Candle> candles, StrategyConfig config, double commissionPercent) {
        long end = candles.get(candles.size() - 1).timestamp() + HOUR;
        return new BacktestRequest("TESTUSDT", Timeframe.H1, T0, end, 10_000, commissionPercent, config);
    }

    public static BacktestRequest request(List<Candle> candles, StrategyConfig config) {
        return request(candles, config, 0);
    }
}
