package com.trendline.core.indicators;

import com.trendline.core.exception.InsufficientDataException;
import com.trendline.core.model.Candle;

import java.util.Arrays;
import java.util.List;

/**
 * Relative Strength Index indicator with Wilder's smoothing.
 * The first value needs {@code period} price changes, i.e. {@code period + 1} closes.
 * Values are clamped to [0, 100]; zero average loss gives 100, zero average gain gives 0.
 */
public final class RSI {

    private RSI() {} // Utility class

    /**
     * Lazy series of defined RSI values, one per bar from index {@code period}.
     *
     * @throws InsufficientDataException if there are fewer than {@code period + 1} candles
     */
    public static IndicatorSeries series(List<Candle> candles, int period) {
        requirePeriod(period);
        return new IndicatorSeries(candles, () -> new State(period));
    }

    /**
     * Calculate RSI for all bars.
     * @return Array where index corresponds to bar index. Invalid values (warmup period) are Double.NaN.
     */
    public static double[] calculate(List<Candle> candles, int period) {
        requirePeriod(period);
        int n = candles.size();
        double[] result = new double[n];
        Arrays.fill(result, Double.NaN);

        State state = new State(period);
        for (int i = 0; i < n; i++) {
            result[i] = state.update(candles.get(i).close());
        }
        return result;
    }

    static double fromAverages(double avgGain, double avgLoss) {
        if (avgLoss == 0) {
            return 100;
        }
        if (avgGain == 0) {
            return 0;
        }
        double rs = avgGain / avgLoss;
        double rsi = 100 - (100 / (1 + rs));
        return Math.max(0, Math.min(100, rsi));
    }

    private static void requirePeriod(int period) {
        if (period < 1) {
            throw new IllegalArgumentException("RSI period must be positive: " + period);
        }
    }

    /**
     * Incremental RSI state.
     */
    public static final class State implements IndicatorState {
        private final int period;
        private double previousClose = Double.NaN;
        private int changes;
        private double gainSum;
        private double lossSum;
        private double avgGain;
        private double avgLoss;
        private double value = Double.NaN;

        public State(int period) {
            requirePeriod(period);
            this.period = period;
        }

        @Override
        public double update(double close) {
            if (Double.isNaN(previousClose)) {
                previousClose = close;
                return Double.NaN;
            }
            double change = close - previousClose;
            previousClose = close;
            double gain = change > 0 ? change : 0;
            double loss = change < 0 ? -change : 0;
            changes++;

            if (changes < period) {
                gainSum += gain;
                lossSum += loss;
                return Double.NaN;
            }
            if (changes == period) {
                gainSum += gain;
                lossSum += loss;
                avgGain = gainSum / period;
                avgLoss = lossSum / period;
            } else {
                avgGain = (avgGain * (period - 1) + gain) / period;
                avgLoss = (avgLoss * (period - 1) + loss) / period;
            }
            value = fromAverages(avgGain, avgLoss);
            return value;
        }

        @Override
        public boolean isReady() {
            return changes >= period;
        }

        @Override
        public int warmupBars() {
            return period + 1;
        }

        public double value() {
            return value;
        }
    }
}
