package com.trendline.core.indicators;

import com.trendline.core.exception.InsufficientDataException;
import com.trendline.core.model.Candle;

import java.util.Arrays;
import java.util.List;

/**
 * Exponential Moving Average indicator.
 * Seeded with the simple average of the first {@code period} closes, then
 * {@code close * k + previous * (1 - k)} with {@code k = 2 / (period + 1)}.
 */
public final class EMA {

    private EMA() {} // Utility class

    /**
     * Lazy series of defined EMA values, one per bar from index {@code period - 1}.
     *
     * @throws InsufficientDataException if there are fewer than {@code period} candles
     */
    public static IndicatorSeries series(List<Candle> candles, int period) {
        requirePeriod(period);
        return new IndicatorSeries(candles, () -> new State(period));
    }

    /**
     * Calculate EMA for all bars.
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

    private static void requirePeriod(int period) {
        if (period < 1) {
            throw new IllegalArgumentException("EMA period must be positive: " + period);
        }
    }

    /**
     * Incremental EMA state.
     */
    public static final class State implements IndicatorState {
        private final int period;
        private final double k;
        private int count;
        private double sum;
        private double value = Double.NaN;

        public State(int period) {
            requirePeriod(period);
            this.period = period;
            this.k = 2.0 / (period + 1);
        }

        @Override
        public double update(double close) {
            count++;
            if (count < period) {
                sum += close;
                return Double.NaN;
            }
            if (count == period) {
                sum += close;
                value = sum / period;
            } else {
                value = close * k + value * (1 - k);
            }
            return value;
        }

        @Override
        public boolean isReady() {
            return count >= period;
        }

        @Override
        public int warmupBars() {
            return period;
        }

        public double value() {
            return value;
        }
    }
}
