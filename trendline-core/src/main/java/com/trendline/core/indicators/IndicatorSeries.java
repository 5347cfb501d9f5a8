package com.trendline.core.indicators;

import com.trendline.core.exception.InsufficientDataException;
import com.trendline.core.model.Candle;

import java.util.List;
import java.util.NoSuchElementException;
import java.util.PrimitiveIterator;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.function.Supplier;
import java.util.stream.DoubleStream;
import java.util.stream.StreamSupport;

/**
 * Lazy, restartable sequence of the defined values of an indicator over a candle list.
 * Nothing is computed until iterated; every call to {@link #iterator()} or
 * {@link #stream()} starts again from a fresh state, so repeated passes
 * reproduce identical values.
 */
public final class IndicatorSeries {

    private final List<Candle> candles;
    private final Supplier<? extends IndicatorState> stateFactory;
    private final int warmupBars;

    IndicatorSeries(List<Candle> candles, Supplier<? extends IndicatorState> stateFactory) {
        this.candles = List.copyOf(candles);
        this.stateFactory = stateFactory;
        this.warmupBars = stateFactory.get().warmupBars();
        if (this.candles.size() < warmupBars) {
            throw new InsufficientDataException(warmupBars, this.candles.size());
        }
    }

    /**
     * Number of defined values: candles minus the warm-up bars plus one.
     */
    public int size() {
        return candles.size() - warmupBars + 1;
    }

    /**
     * Bar index of the first defined value.
     */
    public int firstBarIndex() {
        return warmupBars - 1;
    }

    /**
     * Timestamp of the i-th value of the series.
     */
    public long timestampAt(int i) {
        return candles.get(firstBarIndex() + i).timestamp();
    }

    public PrimitiveIterator.OfDouble iterator() {
        IndicatorState state = stateFactory.get();
        return new PrimitiveIterator.OfDouble() {
            private int bar;

            @Override
            public boolean hasNext() {
                return bar < candles.size();
            }

            @Override
            public double nextDouble() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                double value = state.update(candles.get(bar++).close());
                while (!state.isReady()) {
                    value = state.update(candles.get(bar++).close());
                }
                return value;
            }
        };
    }

    public DoubleStream stream() {
        Spliterator.OfDouble spliterator = Spliterators.spliterator(
            iterator(), size(), Spliterator.ORDERED | Spliterator.SIZED | Spliterator.NONNULL);
        return StreamSupport.doubleStream(spliterator, false);
    }

    public double[] toArray() {
        return stream().toArray();
    }
}
