package com.trendline.core.data;

import com.trendline.core.exception.DataUnavailableException;
import com.trendline.core.model.Candle;
import com.trendline.core.model.Timeframe;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Provider backed by series registered in memory.
 */
public class InMemoryMarketDataProvider implements MarketDataProvider {

    // Key: "SYMBOL:timeframe"
    private final Map<String, List<Candle>> series = new ConcurrentHashMap<>();

    /**
     * Register (or replace) the series for a symbol and timeframe. Bars are served in the given order.
     */
    public InMemoryMarketDataProvider put(String symbol, Timeframe timeframe, List<Candle> candles) {
        series.put(key(symbol, timeframe), List.copyOf(candles));
        return this;
    }

    /**
     * Append a bar to an existing series, e.g. to simulate a live feed.
     */
    public synchronized void append(String symbol, Timeframe timeframe, Candle candle) {
        series.merge(key(symbol, timeframe), List.of(candle), (existing, added) -> {
            List<Candle> merged = new ArrayList<>(existing);
            merged.addAll(added);
            return List.copyOf(merged);
        });
    }

    @Override
    public List<Candle> getBars(String symbol, Timeframe timeframe, long start, long end) throws DataUnavailableException {
        List<Candle> candles = series.get(key(symbol, timeframe));
        if (candles == null) {
            throw new DataUnavailableException("No data registered for " + symbol + " " + timeframe);
        }
        return candles.stream()
            .filter(c -> c.timestamp() >= start && c.timestamp() < end)
            .toList();
    }

    private static String key(String symbol, Timeframe timeframe) {
        return symbol.toUpperCase() + ":" + timeframe.code();
    }
}
