package com.trendline.core.data;

import com.trendline.core.exception.DataUnavailableException;
import com.trendline.core.model.Candle;
import com.trendline.core.model.Timeframe;

import java.util.List;

/**
 * Source of historical bars. Read-only; may be shared by concurrent backtests.
 */
public interface MarketDataProvider {

    /**
     * Bars of {@code symbol} at {@code timeframe} with {@code start <= timestamp < end},
     * in stored order. A known series with no bars in the range yields an empty list.
     *
     * @throws DataUnavailableException if the series is unknown or cannot be read
     */
    List<Candle> getBars(String symbol, Timeframe timeframe, long start, long end) throws DataUnavailableException;
}
