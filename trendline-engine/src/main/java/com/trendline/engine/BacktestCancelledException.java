package com.trendline.engine;

import com.trendline.core.exception.TrendlineException;

import java.util.Locale;

/**
 * A backtest was cancelled between two bars. No partial result is produced.
 */
public class BacktestCancelledException extends TrendlineException {

    private final int barsProcessed;
    private final int totalBars;

    public BacktestCancelledException(int barsProcessed, int totalBars) {
        super(String.format(Locale.ROOT, "Backtest cancelled after %d of %d bars", barsProcessed, totalBars));
        this.barsProcessed = barsProcessed;
        this.totalBars = totalBars;
    }

    public int getBarsProcessed() {
        return barsProcessed;
    }

    public int getTotalBars() {
        return totalBars;
    }
}
