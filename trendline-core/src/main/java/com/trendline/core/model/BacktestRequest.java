package com.trendline.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Backtest invocation: what to replay, over which range, with which parameters.
 *
 * @param startDate         inclusive range start, epoch millis
 * @param endDate           exclusive range end, epoch millis
 * @param commissionPercent commission charged on the notional of every fill, in percent
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record BacktestRequest(
    String symbol,
    Timeframe timeframe,
    long startDate,
    long endDate,
    double initialBalance,
    double commissionPercent,
    StrategyConfig strategy
) {
    @JsonCreator
    public BacktestRequest {
        if (symbol == null || symbol.isBlank()) {
            throw new IllegalArgumentException("symbol is required");
        }
        if (timeframe == null) {
            throw new IllegalArgumentException("timeframe is required");
        }
        if (strategy == null) {
            throw new IllegalArgumentException("strategy is required");
        }
    }

    public BacktestRequest(String symbol, Timeframe timeframe, long startDate, long endDate,
                           double initialBalance, StrategyConfig strategy) {
        this(symbol, timeframe, startDate, endDate, initialBalance, 0.0, strategy);
    }

    @JsonIgnore
    public double commissionRate() {
        return commissionPercent / 100.0;
    }
}
