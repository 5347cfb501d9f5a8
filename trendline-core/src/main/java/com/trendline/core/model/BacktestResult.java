package com.trendline.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;
import java.util.Locale;

/**
 * Result of a backtest run. Contains nothing derived from wall-clock time,
 * so identical inputs produce identical results.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record BacktestResult(
    BacktestRequest request,
    List<Trade> trades,
    List<EquityPoint> equityCurve,
    List<Signal> signals,
    PerformanceStats stats,
    int barsProcessed
) {
    public BacktestResult {
        trades = List.copyOf(trades);
        equityCurve = List.copyOf(equityCurve);
        signals = List.copyOf(signals);
    }

    public double finalBalance() {
        return stats.finalBalance();
    }

    /**
     * Get summary string
     */
    @JsonIgnore
    public String getSummary() {
        return String.format(Locale.ROOT,
            "%s %s: %d trades, %.1f%% win rate, %+.2f%% return, %.2f%% max drawdown, %.2f sharpe",
            request.symbol(),
            request.timeframe(),
            stats.totalTrades(),
            stats.winRate() * 100,
            stats.totalReturnPercent(),
            stats.maxDrawdownPercent(),
            stats.sharpeRatio()
        );
    }
}
