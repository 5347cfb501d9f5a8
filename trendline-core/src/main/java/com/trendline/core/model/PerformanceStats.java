package com.trendline.core.model;

/**
 * Summary statistics of a backtest.
 *
 * @param winRate            fraction of trades with positive profit, in [0, 1]
 * @param maxDrawdownPercent most negative decline from the running peak, in percent (&lt;= 0)
 * @param sharpeRatio        annualized mean/stdDev of per-bar returns, 0 when undefined
 */
public record PerformanceStats(
    double initialBalance,
    double finalBalance,
    double totalReturn,
    double totalReturnPercent,
    int totalTrades,
    int winningTrades,
    int losingTrades,
    double winRate,
    double maxDrawdownPercent,
    double sharpeRatio,
    double profitFactor,
    double averageWin,
    double averageLoss,
    double largestWin,
    double largestLoss
) {
    /**
     * Stats for a run that never changed the balance.
     */
    public static PerformanceStats empty(double initialBalance) {
        return new PerformanceStats(
            initialBalance, initialBalance, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0
        );
    }
}
