package com.trendline.engine;

import com.trendline.core.model.EquityPoint;
import com.trendline.core.model.PerformanceStats;
import com.trendline.core.model.Timeframe;
import com.trendline.core.model.Trade;

import java.util.List;

/**
 * Derives summary statistics from the equity curve and closed trades of a run.
 */
public final class PerformanceAnalyzer {

    private PerformanceAnalyzer() {}

    public static PerformanceStats analyze(double initialBalance, List<EquityPoint> equityCurve,
                                           List<Trade> trades, Timeframe timeframe) {
        double finalBalance = equityCurve.isEmpty()
            ? initialBalance
            : equityCurve.get(equityCurve.size() - 1).balance();

        if (trades.isEmpty() && equityCurve.isEmpty()) {
            return PerformanceStats.empty(initialBalance);
        }

        int winners = 0;
        int losers = 0;
        double totalWins = 0;
        double totalLosses = 0;
        double largestWin = 0;
        double largestLoss = 0;

        for (Trade t : trades) {
            double profit = t.profit();
            if (profit > 0) {
                winners++;
                totalWins += profit;
                largestWin = Math.max(largestWin, profit);
            } else {
                losers++;
                totalLosses += Math.abs(profit);
                largestLoss = Math.max(largestLoss, Math.abs(profit));
            }
        }

        int total = trades.size();
        double winRate = total > 0 ? (double) winners / total : 0;
        double profitFactor = totalLosses > 0 ? totalWins / totalLosses : 0;
        double avgWin = winners > 0 ? totalWins / winners : 0;
        double avgLoss = losers > 0 ? totalLosses / losers : 0;
        double totalReturn = finalBalance - initialBalance;
        double totalReturnPct = initialBalance > 0 ? totalReturn / initialBalance * 100 : 0;

        return new PerformanceStats(
            initialBalance, finalBalance, totalReturn, totalReturnPct,
            total, winners, losers, winRate,
            maxDrawdownPercent(equityCurve),
            sharpeRatio(initialBalance, equityCurve, timeframe),
            profitFactor, avgWin, avgLoss, largestWin, largestLoss
        );
    }

    /**
     * Most negative {@code (balance - runningPeak) / runningPeak * 100} over the curve; 0 for a
     * curve that never declines.
     */
    public static double maxDrawdownPercent(List<EquityPoint> equityCurve) {
        double peak = Double.NEGATIVE_INFINITY;
        double worst = 0;
        for (EquityPoint point : equityCurve) {
            double balance = point.balance();
            if (balance > peak) {
                peak = balance;
            }
            if (peak > 0) {
                worst = Math.min(worst, (balance - peak) / peak * 100);
            }
        }
        return worst;
    }

    /**
     * Annualized Sharpe ratio of per-bar equity returns, starting from the initial balance.
     * Returns 0 when there are fewer than two returns or their standard deviation is 0.
     */
    public static double sharpeRatio(double initialBalance, List<EquityPoint> equityCurve, Timeframe timeframe) {
        int n = equityCurve.size();
        if (n < 2) {
            return 0;
        }

        double[] returns = new double[n];
        double previous = initialBalance;
        for (int i = 0; i < n; i++) {
            double balance = equityCurve.get(i).balance();
            returns[i] = previous > 0 ? (balance - previous) / previous : 0;
            previous = balance;
        }

        double mean = 0;
        for (double r : returns) {
            mean += r;
        }
        mean /= n;

        double variance = 0;
        for (double r : returns) {
            variance += (r - mean) * (r - mean);
        }
        double stdDev = Math.sqrt(variance / n);

        if (stdDev == 0) {
            return 0;
        }
        return mean / stdDev * Math.sqrt(timeframe.barsPerYear());
    }
}
