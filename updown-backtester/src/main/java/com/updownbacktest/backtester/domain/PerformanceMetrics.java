package com.updownbacktest.backtester.domain;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;

/**
 * Calculator for backtest performance metrics. Every ratio returns zero when its
 * denominator is zero.
 */
public class PerformanceMetrics {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    /**
     * Calculate total return percentage.
     */
    public static BigDecimal calculateTotalReturn(BigDecimal initialBalance, BigDecimal finalBalance) {
        if (initialBalance.compareTo(BigDecimal.ZERO) == 0) {
            return BigDecimal.ZERO;
        }

        return finalBalance.subtract(initialBalance)
                .divide(initialBalance, 6, RoundingMode.HALF_UP)
                .multiply(HUNDRED)
                .setScale(4, RoundingMode.HALF_UP);
    }

    /**
     * Calculate the percentage of closed trades that won.
     */
    public static BigDecimal calculateWinRate(int winningTrades, int closedTrades) {
        if (closedTrades == 0) {
            return BigDecimal.ZERO;
        }
        return BigDecimal.valueOf(winningTrades)
                .multiply(HUNDRED)
                .divide(BigDecimal.valueOf(closedTrades), 4, RoundingMode.HALF_UP);
    }

    public static BigDecimal calculateAverage(List<BigDecimal> values) {
        if (values.isEmpty()) {
            return BigDecimal.ZERO;
        }
        return sum(values).divide(BigDecimal.valueOf(values.size()), 4, RoundingMode.HALF_UP);
    }

    /**
     * Gross profit over gross loss. With profits and no losses the cap is returned.
     */
    public static BigDecimal calculateProfitFactor(BigDecimal grossProfit, BigDecimal grossLoss, BigDecimal cap) {
        if (grossLoss.compareTo(BigDecimal.ZERO) > 0) {
            return grossProfit.divide(grossLoss, 4, RoundingMode.HALF_UP);
        }
        return grossProfit.compareTo(BigDecimal.ZERO) > 0 ? cap : BigDecimal.ZERO;
    }

    /**
     * Calculate Sharpe ratio from per-trade returns (risk-free rate of 0, sample
     * standard deviation, annualized over 252 periods).
     */
    public static BigDecimal calculateSharpeRatio(List<BigDecimal> returns) {
        if (returns.size() < 2) {
            return BigDecimal.ZERO;
        }

        BigDecimal meanReturn = sum(returns).divide(
                BigDecimal.valueOf(returns.size()), 10, RoundingMode.HALF_UP);

        BigDecimal sumSquaredDiff = returns.stream()
                .map(r -> r.subtract(meanReturn).pow(2))
                .reduce(BigDecimal.ZERO, BigDecimal::add);

        double variance = sumSquaredDiff.divide(
                BigDecimal.valueOf(returns.size() - 1L), 10, RoundingMode.HALF_UP)
                .doubleValue();
        double stdDev = Math.sqrt(variance);

        if (stdDev == 0) {
            return BigDecimal.ZERO;
        }

        double sharpe = (meanReturn.doubleValue() / stdDev) * Math.sqrt(252);
        return BigDecimal.valueOf(sharpe).setScale(4, RoundingMode.HALF_UP);
    }

    private static BigDecimal sum(List<BigDecimal> values) {
        return values.stream().reduce(BigDecimal.ZERO, BigDecimal::add);
    }
}
