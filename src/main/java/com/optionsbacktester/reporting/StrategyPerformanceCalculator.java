package com.optionsbacktester.reporting;

import com.optionsbacktester.domain.enums.ExitReason;
import com.optionsbacktester.domain.model.Trade;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.apache.commons.math3.stat.descriptive.moment.Mean;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Computes run-level performance metrics from a completed trade ledger.
 *
 * <p>Calculates: win rate, average P&L per trade, profit factor, average and largest
 * win/loss, consecutive win/loss streaks, Sharpe ratio, average holding time, max
 * favorable/adverse excursion, exit-reason counts and the regime table.
 *
 * <p>Trades are evaluated in exit order. A trade with zero P&L counts as a loss.
 */
@Service
public class StrategyPerformanceCalculator {

    private static final Logger log = LoggerFactory.getLogger(StrategyPerformanceCalculator.class);

    static final BigDecimal NO_LOSS_PROFIT_FACTOR = BigDecimal.valueOf(999.99);

    /**
     * Calculates the summary for a run.
     *
     * @param strategyName   adapter name, copied to the report
     * @param trades         the run's ledger
     * @param maxDrawdown    equity-based drawdown tracked by the loop
     * @param initialCapital starting cash
     * @param finalCash      cash after the last close
     * @return the report, or an empty report carrying the capital figures if there are no trades
     */
    public StrategyPerformanceReport calculate(
            String strategyName,
            List<Trade> trades,
            BigDecimal maxDrawdown,
            BigDecimal initialCapital,
            BigDecimal finalCash) {
        BigDecimal returnPercent = returnPercent(initialCapital, finalCash);
        if (trades.isEmpty()) {
            StrategyPerformanceReport empty = StrategyPerformanceReport.empty(strategyName);
            empty.setMaxDrawdown(maxDrawdown);
            empty.setInitialCapital(initialCapital);
            empty.setFinalCash(finalCash);
            empty.setReturnPercent(returnPercent);
            return empty;
        }

        List<Trade> ordered = trades.stream()
                .sorted(Comparator.comparing(Trade::getExitTime))
                .toList();
        List<BigDecimal> pnls = ordered.stream().map(Trade::getRealizedPnl).toList();

        int totalTrades = ordered.size();
        int winningTrades = (int) pnls.stream().filter(p -> p.signum() > 0).count();
        int losingTrades = totalTrades - winningTrades;

        BigDecimal totalPnl = sum(pnls);

        // Gross profit (sum of positive P&Ls) and gross loss (sum of absolute negative P&Ls)
        BigDecimal grossProfit = sum(pnls.stream().filter(p -> p.signum() > 0).toList());
        BigDecimal grossLoss = sum(pnls.stream().filter(p -> p.signum() < 0).map(BigDecimal::abs).toList());

        BigDecimal profitFactor;
        if (grossLoss.signum() > 0) {
            profitFactor = grossProfit.divide(grossLoss, 2, RoundingMode.HALF_UP);
        } else {
            profitFactor = grossProfit.signum() > 0 ? NO_LOSS_PROFIT_FACTOR : BigDecimal.ZERO;
        }

        int lossCount = (int) pnls.stream().filter(p -> p.signum() < 0).count();

        long avgHoldingMinutes = (long) ordered.stream()
                .mapToLong(Trade::getHoldingMinutes)
                .average()
                .orElse(0);

        Map<ExitReason, Integer> exitReasons = new EnumMap<>(ExitReason.class);
        ordered.forEach(t -> exitReasons.merge(t.getExitReason(), 1, Integer::sum));

        BigDecimal sharpeRatio = calculateSharpeRatio(pnls);

        log.debug(
                "Performance calculated for {}: {} trades, {}% win rate, PF={}, maxDD={}",
                strategyName, totalTrades, RegimePerformanceCalculator.percentage(winningTrades, totalTrades),
                profitFactor, maxDrawdown);

        return StrategyPerformanceReport.builder()
                .strategyName(strategyName)
                .totalTrades(totalTrades)
                .winningTrades(winningTrades)
                .losingTrades(losingTrades)
                .winRate(RegimePerformanceCalculator.percentage(winningTrades, totalTrades))
                .totalPnl(totalPnl)
                .avgTradePnl(totalPnl.divide(BigDecimal.valueOf(totalTrades), 2, RoundingMode.HALF_UP))
                .grossProfit(grossProfit)
                .grossLoss(grossLoss)
                .profitFactor(profitFactor)
                .avgWin(average(grossProfit, winningTrades))
                .avgLoss(average(grossLoss, lossCount))
                .largestWin(pnls.stream().max(Comparator.naturalOrder()).filter(p -> p.signum() > 0).orElse(BigDecimal.ZERO))
                .largestLoss(pnls.stream().min(Comparator.naturalOrder()).filter(p -> p.signum() < 0).orElse(BigDecimal.ZERO))
                .maxConsecutiveWins(longestStreak(pnls, true))
                .maxConsecutiveLosses(longestStreak(pnls, false))
                .maxDrawdown(maxDrawdown)
                .sharpeRatio(sharpeRatio)
                .avgHoldingTimeMinutes(avgHoldingMinutes)
                .maxFavorableExcursion(ordered.stream()
                        .map(Trade::getMaxUnrealizedPnl)
                        .filter(Objects::nonNull)
                        .max(Comparator.naturalOrder())
                        .orElse(BigDecimal.ZERO))
                .maxAdverseExcursion(ordered.stream()
                        .map(Trade::getMinUnrealizedPnl)
                        .filter(Objects::nonNull)
                        .min(Comparator.naturalOrder())
                        .orElse(BigDecimal.ZERO))
                .estimatedTrades((int) ordered.stream().filter(Trade::isEstimated).count())
                .exitReasonCounts(exitReasons)
                .regimePerformance(RegimePerformanceCalculator.breakdown(ordered))
                .initialCapital(initialCapital)
                .finalCash(finalCash)
                .returnPercent(returnPercent)
                .build();
    }

    /**
     * Simplified Sharpe ratio: mean trade P&L / population standard deviation of trade P&L.
     * Not annualized since trades are not time-uniform.
     */
    BigDecimal calculateSharpeRatio(List<BigDecimal> pnls) {
        if (pnls.size() < 2) {
            return BigDecimal.ZERO;
        }
        double[] values = pnls.stream().mapToDouble(BigDecimal::doubleValue).toArray();
        double mean = new Mean().evaluate(values);
        double stdDev = new StandardDeviation(false).evaluate(values);
        if (stdDev == 0) {
            return BigDecimal.ZERO;
        }
        return BigDecimal.valueOf(mean / stdDev).setScale(2, RoundingMode.HALF_UP);
    }

    /** Longest run of wins ({@code wins = true}) or non-wins in ledger order. */
    int longestStreak(List<BigDecimal> pnls, boolean wins) {
        int longest = 0;
        int current = 0;
        for (BigDecimal pnl : pnls) {
            if ((pnl.signum() > 0) == wins) {
                current++;
                longest = Math.max(longest, current);
            } else {
                current = 0;
            }
        }
        return longest;
    }

    private static BigDecimal returnPercent(BigDecimal initialCapital, BigDecimal finalCash) {
        if (initialCapital == null || finalCash == null || initialCapital.signum() == 0) {
            return BigDecimal.ZERO;
        }
        return finalCash.subtract(initialCapital)
                .divide(initialCapital, 6, RoundingMode.HALF_UP)
                .multiply(BigDecimal.valueOf(100))
                .setScale(2, RoundingMode.HALF_UP);
    }

    private static BigDecimal sum(List<BigDecimal> values) {
        return values.stream().reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    private static BigDecimal average(BigDecimal total, int count) {
        return count == 0 ? BigDecimal.ZERO : total.divide(BigDecimal.valueOf(count), 2, RoundingMode.HALF_UP);
    }
}
