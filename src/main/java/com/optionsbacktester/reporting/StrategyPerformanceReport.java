package com.optionsbacktester.reporting;

import com.optionsbacktester.domain.enums.ExitReason;
import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.Data;

/**
 * Summary metrics for one backtest run, computed from its trade ledger.
 *
 * <p>Key metrics:
 * <ul>
 *   <li>Win rate and profit factor for profitability assessment</li>
 *   <li>Max drawdown and Sharpe ratio for risk assessment</li>
 *   <li>Exit reasons and holding time for operational insight</li>
 *   <li>Max favorable/adverse excursion from the per-position running P&L extremes</li>
 * </ul>
 *
 * <p>{@code maxDrawdown} is equity-based and supplied by the loop; all other values
 * are derived from the trades alone.
 */
@Data
@Builder
public class StrategyPerformanceReport {

    private String strategyName;
    private int totalTrades;
    private int winningTrades;
    private int losingTrades;
    private BigDecimal winRate;
    private BigDecimal totalPnl;
    private BigDecimal avgTradePnl;
    private BigDecimal grossProfit;
    private BigDecimal grossLoss;
    private BigDecimal profitFactor;
    private BigDecimal avgWin;
    private BigDecimal avgLoss;
    private BigDecimal largestWin;
    private BigDecimal largestLoss;
    private int maxConsecutiveWins;
    private int maxConsecutiveLosses;
    private BigDecimal maxDrawdown;
    private BigDecimal sharpeRatio;
    private long avgHoldingTimeMinutes;
    private BigDecimal maxFavorableExcursion;
    private BigDecimal maxAdverseExcursion;
    private int estimatedTrades;
    private Map<ExitReason, Integer> exitReasonCounts;
    private List<RegimePerformance> regimePerformance;
    private BigDecimal initialCapital;
    private BigDecimal finalCash;
    private BigDecimal returnPercent;

    public static StrategyPerformanceReport empty(String strategyName) {
        return StrategyPerformanceReport.builder()
                .strategyName(strategyName)
                .totalTrades(0)
                .winRate(BigDecimal.ZERO)
                .totalPnl(BigDecimal.ZERO)
                .avgTradePnl(BigDecimal.ZERO)
                .grossProfit(BigDecimal.ZERO)
                .grossLoss(BigDecimal.ZERO)
                .profitFactor(BigDecimal.ZERO)
                .avgWin(BigDecimal.ZERO)
                .avgLoss(BigDecimal.ZERO)
                .largestWin(BigDecimal.ZERO)
                .largestLoss(BigDecimal.ZERO)
                .maxDrawdown(BigDecimal.ZERO)
                .sharpeRatio(BigDecimal.ZERO)
                .maxFavorableExcursion(BigDecimal.ZERO)
                .maxAdverseExcursion(BigDecimal.ZERO)
                .exitReasonCounts(Map.of())
                .regimePerformance(List.of())
                .returnPercent(BigDecimal.ZERO)
                .build();
    }
}
