package com.optionsbacktester.api.dto.response;

import com.optionsbacktester.core.engine.BacktestResult;
import com.optionsbacktester.domain.enums.BacktestStatus;
import com.optionsbacktester.reporting.StrategyPerformanceReport;
import com.optionsbacktester.strategy.base.StrategyMetrics;
import java.math.BigDecimal;
import lombok.Builder;
import lombok.Data;

/**
 * Response DTO for a backtest run: status, counts, summary report and strategy
 * metrics. The ledger itself is served by the trades endpoints.
 */
@Data
@Builder
public class BacktestResponse {

    private String id;
    private String strategyName;
    private BacktestStatus status;
    private BigDecimal initialCapital;
    private BigDecimal finalCash;
    private BigDecimal equityPeak;
    private BigDecimal maxDrawdown;
    private int totalTrades;
    private int openPositionsAtAbort;
    private int barsProcessed;
    private int barsSkipped;
    private int degradedValuations;
    private int signalsReceived;
    private StrategyPerformanceReport summary;
    private StrategyMetrics strategyMetrics;
    private String failureMessage;

    public static BacktestResponse from(BacktestResult result) {
        return BacktestResponse.builder()
                .id(result.getId())
                .strategyName(result.getStrategyName())
                .status(result.getStatus())
                .initialCapital(result.getInitialCapital())
                .finalCash(result.getFinalCash())
                .equityPeak(result.getEquityPeak())
                .maxDrawdown(result.getMaxDrawdown())
                .totalTrades(result.getTrades().size())
                .openPositionsAtAbort(result.getOpenPositionsAtAbort().size())
                .barsProcessed(result.getBarsProcessed())
                .barsSkipped(result.getBarsSkipped())
                .degradedValuations(result.getDegradedValuations())
                .signalsReceived(result.getSignalsReceived())
                .summary(result.getReport())
                .strategyMetrics(result.getStrategyMetrics())
                .failureMessage(result.getFailureMessage())
                .build();
    }
}
