package com.optionsbacktester.core.engine;

import com.optionsbacktester.domain.enums.BacktestStatus;
import com.optionsbacktester.domain.model.Position;
import com.optionsbacktester.domain.model.Trade;
import com.optionsbacktester.reporting.StrategyPerformanceReport;
import com.optionsbacktester.strategy.base.StrategyMetrics;
import java.math.BigDecimal;
import java.util.List;
import lombok.Builder;
import lombok.Value;

/**
 * Outcome of one backtest run: the trade ledger plus the summary and strategy metrics
 * derived from it.
 *
 * <p>An ABORTED result holds the ledger accumulated before the malformed bar, and the
 * positions that were still open at that point (left open, never force-closed).
 */
@Value
@Builder
public class BacktestResult {

    String id;
    String strategyName;
    BacktestStatus status;

    List<Trade> trades;
    List<Position> openPositionsAtAbort;

    BigDecimal initialCapital;
    BigDecimal finalCash;
    BigDecimal equityPeak;
    BigDecimal maxDrawdown;

    int barsProcessed;
    int barsSkipped;
    int degradedValuations;
    int signalsReceived;

    StrategyPerformanceReport report;
    StrategyMetrics strategyMetrics;

    /** Reason the run aborted; null for completed runs. */
    String failureMessage;

    public boolean isCompleted() {
        return status == BacktestStatus.COMPLETED;
    }
}
