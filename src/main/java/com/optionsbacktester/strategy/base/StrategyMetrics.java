package com.optionsbacktester.strategy.base;

import com.optionsbacktester.reporting.RegimePerformance;
import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.Data;

/**
 * Metrics an adapter derives from a completed ledger and the signals it received.
 *
 * <p>Every adapter reports the regime table and signal efficiency (profitable trades
 * over qualifying signals, as a percentage). Family-specific values go into
 * {@link #strategySpecific} under stable names.
 */
@Data
@Builder
public class StrategyMetrics {

    private String strategyName;
    private int totalTrades;
    private int winningTrades;
    private int losingTrades;
    private BigDecimal winRate;
    private BigDecimal totalPnl;
    private BigDecimal avgTradePnl;

    private List<RegimePerformance> regimePerformance;

    private int qualifyingSignals;
    private int profitableTrades;
    private BigDecimal signalEfficiency;

    @Builder.Default
    private Map<String, BigDecimal> strategySpecific = new LinkedHashMap<>();
}
