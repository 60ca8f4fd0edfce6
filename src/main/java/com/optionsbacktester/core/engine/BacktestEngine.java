package com.optionsbacktester.core.engine;

import com.optionsbacktester.domain.enums.BacktestStatus;
import com.optionsbacktester.domain.enums.ExitReason;
import com.optionsbacktester.domain.model.Bar;
import com.optionsbacktester.domain.model.ContractSpec;
import com.optionsbacktester.domain.model.OptionQuote;
import com.optionsbacktester.domain.model.Position;
import com.optionsbacktester.domain.model.Signal;
import com.optionsbacktester.domain.model.Trade;
import com.optionsbacktester.exception.MarketDataException;
import com.optionsbacktester.exception.UnrecoverableDataException;
import com.optionsbacktester.marketdata.QuoteProvider;
import com.optionsbacktester.marketdata.SignalSource;
import com.optionsbacktester.reporting.StrategyPerformanceCalculator;
import com.optionsbacktester.strategy.base.StrategyBacktestingAdapter;
import java.time.LocalDateTime;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Replays historical bars through a strategy adapter.
 *
 * <p>Per bar, in order:
 * <ol>
 *   <li>Validate the bar (strictly increasing timestamp, finite positive prices)</li>
 *   <li>Skip it if it falls inside the warm-up window</li>
 *   <li>Fetch quotes for the adapter's contracts plus every open leg; a failed fetch
 *       skips the whole bar</li>
 *   <li>Mark all open positions</li>
 *   <li>Close the positions whose exit rules fire</li>
 *   <li>Ask the signal source for an entry when capacity and spacing allow</li>
 *   <li>Update equity peak and drawdown</li>
 * </ol>
 * Positions still open after the last bar close with {@link ExitReason#END_OF_PERIOD}
 * at their last valuation.
 *
 * <p>Thread safety: the engine itself is stateless; every run owns its own
 * {@link BacktestState} and executes sequentially on the calling thread.
 */
@Slf4j
@Component
public class BacktestEngine {

    private final StrategyPerformanceCalculator performanceCalculator;

    public BacktestEngine(StrategyPerformanceCalculator performanceCalculator) {
        this.performanceCalculator = performanceCalculator;
    }

    /**
     * Runs a backtest to completion.
     *
     * @throws com.optionsbacktester.exception.ConfigurationException if the settings are invalid
     * @throws UnrecoverableDataException if a bar is malformed; carries the partial result
     */
    public BacktestResult run(
            StrategyBacktestingAdapter adapter,
            List<Bar> bars,
            SignalSource signalSource,
            QuoteProvider quoteProvider,
            BacktestSettings settings) {
        settings.validate();
        String runId = settings.getRunId() != null ? settings.getRunId() : UUID.randomUUID().toString();
        BacktestState state = new BacktestState(settings.getInitialCapital());

        log.info(
                "Backtest {} starting: strategy={}, bars={}, capital={}, maxConcurrent={}, quotes={}",
                runId,
                adapter.strategyName(),
                bars.size(),
                settings.getInitialCapital(),
                settings.getMaxConcurrentPositions(),
                quoteProvider.name());

        Bar previous = null;
        for (int index = 0; index < bars.size(); index++) {
            Bar bar = bars.get(index);
            try {
                validateBar(bar, previous, index);
            } catch (UnrecoverableDataException e) {
                BacktestResult partial = buildResult(runId, adapter, state, settings, BacktestStatus.ABORTED, e.getMessage());
                log.error(
                        "Backtest {} aborted at bar {}: {} ({} trades recorded, {} positions left open)",
                        runId,
                        index,
                        e.getMessage(),
                        partial.getTrades().size(),
                        partial.getOpenPositionsAtAbort().size());
                throw e.withPartialResult(partial);
            }
            previous = bar;

            if (index < settings.getWarmupBars()) {
                log.debug("Warm-up bar {} at {}", index, bar.getTimestamp());
                continue;
            }
            processBar(adapter, bar, index, signalSource, quoteProvider, settings, state);
        }

        LocalDateTime endOfPeriod = bars.isEmpty() ? null : bars.get(bars.size() - 1).getTimestamp();
        closeRemaining(adapter, state, endOfPeriod);

        BacktestResult result = buildResult(runId, adapter, state, settings, BacktestStatus.COMPLETED, null);
        log.info(
                "Backtest {} completed: trades={}, finalCash={}, maxDrawdown={}, barsSkipped={}, degraded={}",
                runId,
                result.getTrades().size(),
                result.getFinalCash(),
                result.getMaxDrawdown(),
                result.getBarsSkipped(),
                result.getDegradedValuations());
        return result;
    }

    private void processBar(
            StrategyBacktestingAdapter adapter,
            Bar bar,
            int index,
            SignalSource signalSource,
            QuoteProvider quoteProvider,
            BacktestSettings settings,
            BacktestState state) {
        Set<ContractSpec> contracts = new LinkedHashSet<>(adapter.requiredContracts(bar.getClose(), bar.getTimestamp()));
        state.getOpenPositions().values().forEach(p -> contracts.addAll(p.contracts()));

        List<OptionQuote> quotes;
        try {
            quotes = quoteProvider.fetch(contracts, bar);
        } catch (MarketDataException e) {
            state.recordSkippedBar();
            log.warn("Skipping bar {} at {}: {}", index, bar.getTimestamp(), e.getMessage());
            return;
        }
        state.recordProcessedBar(bar.getTimestamp());

        List<Position> open = state.openPositionsSnapshot();
        for (Position position : open) {
            adapter.updatePosition(position, bar, quotes);
            if (position.isLastMarkEstimated()) {
                state.recordDegradedValuation();
            }
        }

        for (Position position : open) {
            long holdingMinutes = position.holdingDuration(bar.getTimestamp()).toMinutes();
            Optional<ExitReason> reason = adapter.evaluateExit(position, bar, quotes, holdingMinutes);
            if (reason.isPresent()) {
                Trade trade = state.closePosition(position, reason.get(), bar.getTimestamp());
                log.info(
                        "Closed {} at {}: reason={}, pnl={}, held={}m",
                        trade.getPositionId(),
                        trade.getExitTime(),
                        trade.getExitReason(),
                        trade.getRealizedPnl(),
                        trade.getHoldingMinutes());
            }
        }

        if (state.canEnter(index, settings)) {
            Optional<Signal> received = signalSource.nextSignal(bar, index);
            if (received.isPresent()) {
                Signal signal = stampSignal(received.get(), bar);
                state.recordSignal(signal);
                if (adapter.validateSignal(signal)) {
                    adapter.buildPosition(signal, quotes, bar.getClose()).ifPresent(position -> {
                        state.openPosition(position, index);
                        log.info(
                                "Opened {} at {}: entryCost={}, legs={}, cash={}",
                                position.getId(),
                                position.getEntryTime(),
                                position.getEntryCost(),
                                position.getLegs().size(),
                                state.getCash());
                    });
                }
            }
        }

        state.updateEquity();
        log.debug("Bar {} at {}: equity={}, open={}", index, bar.getTimestamp(), state.equity(), state.getOpenPositions().size());
    }

    /**
     * Closes what is still open at the last valuation, timed at the final bar even when
     * the trailing bars were skipped.
     */
    private void closeRemaining(StrategyBacktestingAdapter adapter, BacktestState state, LocalDateTime endOfPeriod) {
        for (Position position : state.openPositionsSnapshot()) {
            LocalDateTime exitTime = endOfPeriod != null ? endOfPeriod : position.getLastMarkedAt();
            Trade trade = state.closePosition(position, ExitReason.END_OF_PERIOD, exitTime);
            log.info(
                    "Closed {} at end of period: pnl={}, estimated={}",
                    trade.getPositionId(),
                    trade.getRealizedPnl(),
                    trade.isEstimated());
        }
        state.updateEquity();
    }

    /** Fills in the bar timestamp and VIX level when the source left them out. */
    private Signal stampSignal(Signal signal, Bar bar) {
        if (signal.getTimestamp() != null && (signal.getVixLevel() != null || bar.getVix() == null)) {
            return signal;
        }
        return signal.toBuilder()
                .timestamp(signal.getTimestamp() != null ? signal.getTimestamp() : bar.getTimestamp())
                .vixLevel(signal.getVixLevel() != null ? signal.getVixLevel() : bar.getVix())
                .build();
    }

    private void validateBar(Bar bar, Bar previous, int index) {
        if (bar == null || bar.getTimestamp() == null) {
            throw new UnrecoverableDataException("Bar " + index + " has no timestamp", Map.of("barIndex", index));
        }
        if (previous != null && !bar.getTimestamp().isAfter(previous.getTimestamp())) {
            throw new UnrecoverableDataException(
                    "Bar timestamps must be strictly increasing",
                    Map.of(
                            "barIndex", index,
                            "timestamp", bar.getTimestamp().toString(),
                            "previous", previous.getTimestamp().toString()));
        }
        if (!bar.hasFinitePositivePrices()) {
            throw new UnrecoverableDataException(
                    "Bar prices must be finite and positive",
                    Map.of("barIndex", index, "timestamp", bar.getTimestamp().toString()));
        }
    }

    private BacktestResult buildResult(
            String runId,
            StrategyBacktestingAdapter adapter,
            BacktestState state,
            BacktestSettings settings,
            BacktestStatus status,
            String failureMessage) {
        List<Trade> trades = List.copyOf(state.getLedger());
        return BacktestResult.builder()
                .id(runId)
                .strategyName(adapter.strategyName())
                .status(status)
                .trades(trades)
                .openPositionsAtAbort(status == BacktestStatus.ABORTED ? state.openPositionsSnapshot() : List.of())
                .initialCapital(settings.getInitialCapital())
                .finalCash(state.getCash())
                .equityPeak(state.getEquityPeak())
                .maxDrawdown(state.getMaxDrawdown())
                .barsProcessed(state.getBarsProcessed())
                .barsSkipped(state.getBarsSkipped())
                .degradedValuations(state.getDegradedValuations())
                .signalsReceived(state.getSignals().size())
                .report(performanceCalculator.calculate(
                        adapter.strategyName(), trades, state.getMaxDrawdown(), settings.getInitialCapital(), state.getCash()))
                .strategyMetrics(adapter.strategyMetrics(trades, state.getSignals()))
                .failureMessage(failureMessage)
                .build();
    }
}
