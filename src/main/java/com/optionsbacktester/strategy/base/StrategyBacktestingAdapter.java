package com.optionsbacktester.strategy.base;

import com.optionsbacktester.domain.enums.ExitReason;
import com.optionsbacktester.domain.enums.StrategyType;
import com.optionsbacktester.domain.model.Bar;
import com.optionsbacktester.domain.model.ContractSpec;
import com.optionsbacktester.domain.model.OptionQuote;
import com.optionsbacktester.domain.model.Position;
import com.optionsbacktester.domain.model.Signal;
import com.optionsbacktester.domain.model.Trade;
import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Strategy-specific knowledge the backtest loop needs, behind one contract so that the
 * loop never depends on a concrete strategy.
 *
 * <p>An adapter decides which contracts to request for a bar, how to turn an accepted
 * signal into a position, how to mark that position and when to close it, and which
 * metrics describe the finished ledger.
 */
public interface StrategyBacktestingAdapter {

    // ---- Identity ----

    String strategyName();

    StrategyType strategyType();

    // ---- Contract selection ----

    /** Contracts the strategy needs from the quote universe at this bar. */
    Set<ContractSpec> requiredContracts(double underlyingPrice, LocalDateTime time);

    // ---- Position lifecycle ----

    /** True when the signal is an entry this strategy accepts. */
    boolean validateSignal(Signal signal);

    /**
     * Builds a position from an accepted signal. Empty when any required leg has no quote
     * in {@code availableQuotes}: a position is never opened on partial legs.
     */
    Optional<Position> buildPosition(Signal signal, Collection<OptionQuote> availableQuotes, double underlyingPrice);

    /** Re-marks the position at this bar and returns it. */
    Position updatePosition(Position position, Bar bar, Collection<OptionQuote> quotes);

    /** The exit trigger that fires for this position at this bar, if any. */
    Optional<ExitReason> evaluateExit(
            Position position, Bar bar, Collection<OptionQuote> quotes, long holdingMinutes);

    default boolean shouldExit(Position position, Bar bar, Collection<OptionQuote> quotes, long holdingMinutes) {
        return evaluateExit(position, bar, quotes, holdingMinutes).isPresent();
    }

    // ---- Metrics ----

    StrategyMetrics strategyMetrics(List<Trade> trades, List<Signal> signals);
}
