package com.optionsbacktester.marketdata;

import com.optionsbacktester.domain.model.Bar;
import com.optionsbacktester.domain.model.Signal;
import java.util.Optional;

/**
 * Upstream strategy logic that turns a bar into an entry signal.
 *
 * <p>Called by the loop only when a new position could be opened. Implementations may
 * keep state across bars but must be deterministic for identical input.
 */
@FunctionalInterface
public interface SignalSource {

    Optional<Signal> nextSignal(Bar bar, int barIndex);
}
