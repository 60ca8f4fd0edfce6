package com.optionsbacktester.marketdata;

import com.optionsbacktester.domain.model.Bar;
import com.optionsbacktester.domain.model.Signal;
import java.time.LocalDateTime;
import java.util.Collection;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Replays precomputed signals, each delivered on the bar whose timestamp equals the
 * signal's. A signal for a bar on which the loop does not ask (no capacity, spacing)
 * is never delivered. Later signals for the same timestamp replace earlier ones.
 */
public class ScheduledSignalSource implements SignalSource {

    private final Map<LocalDateTime, Signal> byTimestamp = new HashMap<>();

    public ScheduledSignalSource(Collection<Signal> signals) {
        signals.forEach(s -> byTimestamp.put(s.getTimestamp(), s));
    }

    @Override
    public Optional<Signal> nextSignal(Bar bar, int barIndex) {
        return Optional.ofNullable(byTimestamp.get(bar.getTimestamp()));
    }

    public int size() {
        return byTimestamp.size();
    }
}
