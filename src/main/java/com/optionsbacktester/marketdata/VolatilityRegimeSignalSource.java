package com.optionsbacktester.marketdata;

import com.optionsbacktester.domain.enums.SignalAction;
import com.optionsbacktester.domain.model.Bar;
import com.optionsbacktester.domain.model.Signal;
import java.util.Optional;

/**
 * Reference signal source keyed on the bar's volatility index.
 *
 * <p>Emits ENTER on every bar; confidence is high inside the optimal range (15 to 30
 * inclusive) and low outside it, so adapters with a confidence floor only trade the
 * optimal regimes. Bars without a VIX reading produce a HOLD.
 */
public class VolatilityRegimeSignalSource implements SignalSource {

    static final double OPTIMAL_LOW = 15.0;
    static final double OPTIMAL_HIGH = 30.0;
    static final int IN_RANGE_CONFIDENCE = 90;
    static final int OUT_OF_RANGE_CONFIDENCE = 50;

    @Override
    public Optional<Signal> nextSignal(Bar bar, int barIndex) {
        Double vix = bar.getVix();
        if (vix == null || !Double.isFinite(vix)) {
            return Optional.of(Signal.builder()
                    .action(SignalAction.HOLD)
                    .timestamp(bar.getTimestamp())
                    .build());
        }
        boolean optimal = vix >= OPTIMAL_LOW && vix <= OPTIMAL_HIGH;
        return Optional.of(Signal.builder()
                .action(SignalAction.ENTER)
                .confidence(optimal ? IN_RANGE_CONFIDENCE : OUT_OF_RANGE_CONFIDENCE)
                .timestamp(bar.getTimestamp())
                .vixLevel(vix)
                .build());
    }
}
