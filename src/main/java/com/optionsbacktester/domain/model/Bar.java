package com.optionsbacktester.domain.model;

import java.time.LocalDateTime;
import lombok.Builder;
import lombok.Value;

/**
 * One historical OHLCV bar of the underlying. Prices are kept as doubles so that a
 * corrupt feed (NaN, infinity) can be detected rather than failing on parse.
 *
 * <p>{@code vix} is the volatility-index level observed at the bar, when known.
 */
@Value
@Builder
public class Bar {

    LocalDateTime timestamp;
    double open;
    double high;
    double low;
    double close;
    long volume;
    Double vix;

    public boolean hasFinitePositivePrices() {
        return isFinitePositive(open) && isFinitePositive(high) && isFinitePositive(low) && isFinitePositive(close);
    }

    private static boolean isFinitePositive(double value) {
        return Double.isFinite(value) && value > 0;
    }
}
