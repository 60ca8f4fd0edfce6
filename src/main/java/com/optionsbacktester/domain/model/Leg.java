package com.optionsbacktester.domain.model;

import com.optionsbacktester.domain.enums.LegSide;
import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/**
 * One option contract inside a position.
 *
 * <p>{@code quantity} is always positive; direction lives in {@link #side}.
 * {@code entryVolatility} is the implied volatility at entry, kept so that a leg whose
 * quote later disappears can still be valued.
 */
@Value
@Builder
public class Leg {

    ContractSpec contract;
    LegSide side;
    int quantity;
    BigDecimal entryPrice;
    double entryVolatility;

    /** Signed premium per share at entry: positive for debits, negative for credits. */
    public BigDecimal signedEntryPremium() {
        return entryPrice.multiply(BigDecimal.valueOf((long) quantity * side.sign()));
    }

    /** price x quantity x multiplier x (+1 long / -1 short). */
    public BigDecimal valueAt(BigDecimal price, int contractMultiplier) {
        return price.multiply(BigDecimal.valueOf((long) quantity * contractMultiplier * side.sign()));
    }
}
