package com.optionsbacktester.core.valuation;

import java.math.BigDecimal;
import lombok.Value;

/** Result of marking a position: total value and how many legs had to be estimated. */
@Value
public class Valuation {

    BigDecimal currentValue;
    int estimatedLegs;

    public boolean isEstimated() {
        return estimatedLegs > 0;
    }
}
