package com.optionsbacktester.domain.model;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/**
 * Analytic Black-Scholes sensitivities.
 *
 * <p>Units: theta per calendar day, vega per one volatility point (1%), rho per one
 * rate point (1%).
 */
@Value
@Builder
public class Greeks {

    /** Range -1 (deep ITM put) to +1 (deep ITM call). */
    BigDecimal delta;

    /** Non-negative, highest near the money. */
    BigDecimal gamma;

    BigDecimal theta;

    /** Non-negative. */
    BigDecimal vega;

    BigDecimal rho;

    public static Greeks zero() {
        return Greeks.builder()
                .delta(BigDecimal.ZERO)
                .gamma(BigDecimal.ZERO)
                .theta(BigDecimal.ZERO)
                .vega(BigDecimal.ZERO)
                .rho(BigDecimal.ZERO)
                .build();
    }
}
