package com.optionsbacktester.domain.enums;

/**
 * How an option value was obtained. Anything other than ANALYTIC or INTRINSIC is a
 * degraded estimate and must not be treated as equal quality.
 */
public enum PricingMethod {
    /** Closed-form Black-Scholes value. */
    ANALYTIC,
    /** Zero time to expiry, value is the exercise payoff. */
    INTRINSIC,
    /** Intrinsic plus a moneyness-scaled time value approximation. */
    APPROXIMATION;

    public boolean isDegraded() {
        return this == APPROXIMATION;
    }
}
