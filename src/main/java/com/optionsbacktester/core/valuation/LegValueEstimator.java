package com.optionsbacktester.core.valuation;

import com.optionsbacktester.domain.model.Leg;
import com.optionsbacktester.domain.model.OptionPrice;
import java.time.LocalDateTime;

/**
 * Estimates the per-share value of a leg whose quote is missing at a bar.
 */
public interface LegValueEstimator {

    OptionPrice estimate(Leg leg, double underlyingPrice, LocalDateTime asOf);
}
