package com.optionsbacktester.core.valuation;

import com.optionsbacktester.config.PricingConfig;
import com.optionsbacktester.core.processor.OptionPricingEngine;
import com.optionsbacktester.domain.model.ContractSpec;
import com.optionsbacktester.domain.model.Leg;
import com.optionsbacktester.domain.model.OptionPrice;
import java.time.LocalDateTime;

/**
 * Deterministic estimate through the pricing engine's approximation, using the current
 * underlying price, the remaining time to the leg's expiration and the volatility
 * recorded at entry.
 */
public class TheoreticalLegEstimator implements LegValueEstimator {

    private final OptionPricingEngine pricingEngine;
    private final PricingConfig pricingConfig;

    public TheoreticalLegEstimator(OptionPricingEngine pricingEngine, PricingConfig pricingConfig) {
        this.pricingEngine = pricingEngine;
        this.pricingConfig = pricingConfig;
    }

    @Override
    public OptionPrice estimate(Leg leg, double underlyingPrice, LocalDateTime asOf) {
        ContractSpec contract = leg.getContract();
        double timeToExpiry = pricingEngine.timeToExpiryYears(asOf, contract.getExpiration());
        double volatility = leg.getEntryVolatility() > 0 ? leg.getEntryVolatility() : pricingConfig.getDefaultVolatility();
        return pricingEngine.approximate(
                underlyingPrice, contract.getStrike().doubleValue(), timeToExpiry, volatility, contract.getType());
    }
}
