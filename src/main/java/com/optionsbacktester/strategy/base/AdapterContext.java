package com.optionsbacktester.strategy.base;

import com.optionsbacktester.config.PricingConfig;
import com.optionsbacktester.core.processor.ImpliedVolatilitySolver;
import com.optionsbacktester.core.processor.OptionPricingEngine;
import com.optionsbacktester.core.valuation.PositionValuator;
import lombok.Builder;
import lombok.Getter;

/**
 * Services shared by adapter instances.
 *
 * <p>Adapters are plain Java objects created per run by
 * {@link com.optionsbacktester.strategy.StrategyAdapterFactory}, not Spring beans, so
 * the factory hands them this bundle at construction.
 */
@Getter
@Builder
public class AdapterContext {

    private final OptionPricingEngine pricingEngine;
    private final ImpliedVolatilitySolver volatilitySolver;
    private final PositionValuator positionValuator;
    private final PricingConfig pricingConfig;
}
