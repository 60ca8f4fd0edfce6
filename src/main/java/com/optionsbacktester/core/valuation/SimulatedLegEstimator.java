package com.optionsbacktester.core.valuation;

import com.optionsbacktester.core.processor.OptionPricingEngine;
import com.optionsbacktester.domain.enums.PricingMethod;
import com.optionsbacktester.domain.model.ContractSpec;
import com.optionsbacktester.domain.model.Leg;
import com.optionsbacktester.domain.model.OptionPrice;
import java.time.LocalDateTime;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.random.RandomDataGenerator;
import org.apache.commons.math3.random.Well19937c;

/**
 * Simulation-mode estimator: the deterministic estimate with its time value scaled by a
 * uniform random factor in [1 - noise, 1 + noise].
 *
 * <p>Seeded, so two runs built with the same seed see the same sequence of draws.
 * Only wired when {@code backtester.simulation.enabled=true}.
 */
@Slf4j
public class SimulatedLegEstimator implements LegValueEstimator {

    private final LegValueEstimator baseEstimator;
    private final double noise;
    private final RandomDataGenerator random;

    public SimulatedLegEstimator(LegValueEstimator baseEstimator, long seed, double noise) {
        this.baseEstimator = baseEstimator;
        this.noise = Math.max(0.0, noise);
        this.random = new RandomDataGenerator(new Well19937c(seed));
        log.warn("Simulation mode active: missing legs are valued with seeded random noise (seed={})", seed);
    }

    @Override
    public OptionPrice estimate(Leg leg, double underlyingPrice, LocalDateTime asOf) {
        OptionPrice base = baseEstimator.estimate(leg, underlyingPrice, asOf);
        ContractSpec contract = leg.getContract();
        double strike = contract.getStrike().doubleValue();
        double intrinsic = contract.getType().isCall()
                ? Math.max(0.0, underlyingPrice - strike)
                : Math.max(0.0, strike - underlyingPrice);
        double timeValue = Math.max(0.0, base.getValue() - intrinsic);

        double factor = noise > 0 ? random.nextUniform(1.0 - noise, 1.0 + noise) : 1.0;
        double value = Math.max(OptionPricingEngine.MIN_PRICE, intrinsic + timeValue * factor);
        return new OptionPrice(value, PricingMethod.APPROXIMATION);
    }
}
