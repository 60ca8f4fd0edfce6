package com.optionsbacktester.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Opt-in randomised valuation of legs that have no quote.
 *
 * <p>Binds to {@code backtester.simulation.*}. Disabled by default: the standard path
 * is fully deterministic. When enabled, every run with the same seed produces the same
 * ledger, but the estimated legs no longer reflect any observed market.
 */
@Configuration
@ConfigurationProperties(prefix = "backtester.simulation")
@Getter
@Setter
public class SimulationConfig {

    private boolean enabled = false;

    private long seed = 42L;

    /** Maximum relative perturbation applied to the estimated time value (0.25 = +/-25%). */
    private double timeValueNoise = 0.25;
}
