package com.optionsbacktester.config;

import java.time.LocalTime;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Pricing and quote-matching parameters.
 *
 * <p>Binds to the {@code backtester.pricing.*} prefix in application.properties.
 */
@Configuration
@ConfigurationProperties(prefix = "backtester.pricing")
@Getter
@Setter
public class PricingConfig {

    /** Continuously compounded risk-free rate as a decimal. */
    private double riskFreeRate = 0.05;

    /** Continuous dividend yield as a decimal. Zero for cash-settled index options. */
    private double dividendYield = 0.0;

    /** Volatility used when neither a quote nor the bar carries one. */
    private double defaultVolatility = 0.20;

    /** Time of day at which contracts expire on their expiration date. */
    private LocalTime expiryCloseTime = LocalTime.of(16, 0);

    /** Half-width of the synthetic bid/ask spread around theoretical prices. */
    private double quoteHalfSpread = 0.05;

    /** Maximum expiration mismatch, in days, when matching a leg to a quote. */
    private int expirationToleranceDays = 1;
}
