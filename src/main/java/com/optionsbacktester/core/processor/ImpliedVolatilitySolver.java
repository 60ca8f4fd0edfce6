package com.optionsbacktester.core.processor;

import com.optionsbacktester.domain.enums.OptionType;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.distribution.NormalDistribution;
import org.springframework.stereotype.Component;

/**
 * Recovers implied volatility from an observed option price.
 *
 * <p>Newton-Raphson on vega first (a handful of iterations near the money), then
 * bisection over [0.001, 5.0] when vega vanishes deep in or out of the money.
 * Results outside [1%, 200%] are clamped with a warning. Prices that no volatility
 * can reproduce return {@link #UNSOLVABLE}.
 *
 * <p>Used at position entry when a quote carries no implied volatility, so that a
 * leg can still be estimated if its quote disappears later.
 */
@Slf4j
@Component
public class ImpliedVolatilitySolver {

    private static final double NR_INITIAL_GUESS = 0.25;
    private static final double TOLERANCE = 0.0001;
    private static final int NR_MAX_ITERATIONS = 100;

    private static final double BISECTION_LOWER = 0.001;
    private static final double BISECTION_UPPER = 5.0;
    private static final int BISECTION_MAX_ITERATIONS = 200;

    /** Returned by {@link #solve} when no volatility reproduces the price. */
    public static final double UNSOLVABLE = -1.0;

    static final double IV_MIN = 0.01;
    static final double IV_MAX = 2.0;

    private static final NormalDistribution NORM = new NormalDistribution();

    private final OptionPricingEngine pricingEngine;

    public ImpliedVolatilitySolver(OptionPricingEngine pricingEngine) {
        this.pricingEngine = pricingEngine;
    }

    /**
     * @return implied volatility as a decimal, or {@link #UNSOLVABLE}
     */
    public double solve(double S, double K, double T, double r, double q, double price, OptionType type) {
        if (!(price > 0) || !(S > 0) || !(K > 0) || !(T > 0)) {
            return UNSOLVABLE;
        }

        Double newton = tryNewtonRaphson(S, K, T, r, q, price, type);
        double iv;
        if (newton != null) {
            iv = newton;
        } else {
            log.debug("Newton-Raphson did not converge for {} S={} K={} T={} price={}, trying bisection",
                    type, S, K, T, price);
            iv = bisect(S, K, T, r, q, price, type);
        }

        if (iv < 0) {
            return UNSOLVABLE;
        }
        return clampToSaneRange(iv);
    }

    /**
     * Solves with a fallback: when the price cannot be inverted, {@code fallback} is
     * returned instead of the sentinel.
     */
    public double solveOrDefault(double S, double K, double T, double r, double q, double price, OptionType type,
            double fallback) {
        double iv = solve(S, K, T, r, q, price, type);
        return iv < 0 ? fallback : iv;
    }

    double clampToSaneRange(double iv) {
        if (iv < IV_MIN || iv > IV_MAX) {
            log.warn("Suspect implied volatility {}%, clamping to [{}%, {}%]", iv * 100, IV_MIN * 100, IV_MAX * 100);
            return Math.max(IV_MIN, Math.min(iv, IV_MAX));
        }
        return iv;
    }

    private Double tryNewtonRaphson(double S, double K, double T, double r, double q, double price, OptionType type) {
        double sigma = NR_INITIAL_GUESS;
        double sqrtT = Math.sqrt(T);

        for (int i = 0; i < NR_MAX_ITERATIONS; i++) {
            double diff = pricingEngine.analyticPrice(S, K, T, r, q, sigma, type) - price;
            if (Math.abs(diff) < TOLERANCE) {
                return sigma;
            }

            double d1 = (Math.log(S / K) + (r - q + sigma * sigma / 2.0) * T) / (sigma * sqrtT);
            double vega = S * Math.exp(-q * T) * NORM.density(d1) * sqrtT;
            if (!Double.isFinite(diff) || Math.abs(vega) < 1e-10) {
                return null;
            }

            sigma = Math.max(BISECTION_LOWER, Math.min(BISECTION_UPPER, sigma - diff / vega));
        }
        return null;
    }

    private double bisect(double S, double K, double T, double r, double q, double price, OptionType type) {
        double lower = BISECTION_LOWER;
        double upper = BISECTION_UPPER;

        double lowerPrice = pricingEngine.analyticPrice(S, K, T, r, q, lower, type);
        double upperPrice = pricingEngine.analyticPrice(S, K, T, r, q, upper, type);
        if (price < lowerPrice || price > upperPrice) {
            log.debug("Price {} outside achievable range [{}, {}]", price, lowerPrice, upperPrice);
            return UNSOLVABLE;
        }

        for (int i = 0; i < BISECTION_MAX_ITERATIONS; i++) {
            double mid = (lower + upper) / 2.0;
            double midPrice = pricingEngine.analyticPrice(S, K, T, r, q, mid, type);
            if (Math.abs(midPrice - price) < TOLERANCE) {
                return mid;
            }
            if (midPrice > price) {
                upper = mid;
            } else {
                lower = mid;
            }
        }
        return (lower + upper) / 2.0;
    }
}
