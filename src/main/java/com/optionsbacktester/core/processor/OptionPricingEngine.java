package com.optionsbacktester.core.processor;

import com.optionsbacktester.config.PricingConfig;
import com.optionsbacktester.domain.enums.OptionType;
import com.optionsbacktester.domain.enums.PricingMethod;
import com.optionsbacktester.domain.model.Greeks;
import com.optionsbacktester.domain.model.OptionPrice;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.distribution.NormalDistribution;
import org.springframework.stereotype.Component;

/**
 * Black-Scholes-Merton pricing and Greeks for European options.
 *
 * <p>Key formulas:
 * <ul>
 *   <li>d1 = [ln(S/K) + (r - q + sigma^2/2) * T] / (sigma * sqrt(T))
 *   <li>d2 = d1 - sigma * sqrt(T)
 *   <li>Call: S * e^(-qT) * N(d1) - K * e^(-rT) * N(d2)
 *   <li>Put: K * e^(-rT) * N(-d2) - S * e^(-qT) * N(-d1)
 * </ul>
 *
 * <p>Input handling:
 * <ul>
 *   <li>T == 0 collapses to intrinsic value
 *   <li>Negative or non-finite T and sigma are clamped to a small positive epsilon,
 *       never rejected, so a replay cannot stall on one bad input
 *   <li>Every returned value is at least {@link #MIN_PRICE}
 * </ul>
 *
 * <p>When the closed form cannot be evaluated (non-finite d1 or result), the engine
 * falls back to {@link #approximate}, logs a degraded-pricing warning and tags the
 * result {@link PricingMethod#APPROXIMATION}.
 */
@Slf4j
@Component
public class OptionPricingEngine {

    public static final double MIN_PRICE = 0.01;

    // One minute expressed in years (365 * 24 * 60 minutes)
    static final double MINUTES_PER_YEAR = 525600.0;
    static final double MIN_T_YEARS = 1.0 / MINUTES_PER_YEAR;

    static final double MIN_VOLATILITY = 0.0001;

    // Time value scaling used by the approximation
    private static final double APPROXIMATION_SCALE = 0.4;

    // Reusable standard normal distribution (thread-safe in commons-math3)
    private static final NormalDistribution NORM = new NormalDistribution();

    private final PricingConfig pricingConfig;

    public OptionPricingEngine(PricingConfig pricingConfig) {
        this.pricingConfig = pricingConfig;
    }

    /**
     * Prices an option with no dividend yield.
     *
     * @param underlying        underlying price
     * @param strike            strike price
     * @param timeToExpiryYears time to expiry in years; 0 means expiring now
     * @param volatility        annualised volatility as a decimal
     * @param rate              continuously compounded risk-free rate
     * @param type              CALL or PUT
     * @return value of at least 0.01 and the method that produced it
     */
    public OptionPrice price(
            double underlying,
            double strike,
            double timeToExpiryYears,
            double volatility,
            double rate,
            OptionType type) {
        return price(underlying, strike, timeToExpiryYears, volatility, rate, 0.0, type);
    }

    public OptionPrice price(
            double underlying,
            double strike,
            double timeToExpiryYears,
            double volatility,
            double rate,
            double dividendYield,
            OptionType type) {

        if (timeToExpiryYears == 0.0) {
            return new OptionPrice(floor(intrinsic(underlying, strike, type)), PricingMethod.INTRINSIC);
        }

        double t = clampPositive(timeToExpiryYears, MIN_T_YEARS);
        double sigma = clampPositive(volatility, MIN_VOLATILITY);

        double value = analyticPrice(underlying, strike, t, rate, dividendYield, sigma, type);
        if (!Double.isFinite(value)) {
            log.warn(
                    "Analytic pricing unavailable for {} S={} K={} T={} sigma={}, using degraded approximation",
                    type,
                    underlying,
                    strike,
                    t,
                    sigma);
            return approximate(underlying, strike, t, sigma, type);
        }
        return new OptionPrice(floor(value), PricingMethod.ANALYTIC);
    }

    /** Prices with the configured rate and dividend yield. */
    public OptionPrice price(double underlying, double strike, double timeToExpiryYears, double volatility, OptionType type) {
        return price(
                underlying,
                strike,
                timeToExpiryYears,
                volatility,
                pricingConfig.getRiskFreeRate(),
                pricingConfig.getDividendYield(),
                type);
    }

    /**
     * Degraded estimate: intrinsic value plus a time value of
     * {@code S * sigma * sqrt(T) * factor * 0.4}, where factor is the moneyness S/K for
     * calls and 2 - S/K for puts, each clamped to [0.1, 1.0]. Always tagged
     * {@link PricingMethod#APPROXIMATION}.
     */
    public OptionPrice approximate(
            double underlying, double strike, double timeToExpiryYears, double volatility, OptionType type) {
        double t = timeToExpiryYears == 0.0 ? 0.0 : clampPositive(timeToExpiryYears, MIN_T_YEARS);
        double sigma = clampPositive(volatility, MIN_VOLATILITY);

        double moneyness = underlying / strike;
        double factor = type.isCall() ? clamp(moneyness, 0.1, 1.0) : clamp(2.0 - moneyness, 0.1, 1.0);
        double timeValue = underlying * sigma * Math.sqrt(t) * factor * APPROXIMATION_SCALE;
        double value = intrinsic(underlying, strike, type) + timeValue;

        if (!Double.isFinite(value)) {
            log.warn("Approximation not finite for {} S={} K={}, using minimum price", type, underlying, strike);
            return new OptionPrice(MIN_PRICE, PricingMethod.APPROXIMATION);
        }
        return new OptionPrice(floor(value), PricingMethod.APPROXIMATION);
    }

    /**
     * Analytic Greeks of the same formula. At T == 0 delta is the exercise indicator
     * and every other sensitivity is zero.
     *
     * @throws IllegalStateException if a result breaks delta in [-1, 1] or gamma, vega >= 0
     */
    public Greeks greeks(
            double underlying,
            double strike,
            double timeToExpiryYears,
            double volatility,
            double rate,
            double dividendYield,
            OptionType type) {

        if (timeToExpiryYears == 0.0) {
            double delta = 0.0;
            if (type.isCall() && underlying > strike) {
                delta = 1.0;
            } else if (!type.isCall() && underlying < strike) {
                delta = -1.0;
            }
            return verified(delta, 0.0, 0.0, 0.0, 0.0);
        }

        double t = clampPositive(timeToExpiryYears, MIN_T_YEARS);
        double sigma = clampPositive(volatility, MIN_VOLATILITY);
        double q = dividendYield;
        double r = rate;

        double sqrtT = Math.sqrt(t);
        double d1 = (Math.log(underlying / strike) + (r - q + sigma * sigma / 2.0) * t) / (sigma * sqrtT);
        double d2 = d1 - sigma * sqrtT;

        double nd1 = NORM.density(d1);
        double expQT = Math.exp(-q * t);
        double expRT = Math.exp(-r * t);

        double delta;
        double theta;
        double rho;
        if (type.isCall()) {
            delta = expQT * NORM.cumulativeProbability(d1);
            theta = (-underlying * expQT * nd1 * sigma / (2.0 * sqrtT)
                            + q * underlying * expQT * NORM.cumulativeProbability(d1)
                            - r * strike * expRT * NORM.cumulativeProbability(d2))
                    / 365.0;
            rho = strike * t * expRT * NORM.cumulativeProbability(d2) / 100.0;
        } else {
            delta = expQT * (NORM.cumulativeProbability(d1) - 1.0);
            theta = (-underlying * expQT * nd1 * sigma / (2.0 * sqrtT)
                            - q * underlying * expQT * NORM.cumulativeProbability(-d1)
                            + r * strike * expRT * NORM.cumulativeProbability(-d2))
                    / 365.0;
            rho = -strike * t * expRT * NORM.cumulativeProbability(-d2) / 100.0;
        }

        double gamma = expQT * nd1 / (underlying * sigma * sqrtT);
        double vega = underlying * expQT * nd1 * sqrtT / 100.0;

        return verified(delta, gamma, theta, vega, rho);
    }

    public Greeks greeks(double underlying, double strike, double timeToExpiryYears, double volatility, OptionType type) {
        return greeks(
                underlying,
                strike,
                timeToExpiryYears,
                volatility,
                pricingConfig.getRiskFreeRate(),
                pricingConfig.getDividendYield(),
                type);
    }

    /**
     * Years between {@code from} and the expiry close on {@code expiration}. Never negative:
     * an expired contract returns 0.
     */
    public double timeToExpiryYears(LocalDateTime from, LocalDate expiration) {
        LocalDateTime expiryClose = expiration.atTime(pricingConfig.getExpiryCloseTime());
        long minutes = ChronoUnit.MINUTES.between(from, expiryClose);
        return Math.max(minutes, 0) / MINUTES_PER_YEAR;
    }

    /** Raw closed-form value; NaN when d1 is not finite. */
    double analyticPrice(double S, double K, double T, double r, double q, double sigma, OptionType type) {
        double sqrtT = Math.sqrt(T);
        double d1 = (Math.log(S / K) + (r - q + sigma * sigma / 2.0) * T) / (sigma * sqrtT);
        if (!Double.isFinite(d1)) {
            return Double.NaN;
        }
        double d2 = d1 - sigma * sqrtT;

        if (type.isCall()) {
            return S * Math.exp(-q * T) * NORM.cumulativeProbability(d1)
                    - K * Math.exp(-r * T) * NORM.cumulativeProbability(d2);
        }
        return K * Math.exp(-r * T) * NORM.cumulativeProbability(-d2)
                - S * Math.exp(-q * T) * NORM.cumulativeProbability(-d1);
    }

    static double intrinsic(double underlying, double strike, OptionType type) {
        return type.isCall() ? Math.max(0.0, underlying - strike) : Math.max(0.0, strike - underlying);
    }

    private static Greeks verified(double delta, double gamma, double theta, double vega, double rho) {
        if (!(delta >= -1.0 && delta <= 1.0) || !(gamma >= 0.0) || !(vega >= 0.0)) {
            throw new IllegalStateException(String.format(
                    "Greeks out of bounds: delta=%s gamma=%s vega=%s", delta, gamma, vega));
        }
        return Greeks.builder()
                .delta(BigDecimal.valueOf(delta).setScale(4, RoundingMode.HALF_UP))
                .gamma(BigDecimal.valueOf(gamma).setScale(6, RoundingMode.HALF_UP))
                .theta(BigDecimal.valueOf(theta).setScale(4, RoundingMode.HALF_UP))
                .vega(BigDecimal.valueOf(vega).setScale(4, RoundingMode.HALF_UP))
                .rho(BigDecimal.valueOf(rho).setScale(4, RoundingMode.HALF_UP))
                .build();
    }

    private static double clampPositive(double value, double epsilon) {
        if (!Double.isFinite(value) || value < epsilon) {
            return epsilon;
        }
        return value;
    }

    private static double clamp(double value, double min, double max) {
        if (Double.isNaN(value)) {
            return max;
        }
        return Math.max(min, Math.min(max, value));
    }

    private static double floor(double value) {
        return Math.max(MIN_PRICE, value);
    }
}
