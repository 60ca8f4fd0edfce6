package com.optionsbacktester.core.valuation;

import com.optionsbacktester.config.PricingConfig;
import com.optionsbacktester.domain.model.ContractSpec;
import com.optionsbacktester.domain.model.Leg;
import com.optionsbacktester.domain.model.OptionPrice;
import com.optionsbacktester.domain.model.OptionQuote;
import com.optionsbacktester.domain.model.Position;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.Collection;
import java.util.Comparator;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;

/**
 * Marks positions to market from a bar's quote universe.
 *
 * <p>For each leg the matching quote is the one with the same type and strike whose
 * expiration lies within the configured tolerance (closest expiration first). Its
 * mark price is last when positive, otherwise mid. Leg value is
 * {@code price x quantity x multiplier x sign}.
 *
 * <p>A leg without a quote does not abort the mark: its value comes from the
 * {@link LegValueEstimator} and the position is flagged as estimated. A leg marked
 * from an estimated quote counts as estimated too.
 *
 * <p>Created per backtest run together with its estimator, so a seeded simulation
 * estimator starts from the same seed on every run.
 */
@Slf4j
public class PositionValuator {

    private final LegValueEstimator legValueEstimator;
    private final PricingConfig pricingConfig;

    public PositionValuator(LegValueEstimator legValueEstimator, PricingConfig pricingConfig) {
        this.legValueEstimator = legValueEstimator;
        this.pricingConfig = pricingConfig;
    }

    /**
     * Computes the current value of every leg without mutating the position.
     */
    public Valuation markToMarket(
            Position position, Collection<OptionQuote> quotes, double underlyingPrice, LocalDateTime asOf) {
        BigDecimal total = BigDecimal.ZERO;
        int estimatedLegs = 0;

        for (Leg leg : position.getLegs()) {
            Optional<OptionQuote> quote = findQuote(leg.getContract(), quotes);
            BigDecimal price;
            if (quote.isPresent()) {
                price = quote.get().markPrice();
                if (quote.get().isEstimated()) {
                    estimatedLegs++;
                }
            } else {
                OptionPrice estimate = legValueEstimator.estimate(leg, underlyingPrice, asOf);
                price = estimate.toBigDecimal(4);
                estimatedLegs++;
                log.warn(
                        "No quote for leg {} of position {} at {}, estimated at {} ({})",
                        leg.getContract(),
                        position.getId(),
                        asOf,
                        price,
                        estimate.getMethod());
            }
            total = total.add(leg.valueAt(price, position.getContractMultiplier()));
        }

        return new Valuation(total, estimatedLegs);
    }

    /** Marks the position and applies the result to it. */
    public Valuation mark(Position position, Collection<OptionQuote> quotes, double underlyingPrice, LocalDateTime asOf) {
        Valuation valuation = markToMarket(position, quotes, underlyingPrice, asOf);
        position.applyMark(valuation.getCurrentValue(), valuation.isEstimated(), asOf);
        log.debug(
                "Marked {}: value={} pnl={} estimatedLegs={}",
                position.getId(),
                position.getCurrentValue(),
                position.getUnrealizedPnl(),
                valuation.getEstimatedLegs());
        return valuation;
    }

    public Optional<OptionQuote> findQuote(ContractSpec contract, Collection<OptionQuote> quotes) {
        int tolerance = pricingConfig.getExpirationToleranceDays();
        return quotes.stream()
                .filter(q -> contract.matches(q, tolerance))
                .min(Comparator.comparingLong(
                        q -> Math.abs(ChronoUnit.DAYS.between(contract.getExpiration(), q.getExpiration()))));
    }
}
