package com.optionsbacktester.marketdata;

import com.optionsbacktester.config.PricingConfig;
import com.optionsbacktester.core.processor.OptionPricingEngine;
import com.optionsbacktester.domain.model.Bar;
import com.optionsbacktester.domain.model.ContractSpec;
import com.optionsbacktester.domain.model.OptionPrice;
import com.optionsbacktester.domain.model.OptionQuote;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;

/**
 * Synthesizes quotes from the pricing engine when no recorded chain exists.
 *
 * <p>Every requested contract gets a quote priced at the bar close with volatility
 * {@code bar.vix / 100} (or the configured default), a symmetric bid/ask spread and
 * {@code last} at the theoretical value. Output is fully deterministic.
 *
 * <p>A contract the engine could only price by approximation is quoted with
 * {@code estimated = true}.
 */
@Slf4j
public class TheoreticalQuoteProvider implements QuoteProvider {

    public static final String NAME = "theoretical";

    private static final int PRICE_SCALE = 2;

    private final OptionPricingEngine pricingEngine;
    private final PricingConfig pricingConfig;

    public TheoreticalQuoteProvider(OptionPricingEngine pricingEngine, PricingConfig pricingConfig) {
        this.pricingEngine = pricingEngine;
        this.pricingConfig = pricingConfig;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public List<OptionQuote> fetch(Set<ContractSpec> contracts, Bar bar) {
        double volatility = volatilityFor(bar);
        BigDecimal halfSpread = BigDecimal.valueOf(pricingConfig.getQuoteHalfSpread());
        List<OptionQuote> quotes = new ArrayList<>(contracts.size());

        for (ContractSpec contract : contracts) {
            double timeToExpiry = pricingEngine.timeToExpiryYears(bar.getTimestamp(), contract.getExpiration());
            OptionPrice price = pricingEngine.price(
                    bar.getClose(), contract.getStrike().doubleValue(), timeToExpiry, volatility, contract.getType());
            if (price.isDegraded()) {
                log.warn("Theoretical quote for {} at {} is a {} estimate", contract, bar.getTimestamp(), price.getMethod());
            }
            BigDecimal last = price.toBigDecimal(PRICE_SCALE);
            BigDecimal bid = last.subtract(halfSpread).max(BigDecimal.ZERO).setScale(PRICE_SCALE, RoundingMode.HALF_UP);
            BigDecimal ask = last.add(halfSpread).setScale(PRICE_SCALE, RoundingMode.HALF_UP);

            quotes.add(OptionQuote.builder()
                    .type(contract.getType())
                    .strike(contract.getStrike())
                    .expiration(contract.getExpiration())
                    .bid(bid)
                    .ask(ask)
                    .last(last)
                    .impliedVolatility(BigDecimal.valueOf(volatility))
                    .estimated(price.isDegraded())
                    .build());
        }
        log.debug("Theoretical quotes at {}: {} contracts, vol={}", bar.getTimestamp(), quotes.size(), volatility);
        return quotes;
    }

    double volatilityFor(Bar bar) {
        Double vix = bar.getVix();
        if (vix != null && Double.isFinite(vix) && vix > 0) {
            return vix / 100.0;
        }
        return pricingConfig.getDefaultVolatility();
    }
}
