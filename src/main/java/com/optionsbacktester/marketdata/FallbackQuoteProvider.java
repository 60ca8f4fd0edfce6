package com.optionsbacktester.marketdata;

import com.optionsbacktester.config.MarketDataConfig;
import com.optionsbacktester.domain.model.Bar;
import com.optionsbacktester.domain.model.ContractSpec;
import com.optionsbacktester.domain.model.OptionQuote;
import com.optionsbacktester.exception.ConfigurationException;
import com.optionsbacktester.exception.MarketDataException;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;

/**
 * Tries quote providers in a fixed priority order and returns the first non-empty answer.
 *
 * <p>Providers that report {@link QuoteProvider#isRateLimited()} get their own
 * resilience4j {@link RateLimiter}, owned by this object; in-memory providers are never
 * throttled. A provider that is out of permits, throws {@link MarketDataException} or
 * returns no quotes is skipped. The loop only ever sees one provider's complete answer for a bar;
 * when every provider fails the bar fails with a single {@link MarketDataException}.
 */
@Slf4j
public class FallbackQuoteProvider implements QuoteProvider {

    public static final String NAME = "fallback";

    private final List<QuoteProvider> providers;
    private final Map<String, RateLimiter> rateLimiters = new LinkedHashMap<>();

    /**
     * @param available providers by name; only those named in the priority list are used
     * @param config    priority order and rate limit settings
     * @throws ConfigurationException when the priority list selects no available provider
     */
    public FallbackQuoteProvider(Map<String, QuoteProvider> available, MarketDataConfig config) {
        RateLimiterConfig limiterConfig = RateLimiterConfig.custom()
                .limitForPeriod(config.getLimitForPeriod())
                .limitRefreshPeriod(config.getLimitRefreshPeriod())
                .timeoutDuration(config.getAcquireTimeout())
                .build();

        List<QuoteProvider> ordered = new ArrayList<>();
        for (String name : config.getProviderPriority()) {
            QuoteProvider provider = available.get(name);
            if (provider == null) {
                log.debug("Provider '{}' in priority list is not available for this run", name);
                continue;
            }
            ordered.add(provider);
            if (provider.isRateLimited()) {
                rateLimiters.put(name, RateLimiter.of("quotes-" + name, limiterConfig));
            }
        }
        if (ordered.isEmpty()) {
            throw new ConfigurationException(
                    "No quote provider available",
                    Map.of("priority", config.getProviderPriority(), "available", List.copyOf(available.keySet())));
        }
        this.providers = List.copyOf(ordered);
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public List<OptionQuote> fetch(Set<ContractSpec> contracts, Bar bar) {
        Map<String, Object> failures = new LinkedHashMap<>();
        for (QuoteProvider provider : providers) {
            RateLimiter limiter = rateLimiters.get(provider.name());
            if (limiter != null && !limiter.acquirePermission()) {
                log.warn("Quote provider {} rate limited at {}, trying next", provider.name(), bar.getTimestamp());
                failures.put(provider.name(), "rate limited");
                continue;
            }
            try {
                List<OptionQuote> quotes = provider.fetch(contracts, bar);
                if (!quotes.isEmpty()) {
                    return quotes;
                }
                failures.put(provider.name(), "no quotes");
            } catch (MarketDataException e) {
                log.debug("Quote provider {} failed at {}: {}", provider.name(), bar.getTimestamp(), e.getMessage());
                failures.put(provider.name(), e.getMessage());
            }
        }
        throw new MarketDataException("All quote providers failed at " + bar.getTimestamp(), failures);
    }

    public List<String> providerOrder() {
        return providers.stream().map(QuoteProvider::name).toList();
    }
}
