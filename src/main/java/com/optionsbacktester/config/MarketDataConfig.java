package com.optionsbacktester.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Quote provider chain and its per-provider rate limits.
 *
 * <p>Binds to the {@code backtester.market-data.*} prefix in application.properties.
 * Provider names are those returned by {@code QuoteProvider.name()}.
 */
@Configuration
@ConfigurationProperties(prefix = "backtester.market-data")
@Getter
@Setter
public class MarketDataConfig {

    /** Providers tried in this order for every bar; the first non-empty answer wins. */
    private List<String> providerPriority = new ArrayList<>(List.of("recorded", "theoretical"));

    /** Calls each provider may serve per refresh period. */
    private int limitForPeriod = 1000;

    private Duration limitRefreshPeriod = Duration.ofSeconds(1);

    /** How long a fetch waits for a permit before moving to the next provider. */
    private Duration acquireTimeout = Duration.ZERO;

    /** Fall back to engine-priced quotes when a request carries no recorded quotes. */
    private boolean theoreticalFallbackEnabled = true;
}
