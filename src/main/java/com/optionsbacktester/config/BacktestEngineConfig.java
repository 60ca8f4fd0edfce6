package com.optionsbacktester.config;

import java.math.BigDecimal;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Default run settings for backtests submitted without explicit values.
 *
 * <p>Binds to the {@code backtester.engine.*} prefix in application.properties.
 */
@Configuration
@ConfigurationProperties(prefix = "backtester.engine")
@Getter
@Setter
public class BacktestEngineConfig {

    private BigDecimal initialCapital = BigDecimal.valueOf(100_000);

    private int maxConcurrentPositions = 1;

    /** Leading bars validated but not traded. */
    private int warmupBars = 0;

    private int minBarsBetweenEntries = 0;

    /** Completed results kept in memory; the oldest is evicted beyond this. */
    private int maxStoredResults = 100;
}
