package com.optionsbacktester.core.engine;

import com.optionsbacktester.exception.ConfigurationException;
import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

/**
 * Run-level parameters for one backtest.
 *
 * <p>{@code minBarsBetweenEntries} counts bars between consecutive entries; 0 allows an
 * entry on every bar. Bars before {@code warmupBars} are validated but not traded.
 */
@Value
@Builder(toBuilder = true)
public class BacktestSettings {

    /** Optional caller-supplied run id; a random id is used when absent. */
    String runId;

    @Builder.Default
    BigDecimal initialCapital = BigDecimal.valueOf(100_000);

    @Builder.Default
    int maxConcurrentPositions = 1;

    @Builder.Default
    int warmupBars = 0;

    @Builder.Default
    int minBarsBetweenEntries = 0;

    /**
     * @throws ConfigurationException when any parameter is out of range
     */
    public BacktestSettings validate() {
        Map<String, Object> details = new LinkedHashMap<>();
        if (initialCapital == null || initialCapital.signum() <= 0) {
            details.put("initialCapital", String.valueOf(initialCapital));
        }
        if (maxConcurrentPositions < 1) {
            details.put("maxConcurrentPositions", maxConcurrentPositions);
        }
        if (warmupBars < 0) {
            details.put("warmupBars", warmupBars);
        }
        if (minBarsBetweenEntries < 0) {
            details.put("minBarsBetweenEntries", minBarsBetweenEntries);
        }
        if (!details.isEmpty()) {
            throw new ConfigurationException("Invalid backtest settings: " + details.keySet(), details);
        }
        return this;
    }
}
