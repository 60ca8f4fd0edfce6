package com.optionsbacktester.config;

import com.optionsbacktester.domain.enums.EntryFillModel;
import java.math.BigDecimal;
import java.time.Duration;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Per-strategy default parameters used when a backtest request does not override them.
 *
 * <p>Binds to {@code backtester.strategies.flyagonal.*} and
 * {@code backtester.strategies.momentum.*}. Durations accept Spring's format
 * ({@code 108h}, {@code 7d}, {@code 210m}).
 */
@Configuration
@ConfigurationProperties(prefix = "backtester.strategies")
@Getter
@Setter
public class StrategyDefaultsConfig {

    /** Fill model applied to every adapter's entry legs. */
    private EntryFillModel fillModel = EntryFillModel.MARK;

    private Flyagonal flyagonal = new Flyagonal();
    private Momentum momentum = new Momentum();

    @Getter
    @Setter
    public static class Flyagonal {
        private int quantity = 1;
        private int minConfidence = 85;
        private BigDecimal maxLoss = BigDecimal.valueOf(500);
        private BigDecimal profitTarget = BigDecimal.valueOf(750);
        private Duration targetHoldingPeriod = Duration.ofHours(108);
        private Duration maxHoldingPeriod = Duration.ofDays(7);
        private BigDecimal minProfitZoneWidth = BigDecimal.valueOf(200);
    }

    @Getter
    @Setter
    public static class Momentum {
        private int quantity = 1;
        private int minConfidence = 0;
        private BigDecimal stopLossPercent = new BigDecimal("0.5");
        private BigDecimal takeProfitPercent = new BigDecimal("1.0");

        /** Used only for positions that carry no thresholds of their own. */
        private BigDecimal maxLoss = BigDecimal.valueOf(125);

        private BigDecimal profitTarget = BigDecimal.valueOf(250);
        private Duration maxHoldingPeriod = Duration.ofMinutes(210);
        private int strikeInterval = 1;
        private int strikesAroundAtm = 2;
        private int expiryDaysAhead = 0;
    }
}
