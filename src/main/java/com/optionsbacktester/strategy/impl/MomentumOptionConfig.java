package com.optionsbacktester.strategy.impl;

import com.optionsbacktester.strategy.base.BaseAdapterConfig;
import java.math.BigDecimal;
import java.time.Duration;
import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.experimental.SuperBuilder;

/**
 * Configuration for the single-leg momentum adapter.
 *
 * <p>Per-position thresholds are fractions of the entry cost, fixed when the position
 * opens: {@code stopLossPercent = 0.5} closes at a 50% loss of premium paid,
 * {@code takeProfitPercent = 1.0} at a 100% gain. The inherited {@code profitTarget}
 * and {@code maxLoss} amounts only apply when a position carries no thresholds of its own.
 *
 * <p><b>Contract universe example (underlying at 602.4, interval 1, 2 strikes around ATM):</b>
 * <pre>
 *   600 601 [602] 603 604, calls and puts, same-day expiry
 * </pre>
 */
@Data
@EqualsAndHashCode(callSuper = true)
@SuperBuilder
@NoArgsConstructor
public class MomentumOptionConfig extends BaseAdapterConfig {

    public static final Duration DEFAULT_MAX_HOLD = Duration.ofMinutes(210);
    public static final BigDecimal DEFAULT_PROFIT_TARGET = BigDecimal.valueOf(250);
    public static final BigDecimal DEFAULT_MAX_LOSS = BigDecimal.valueOf(125);

    @Builder.Default
    private BigDecimal stopLossPercent = new BigDecimal("0.5");

    @Builder.Default
    private BigDecimal takeProfitPercent = new BigDecimal("1.0");

    @Builder.Default
    private int strikeInterval = 1;

    /** Strikes requested on each side of the ATM strike. */
    @Builder.Default
    private int strikesAroundAtm = 2;

    /** 0 for same-day expiry. */
    @Builder.Default
    private int expiryDaysAhead = 0;

    public static MomentumOptionConfig defaults(String underlyingSymbol) {
        return MomentumOptionConfig.builder()
                .underlyingSymbol(underlyingSymbol)
                .profitTarget(DEFAULT_PROFIT_TARGET)
                .maxLoss(DEFAULT_MAX_LOSS)
                .maxHoldingPeriod(DEFAULT_MAX_HOLD)
                .build();
    }
}
