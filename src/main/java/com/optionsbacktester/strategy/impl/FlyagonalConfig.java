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
 * Configuration for the Flyagonal adapter.
 *
 * <p>Extends {@link BaseAdapterConfig} with the strike and expiry layout of the combined
 * call broken-wing butterfly and put diagonal.
 *
 * <p><b>Strike layout example (SPX at 6360):</b>
 * <pre>
 *   Buy PE 6115 (+16d) | Sell PE 6165 (+8d) | --- 6360 --- | Buy CE 6370 | Sell 2x CE 6420 | Buy CE 6480 (+8d)
 * </pre>
 */
@Data
@EqualsAndHashCode(callSuper = true)
@SuperBuilder
@NoArgsConstructor
public class FlyagonalConfig extends BaseAdapterConfig {

    public static final BigDecimal DEFAULT_MAX_LOSS = BigDecimal.valueOf(500);
    public static final BigDecimal DEFAULT_PROFIT_TARGET = BigDecimal.valueOf(750);
    public static final Duration DEFAULT_TARGET_HOLD = Duration.ofHours(108);
    public static final Duration DEFAULT_MAX_HOLD = Duration.ofDays(7);
    public static final int DEFAULT_MIN_CONFIDENCE = 85;

    /** Underlying is rounded up to this increment before the butterfly offsets apply. */
    @Builder.Default
    private int strikeRounding = 10;

    /** Points above the rounded underlying for the lower long call. */
    @Builder.Default
    private int lowerWingOffset = 10;

    /** Lower long call to short calls. */
    @Builder.Default
    private int lowerWingWidth = 50;

    /** Short calls to upper long call; wider than the lower wing. */
    @Builder.Default
    private int upperWingWidth = 60;

    /** Short diagonal put strike as a fraction of the underlying. */
    @Builder.Default
    private double diagonalShortFactor = 0.97;

    @Builder.Default
    private int diagonalStrikeRounding = 5;

    /** Short diagonal put to long diagonal put. */
    @Builder.Default
    private int diagonalWidth = 50;

    @Builder.Default
    private int shortExpiryDays = 8;

    @Builder.Default
    private int longExpiryDays = 16;

    /** Zone width, in points, counted as a sufficient profit zone. */
    @Builder.Default
    private BigDecimal minProfitZoneWidth = BigDecimal.valueOf(200);

    /** Config with the documented Flyagonal defaults for the given underlying. */
    public static FlyagonalConfig defaults(String underlyingSymbol) {
        return FlyagonalConfig.builder()
                .underlyingSymbol(underlyingSymbol)
                .minConfidence(DEFAULT_MIN_CONFIDENCE)
                .maxLoss(DEFAULT_MAX_LOSS)
                .profitTarget(DEFAULT_PROFIT_TARGET)
                .targetHoldingPeriod(DEFAULT_TARGET_HOLD)
                .maxHoldingPeriod(DEFAULT_MAX_HOLD)
                .build();
    }
}
