package com.optionsbacktester.domain.model;

import com.optionsbacktester.domain.enums.VolatilityRegime;
import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/**
 * Fixed set of descriptive attributes attached to a position at entry.
 *
 * <p>All fields except {@code regime} are optional. {@code maxLoss} and
 * {@code profitTarget} are the stated thresholds in currency, fixed when the
 * position opens and never recomputed.
 */
@Value
@Builder(toBuilder = true)
public class PositionMetadata {

    @Builder.Default
    VolatilityRegime regime = VolatilityRegime.UNKNOWN;

    Double vixLevel;
    BigDecimal maxLoss;
    BigDecimal profitTarget;

    /** Distance in points between the lowest and highest profitable underlying level. */
    BigDecimal profitZoneWidth;

    Integer signalConfidence;

    public static PositionMetadata empty() {
        return PositionMetadata.builder().build();
    }
}
