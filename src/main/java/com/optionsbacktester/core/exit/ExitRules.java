package com.optionsbacktester.core.exit;

import com.optionsbacktester.exception.ConfigurationException;
import java.math.BigDecimal;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

/**
 * Strategy-configured exit thresholds. Constants for the life of an adapter; never
 * recomputed per bar.
 *
 * <p>{@code profitTarget} and {@code maxLoss} are positive currency amounts (the stop
 * triggers at {@code -maxLoss}). A position may carry its own stated amounts in its
 * metadata, which take precedence. {@code targetHoldingPeriod} is optional.
 */
@Value
@Builder(toBuilder = true)
public class ExitRules {

    BigDecimal profitTarget;
    BigDecimal maxLoss;
    Duration targetHoldingPeriod;
    Duration maxHoldingPeriod;

    /**
     * @throws ConfigurationException when a threshold is missing, non-positive, or the
     *     target hold is longer than the maximum hold
     */
    public ExitRules validate() {
        Map<String, Object> details = new HashMap<>();
        if (profitTarget == null || profitTarget.signum() <= 0) {
            details.put("profitTarget", String.valueOf(profitTarget));
        }
        if (maxLoss == null || maxLoss.signum() <= 0) {
            details.put("maxLoss", String.valueOf(maxLoss));
        }
        if (maxHoldingPeriod == null || maxHoldingPeriod.isZero() || maxHoldingPeriod.isNegative()) {
            details.put("maxHoldingPeriod", String.valueOf(maxHoldingPeriod));
        }
        if (targetHoldingPeriod != null) {
            boolean nonPositive = targetHoldingPeriod.isZero() || targetHoldingPeriod.isNegative();
            boolean beyondMax = maxHoldingPeriod != null && targetHoldingPeriod.compareTo(maxHoldingPeriod) > 0;
            if (nonPositive || beyondMax) {
                details.put("targetHoldingPeriod", String.valueOf(targetHoldingPeriod));
            }
        }
        if (!details.isEmpty()) {
            throw new ConfigurationException("Invalid exit thresholds: " + details.keySet(), details);
        }
        return this;
    }

    public boolean hasTargetHold() {
        return targetHoldingPeriod != null;
    }
}
