package com.optionsbacktester.core.exit;

import com.optionsbacktester.domain.enums.ExitReason;
import com.optionsbacktester.domain.model.PositionMetadata;
import java.math.BigDecimal;
import java.time.Duration;
import java.util.Optional;

/**
 * Exit decision for an open position. Triggers are checked in priority order and the
 * first match wins:
 * <ol>
 *   <li>unrealized P&L at or above the profit target: {@link ExitReason#PROFIT_TARGET}
 *   <li>unrealized P&L at or below minus the max loss: {@link ExitReason#STOP_LOSS}
 *   <li>holding time at or beyond the target hold, if one is set: {@link ExitReason#TARGET_HOLD_REACHED}
 *   <li>holding time at or beyond the max hold: {@link ExitReason#MAX_HOLD_REACHED}
 * </ol>
 * {@link ExitReason#END_OF_PERIOD} is not decided here; the loop applies it after the
 * last bar.
 */
public final class ExitDecisionEvaluator {

    private ExitDecisionEvaluator() {}

    public static Optional<ExitReason> evaluate(
            BigDecimal unrealizedPnl, Duration holding, ExitRules rules, PositionMetadata metadata) {
        BigDecimal profitTarget = effectiveProfitTarget(rules, metadata);
        BigDecimal maxLoss = effectiveMaxLoss(rules, metadata);

        if (unrealizedPnl.compareTo(profitTarget) >= 0) {
            return Optional.of(ExitReason.PROFIT_TARGET);
        }
        if (unrealizedPnl.compareTo(maxLoss.negate()) <= 0) {
            return Optional.of(ExitReason.STOP_LOSS);
        }
        if (rules.hasTargetHold() && holding.compareTo(rules.getTargetHoldingPeriod()) >= 0) {
            return Optional.of(ExitReason.TARGET_HOLD_REACHED);
        }
        if (holding.compareTo(rules.getMaxHoldingPeriod()) >= 0) {
            return Optional.of(ExitReason.MAX_HOLD_REACHED);
        }
        return Optional.empty();
    }

    static BigDecimal effectiveProfitTarget(ExitRules rules, PositionMetadata metadata) {
        if (metadata != null && metadata.getProfitTarget() != null) {
            return metadata.getProfitTarget();
        }
        return rules.getProfitTarget();
    }

    static BigDecimal effectiveMaxLoss(ExitRules rules, PositionMetadata metadata) {
        if (metadata != null && metadata.getMaxLoss() != null) {
            return metadata.getMaxLoss();
        }
        return rules.getMaxLoss();
    }
}
