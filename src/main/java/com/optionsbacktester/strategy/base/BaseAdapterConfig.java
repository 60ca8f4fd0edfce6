package com.optionsbacktester.strategy.base;

import com.optionsbacktester.core.exit.ExitRules;
import com.optionsbacktester.domain.enums.EntryFillModel;
import com.optionsbacktester.domain.model.Position;
import java.math.BigDecimal;
import java.time.Duration;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.experimental.SuperBuilder;

/**
 * Configuration shared by every backtesting adapter.
 *
 * <p>Uses {@code @SuperBuilder} so strategy configs chain builder calls:
 * {@code FlyagonalConfig.builder().underlyingSymbol("SPX").profitTarget(...).build()}.
 *
 * <p>{@code profitTarget} and {@code maxLoss} are positive currency amounts per position.
 */
@Data
@SuperBuilder
@NoArgsConstructor
public class BaseAdapterConfig {

    @Builder.Default
    private String underlyingSymbol = "SPX";

    /** Contracts per unit leg. A butterfly body sells twice this amount. */
    @Builder.Default
    private int quantity = 1;

    /** Signals below this confidence (0 to 100) are not traded. */
    @Builder.Default
    private int minConfidence = 0;

    @Builder.Default
    private EntryFillModel fillModel = EntryFillModel.MARK;

    @Builder.Default
    private int contractMultiplier = Position.DEFAULT_CONTRACT_MULTIPLIER;

    private BigDecimal profitTarget;
    private BigDecimal maxLoss;

    /** Optional; a hold-based exit that fires before the maximum hold. */
    private Duration targetHoldingPeriod;

    private Duration maxHoldingPeriod;

    public ExitRules toExitRules() {
        return ExitRules.builder()
                .profitTarget(profitTarget)
                .maxLoss(maxLoss)
                .targetHoldingPeriod(targetHoldingPeriod)
                .maxHoldingPeriod(maxHoldingPeriod)
                .build();
    }
}
