package com.optionsbacktester.domain.model;

import com.optionsbacktester.domain.enums.ExitReason;
import com.optionsbacktester.domain.enums.VolatilityRegime;
import java.math.BigDecimal;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import lombok.Builder;
import lombok.Value;

/**
 * Immutable ledger record of one closed position.
 *
 * <p>{@code realizedPnl = exitValue - entryCost}. {@code estimated} marks trades whose
 * valuation used an estimated leg at any point, so consumers can separate them from
 * trades marked purely on quotes.
 */
@Value
@Builder(toBuilder = true)
public class Trade {

    String positionId;
    String strategyName;
    LocalDateTime entryTime;
    LocalDateTime exitTime;
    BigDecimal entryCost;
    BigDecimal exitValue;
    BigDecimal realizedPnl;
    Duration holdingDuration;
    ExitReason exitReason;
    VolatilityRegime regimeAtEntry;
    boolean estimated;
    BigDecimal maxUnrealizedPnl;
    BigDecimal minUnrealizedPnl;
    List<Leg> legs;
    PositionMetadata metadata;

    /**
     * Builds the ledger record for a position that has just been closed.
     *
     * @throws IllegalStateException if the position is still open
     */
    public static Trade fromClosedPosition(Position position) {
        if (position.isOpen()) {
            throw new IllegalStateException("Cannot record open position " + position.getId() + " as a trade");
        }
        return Trade.builder()
                .positionId(position.getId())
                .strategyName(position.getStrategyName())
                .entryTime(position.getEntryTime())
                .exitTime(position.getExitTime())
                .entryCost(position.getEntryCost())
                .exitValue(position.getCurrentValue())
                .realizedPnl(position.getCurrentValue().subtract(position.getEntryCost()))
                .holdingDuration(position.holdingDuration(position.getExitTime()))
                .exitReason(position.getExitReason())
                .regimeAtEntry(position.getMetadata().getRegime())
                .estimated(position.isEstimated())
                .maxUnrealizedPnl(position.getMaxUnrealizedPnl())
                .minUnrealizedPnl(position.getMinUnrealizedPnl())
                .legs(List.copyOf(position.getLegs()))
                .metadata(position.getMetadata())
                .build();
    }

    public boolean isWin() {
        return realizedPnl.signum() > 0;
    }

    public long getHoldingMinutes() {
        return holdingDuration.toMinutes();
    }
}
