package com.optionsbacktester.domain.model;

import com.optionsbacktester.domain.enums.ExitReason;
import com.optionsbacktester.domain.enums.PositionStatus;
import java.math.BigDecimal;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A simulated multi-leg option position.
 *
 * <p>Sign convention: {@code entryCost} is the signed cash outflow at entry on the same
 * contract basis as leg values (per-share premium x contract multiplier). Net-debit
 * positions have positive entry cost and positive current value; net-credit positions
 * have both negative. {@code unrealizedPnl = currentValue - entryCost} therefore means
 * profit for a value increase on debits and for a value decrease (towards zero) on credits.
 *
 * <p>Mutated every bar by the active adapter and closed exactly once. After
 * {@link #close} the position is moved to the ledger as a {@link Trade}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Position {

    public static final int DEFAULT_CONTRACT_MULTIPLIER = 100;

    private String id;
    private String underlyingSymbol;
    private String strategyName;

    @Builder.Default
    private List<Leg> legs = new ArrayList<>();

    private LocalDateTime entryTime;
    private BigDecimal underlyingAtEntry;

    @Builder.Default
    private int contractMultiplier = DEFAULT_CONTRACT_MULTIPLIER;

    private BigDecimal entryCost;
    private BigDecimal currentValue;
    private BigDecimal unrealizedPnl;

    // Running extremes of unrealized P&L since entry
    private BigDecimal maxUnrealizedPnl;
    private BigDecimal minUnrealizedPnl;

    /** Set once any mark used an estimated leg value; never cleared. */
    private boolean estimated;

    /** Whether the most recent mark used an estimated leg value. */
    private boolean lastMarkEstimated;

    private LocalDateTime lastMarkedAt;

    @Builder.Default
    private PositionStatus status = PositionStatus.OPEN;

    private ExitReason exitReason;
    private LocalDateTime exitTime;

    @Builder.Default
    private PositionMetadata metadata = PositionMetadata.empty();

    /** Sum over legs of entryPrice x quantity x sign(side), per share. */
    public static BigDecimal netPremium(List<Leg> legs) {
        return legs.stream().map(Leg::signedEntryPremium).reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    public BigDecimal netPremium() {
        return netPremium(legs);
    }

    /**
     * Opens the position bookkeeping: entry cost from the legs and an initial mark at
     * entry prices, which gives zero unrealized P&L.
     */
    public Position initializeEntry() {
        this.entryCost = netPremium(legs).multiply(BigDecimal.valueOf(contractMultiplier));
        this.currentValue = entryCost;
        this.unrealizedPnl = BigDecimal.ZERO;
        this.maxUnrealizedPnl = BigDecimal.ZERO;
        this.minUnrealizedPnl = BigDecimal.ZERO;
        this.lastMarkedAt = entryTime;
        return this;
    }

    /** Applies a fresh mark and updates the running P&L extremes. */
    public void applyMark(BigDecimal value, boolean usedEstimates, LocalDateTime markedAt) {
        requireOpen();
        this.currentValue = value;
        this.unrealizedPnl = value.subtract(entryCost);
        this.maxUnrealizedPnl = maxUnrealizedPnl == null ? unrealizedPnl : maxUnrealizedPnl.max(unrealizedPnl);
        this.minUnrealizedPnl = minUnrealizedPnl == null ? unrealizedPnl : minUnrealizedPnl.min(unrealizedPnl);
        this.estimated = estimated || usedEstimates;
        this.lastMarkEstimated = usedEstimates;
        this.lastMarkedAt = markedAt;
    }

    /**
     * Terminal transition OPEN to CLOSED.
     *
     * @throws IllegalStateException if the position is already closed
     */
    public void close(ExitReason reason, LocalDateTime time) {
        requireOpen();
        this.status = PositionStatus.CLOSED;
        this.exitReason = reason;
        this.exitTime = time;
    }

    public boolean isOpen() {
        return status == PositionStatus.OPEN;
    }

    public Duration holdingDuration(LocalDateTime asOf) {
        return Duration.between(entryTime, asOf);
    }

    public List<ContractSpec> contracts() {
        return legs.stream().map(Leg::getContract).toList();
    }

    private void requireOpen() {
        if (status != PositionStatus.OPEN) {
            throw new IllegalStateException("Position " + id + " is already closed (" + exitReason + ")");
        }
    }
}
