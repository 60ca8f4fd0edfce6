package com.optionsbacktester.core.engine;

import com.optionsbacktester.domain.enums.ExitReason;
import com.optionsbacktester.domain.model.Position;
import com.optionsbacktester.domain.model.Signal;
import com.optionsbacktester.domain.model.Trade;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.Getter;

/**
 * Mutable state of one backtest run. Owned by the loop; single writer.
 *
 * <p>Cash accounting: opening a position pays its entry cost, closing it receives its
 * current value. Since {@code realizedPnl = exitValue - entryCost}, cash after every
 * position has closed equals initial capital plus the sum of realized P&L.
 */
@Getter
public class BacktestState {

    private BigDecimal cash;

    // Insertion ordered: positions are marked and evaluated in the order they opened
    private final Map<String, Position> openPositions = new LinkedHashMap<>();

    private final List<Trade> ledger = new ArrayList<>();
    private final List<Signal> signals = new ArrayList<>();

    private BigDecimal equityPeak;
    private BigDecimal maxDrawdown = BigDecimal.ZERO;

    /** Bar index of the last entry; null until the first position opens. */
    private Integer lastEntryBarIndex;

    private int barsProcessed;
    private int barsSkipped;
    private int degradedValuations;
    private LocalDateTime lastProcessedAt;

    public BacktestState(BigDecimal initialCapital) {
        this.cash = initialCapital;
        this.equityPeak = initialCapital;
    }

    // ---- Positions ----

    public void openPosition(Position position, int barIndex) {
        cash = cash.subtract(position.getEntryCost());
        openPositions.put(position.getId(), position);
        lastEntryBarIndex = barIndex;
    }

    /** Closes the position, books its value into cash and appends it to the ledger. */
    public Trade closePosition(Position position, ExitReason reason, LocalDateTime time) {
        position.close(reason, time);
        Trade trade = Trade.fromClosedPosition(position);
        cash = cash.add(position.getCurrentValue());
        ledger.add(trade);
        openPositions.remove(position.getId());
        return trade;
    }

    /** Copy of the open positions, safe to iterate while closing. */
    public List<Position> openPositionsSnapshot() {
        return new ArrayList<>(openPositions.values());
    }

    public boolean canEnter(int barIndex, BacktestSettings settings) {
        if (openPositions.size() >= settings.getMaxConcurrentPositions()) {
            return false;
        }
        return lastEntryBarIndex == null || barIndex - lastEntryBarIndex >= settings.getMinBarsBetweenEntries();
    }

    // ---- Equity ----

    public BigDecimal equity() {
        BigDecimal openValue = openPositions.values().stream()
                .map(Position::getCurrentValue)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        return cash.add(openValue);
    }

    public void updateEquity() {
        BigDecimal equity = equity();
        equityPeak = equityPeak.max(equity);
        maxDrawdown = maxDrawdown.max(equityPeak.subtract(equity));
    }

    // ---- Counters ----

    public void recordSignal(Signal signal) {
        signals.add(signal);
    }

    public void recordProcessedBar(LocalDateTime time) {
        barsProcessed++;
        lastProcessedAt = time;
    }

    public void recordSkippedBar() {
        barsSkipped++;
    }

    public void recordDegradedValuation() {
        degradedValuations++;
    }

    public List<Trade> getLedger() {
        return Collections.unmodifiableList(ledger);
    }

    public List<Signal> getSignals() {
        return Collections.unmodifiableList(signals);
    }
}
