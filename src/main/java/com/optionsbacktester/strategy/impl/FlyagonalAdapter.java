package com.optionsbacktester.strategy.impl;

import com.optionsbacktester.domain.enums.LegSide;
import com.optionsbacktester.domain.enums.StrategyType;
import com.optionsbacktester.domain.enums.VolatilityRegime;
import com.optionsbacktester.domain.model.ContractSpec;
import com.optionsbacktester.domain.model.Leg;
import com.optionsbacktester.domain.model.OptionQuote;
import com.optionsbacktester.domain.model.PositionMetadata;
import com.optionsbacktester.domain.model.Signal;
import com.optionsbacktester.domain.model.Trade;
import com.optionsbacktester.reporting.RegimePerformanceCalculator;
import com.optionsbacktester.strategy.base.AdapterContext;
import com.optionsbacktester.strategy.base.BaseBacktestingAdapter;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Flyagonal: a call broken-wing butterfly above the market combined with a put diagonal
 * below it.
 *
 * <p><b>Market view:</b> Range-bound to mildly bullish over about a week. The butterfly
 * profits if the underlying drifts up towards the short strikes; the diagonal collects
 * decay on the downside and hedges a volatility expansion.
 *
 * <p><b>Legs (5 contracts, 6 units):</b>
 * <ol>
 *   <li>Buy CE at ceil(S/10)*10 + 10 (short expiry)</li>
 *   <li>Sell 2x CE at lower + 50 (short expiry)</li>
 *   <li>Buy CE at short + 60 (short expiry, wider upper wing)</li>
 *   <li>Sell PE at floor(0.97*S/5)*5 (short expiry)</li>
 *   <li>Buy PE at diagonal short - 50 (long expiry)</li>
 * </ol>
 *
 * <p><b>Exit conditions:</b> profit target, max loss, 4.5 day target hold and 7 day
 * maximum hold by default.
 *
 * <p>A signal may name the five contracts itself, in the order above; otherwise the
 * layout is derived from the underlying price at entry.
 */
public class FlyagonalAdapter extends BaseBacktestingAdapter {

    public static final String NAME = "flyagonal";

    static final String METRIC_PROFIT_ZONE_EFFICIENCY = "profitZoneEfficiency";
    static final String METRIC_SIGNALS_WITH_ZONE = "signalsWithProfitZone";
    static final String METRIC_SIGNALS_IN_ZONE = "signalsInProfitZone";
    static final String METRIC_AVG_ZONE_WIDTH = "avgProfitZoneWidth";
    static final String METRIC_AVG_ENTRY_COST = "avgEntryCost";
    static final String METRIC_AVG_HOLDING_DAYS = "avgHoldingDays";

    private static final int LAYOUT_SIZE = 5;
    private static final BigDecimal MINUTES_PER_DAY = BigDecimal.valueOf(24 * 60);

    private final FlyagonalConfig flyagonalConfig;

    public FlyagonalAdapter(FlyagonalConfig flyagonalConfig, AdapterContext context) {
        super(flyagonalConfig, context);
        this.flyagonalConfig = flyagonalConfig;
    }

    // ========================
    // IDENTITY
    // ========================

    @Override
    public String strategyName() {
        return NAME;
    }

    @Override
    public StrategyType strategyType() {
        return StrategyType.FLYAGONAL;
    }

    // ========================
    // CONTRACT SELECTION
    // ========================

    @Override
    public Set<ContractSpec> requiredContracts(double underlyingPrice, LocalDateTime time) {
        return new LinkedHashSet<>(layout(underlyingPrice, time.toLocalDate()).contracts());
    }

    /** Five-contract layout for an underlying level and entry date. */
    Layout layout(double underlyingPrice, LocalDate entryDate) {
        LocalDate shortExpiry = entryDate.plusDays(flyagonalConfig.getShortExpiryDays());
        LocalDate longExpiry = entryDate.plusDays(flyagonalConfig.getLongExpiryDays());

        int rounding = flyagonalConfig.getStrikeRounding();
        long base = (long) Math.ceil(underlyingPrice / rounding) * rounding;
        long lower = base + flyagonalConfig.getLowerWingOffset();
        long body = lower + flyagonalConfig.getLowerWingWidth();
        long upper = body + flyagonalConfig.getUpperWingWidth();

        int diagonalRounding = flyagonalConfig.getDiagonalStrikeRounding();
        long diagonalShort = (long) Math.floor(underlyingPrice * flyagonalConfig.getDiagonalShortFactor() / diagonalRounding)
                * diagonalRounding;
        long diagonalLong = diagonalShort - flyagonalConfig.getDiagonalWidth();

        return new Layout(
                ContractSpec.call(lower, shortExpiry),
                ContractSpec.call(body, shortExpiry),
                ContractSpec.call(upper, shortExpiry),
                ContractSpec.put(diagonalShort, shortExpiry),
                ContractSpec.put(diagonalLong, longExpiry));
    }

    // ========================
    // ENTRY
    // ========================

    @Override
    protected boolean acceptsSignal(Signal signal) {
        int targets = signal.getTargetContracts().size();
        if (targets != 0 && targets != LAYOUT_SIZE) {
            logDecision(
                    "SIGNAL_REJECTED",
                    "Signal must name all five contracts or none",
                    Map.of("targetContracts", targets));
            return false;
        }
        return true;
    }

    @Override
    protected List<Leg> selectLegs(Signal signal, Collection<OptionQuote> quotes, double underlyingPrice) {
        LocalDateTime entryTime = signal.getTimestamp();
        Layout layout = signal.getTargetContracts().size() == LAYOUT_SIZE
                ? Layout.of(signal.getTargetContracts())
                : layout(underlyingPrice, entryTime.toLocalDate());

        int quantity = config.getQuantity();
        return List.of(
                openLeg(layout.longLower(), LegSide.LONG, quantity, quotes, underlyingPrice, entryTime),
                openLeg(layout.shortBody(), LegSide.SHORT, quantity * 2, quotes, underlyingPrice, entryTime),
                openLeg(layout.longUpper(), LegSide.LONG, quantity, quotes, underlyingPrice, entryTime),
                openLeg(layout.diagonalShort(), LegSide.SHORT, quantity, quotes, underlyingPrice, entryTime),
                openLeg(layout.diagonalLong(), LegSide.LONG, quantity, quotes, underlyingPrice, entryTime));
    }

    @Override
    protected PositionMetadata describeEntry(
            Signal signal, List<Leg> legs, BigDecimal entryCost, double underlyingPrice) {
        BigDecimal zoneWidth = signal.getProfitZoneWidth() != null
                ? signal.getProfitZoneWidth()
                // Upper call wing to short put: the span the combined structure is built to cover
                : legs.get(2).getContract().getStrike().subtract(legs.get(3).getContract().getStrike());

        return PositionMetadata.builder()
                .regime(VolatilityRegime.fromVix(signal.getVixLevel()))
                .vixLevel(signal.getVixLevel())
                .maxLoss(signal.getStopLoss() != null ? signal.getStopLoss() : exitRules.getMaxLoss())
                .profitTarget(signal.getTakeProfit() != null ? signal.getTakeProfit() : exitRules.getProfitTarget())
                .profitZoneWidth(zoneWidth)
                .signalConfidence(signal.getConfidence())
                .build();
    }

    // ========================
    // METRICS
    // ========================

    @Override
    protected void addStrategySpecificMetrics(
            Map<String, BigDecimal> metrics, List<Trade> trades, List<Signal> signals) {
        List<BigDecimal> widths = signals.stream()
                .map(Signal::getProfitZoneWidth)
                .filter(w -> w != null)
                .toList();
        int inZone = (int) widths.stream()
                .filter(w -> w.compareTo(flyagonalConfig.getMinProfitZoneWidth()) >= 0)
                .count();

        metrics.put(METRIC_SIGNALS_WITH_ZONE, BigDecimal.valueOf(widths.size()));
        metrics.put(METRIC_SIGNALS_IN_ZONE, BigDecimal.valueOf(inZone));
        metrics.put(METRIC_PROFIT_ZONE_EFFICIENCY, RegimePerformanceCalculator.percentage(inZone, widths.size()));
        metrics.put(METRIC_AVG_ZONE_WIDTH, average(widths));
        metrics.put(METRIC_AVG_ENTRY_COST, average(trades.stream().map(Trade::getEntryCost).toList()));

        BigDecimal avgMinutes = average(trades.stream()
                .map(t -> BigDecimal.valueOf(t.getHoldingMinutes()))
                .toList());
        metrics.put(METRIC_AVG_HOLDING_DAYS, avgMinutes.divide(MINUTES_PER_DAY, 2, RoundingMode.HALF_UP));
    }

    private static BigDecimal average(List<BigDecimal> values) {
        if (values.isEmpty()) {
            return BigDecimal.ZERO;
        }
        BigDecimal sum = values.stream().reduce(BigDecimal.ZERO, BigDecimal::add);
        return sum.divide(BigDecimal.valueOf(values.size()), 2, RoundingMode.HALF_UP);
    }

    /** The five Flyagonal contracts in leg order. */
    record Layout(
            ContractSpec longLower,
            ContractSpec shortBody,
            ContractSpec longUpper,
            ContractSpec diagonalShort,
            ContractSpec diagonalLong) {

        static Layout of(List<ContractSpec> contracts) {
            return new Layout(contracts.get(0), contracts.get(1), contracts.get(2), contracts.get(3), contracts.get(4));
        }

        List<ContractSpec> contracts() {
            return List.of(longLower, shortBody, longUpper, diagonalShort, diagonalLong);
        }
    }
}
