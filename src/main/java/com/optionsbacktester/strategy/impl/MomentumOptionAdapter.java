package com.optionsbacktester.strategy.impl;

import com.optionsbacktester.domain.enums.LegSide;
import com.optionsbacktester.domain.enums.OptionType;
import com.optionsbacktester.domain.enums.StrategyType;
import com.optionsbacktester.domain.enums.VolatilityRegime;
import com.optionsbacktester.domain.model.ContractSpec;
import com.optionsbacktester.domain.model.Leg;
import com.optionsbacktester.domain.model.OptionQuote;
import com.optionsbacktester.domain.model.PositionMetadata;
import com.optionsbacktester.domain.model.Signal;
import com.optionsbacktester.domain.model.Trade;
import com.optionsbacktester.exception.ConfigurationException;
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
 * Single-leg directional strategy: buys one call or put named by the signal.
 *
 * <p><b>Market view:</b> Short-term directional, intraday. The upstream signal picks
 * the side and strike from the ATM neighbourhood this adapter requests.
 *
 * <p><b>Legs (1):</b> Buy CE or PE, quantity from config.
 *
 * <p><b>Exit conditions:</b>
 * <ul>
 *   <li>Take profit: P&L >= entryCost * takeProfitPercent (or the signal's amount)</li>
 *   <li>Stop loss: P&L <= -(entryCost * stopLossPercent) (or the signal's amount)</li>
 *   <li>Time exit: 210 minutes held, before the same-day expiry</li>
 * </ul>
 */
public class MomentumOptionAdapter extends BaseBacktestingAdapter {

    public static final String NAME = "momentum";

    static final String METRIC_CALL_TRADES = "callTrades";
    static final String METRIC_PUT_TRADES = "putTrades";
    static final String METRIC_CALL_WIN_RATE = "callWinRate";
    static final String METRIC_PUT_WIN_RATE = "putWinRate";
    static final String METRIC_AVG_HOLDING_MINUTES = "avgHoldingMinutes";

    private final MomentumOptionConfig momentumConfig;

    public MomentumOptionAdapter(MomentumOptionConfig momentumConfig, AdapterContext context) {
        super(momentumConfig, context);
        this.momentumConfig = momentumConfig;
        if (momentumConfig.getStrikeInterval() < 1
                || momentumConfig.getStrikesAroundAtm() < 0
                || momentumConfig.getExpiryDaysAhead() < 0
                || !isPositive(momentumConfig.getStopLossPercent())
                || !isPositive(momentumConfig.getTakeProfitPercent())) {
            throw new ConfigurationException(
                    "Invalid momentum configuration",
                    Map.of(
                            "strikeInterval", momentumConfig.getStrikeInterval(),
                            "strikesAroundAtm", momentumConfig.getStrikesAroundAtm(),
                            "expiryDaysAhead", momentumConfig.getExpiryDaysAhead(),
                            "stopLossPercent", String.valueOf(momentumConfig.getStopLossPercent()),
                            "takeProfitPercent", String.valueOf(momentumConfig.getTakeProfitPercent())));
        }
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
        return StrategyType.MOMENTUM;
    }

    // ========================
    // CONTRACT SELECTION
    // ========================

    @Override
    public Set<ContractSpec> requiredContracts(double underlyingPrice, LocalDateTime time) {
        int interval = momentumConfig.getStrikeInterval();
        long atm = Math.round(underlyingPrice / interval) * interval;
        LocalDate expiry = time.toLocalDate().plusDays(momentumConfig.getExpiryDaysAhead());

        Set<ContractSpec> contracts = new LinkedHashSet<>();
        for (int i = -momentumConfig.getStrikesAroundAtm(); i <= momentumConfig.getStrikesAroundAtm(); i++) {
            long strike = atm + (long) i * interval;
            contracts.add(ContractSpec.call(strike, expiry));
            contracts.add(ContractSpec.put(strike, expiry));
        }
        return contracts;
    }

    // ========================
    // ENTRY
    // ========================

    @Override
    protected boolean acceptsSignal(Signal signal) {
        if (signal.getTargetContracts().size() != 1) {
            logDecision(
                    "SIGNAL_REJECTED",
                    "Momentum signal must target exactly one contract",
                    Map.of("targetContracts", signal.getTargetContracts().size()));
            return false;
        }
        return true;
    }

    @Override
    protected List<Leg> selectLegs(Signal signal, Collection<OptionQuote> quotes, double underlyingPrice) {
        ContractSpec target = signal.getTargetContracts().get(0);
        return List.of(openLeg(
                target, LegSide.LONG, config.getQuantity(), quotes, underlyingPrice, signal.getTimestamp()));
    }

    @Override
    protected PositionMetadata describeEntry(
            Signal signal, List<Leg> legs, BigDecimal entryCost, double underlyingPrice) {
        BigDecimal premium = entryCost.abs();
        BigDecimal profitTarget = signal.getTakeProfit() != null
                ? signal.getTakeProfit()
                : fractionOrDefault(premium, momentumConfig.getTakeProfitPercent(), exitRules.getProfitTarget());
        BigDecimal maxLoss = signal.getStopLoss() != null
                ? signal.getStopLoss()
                : fractionOrDefault(premium, momentumConfig.getStopLossPercent(), exitRules.getMaxLoss());

        return PositionMetadata.builder()
                .regime(VolatilityRegime.fromVix(signal.getVixLevel()))
                .vixLevel(signal.getVixLevel())
                .profitTarget(profitTarget)
                .maxLoss(maxLoss)
                .signalConfidence(signal.getConfidence())
                .build();
    }

    // ========================
    // METRICS
    // ========================

    @Override
    protected void addStrategySpecificMetrics(
            Map<String, BigDecimal> metrics, List<Trade> trades, List<Signal> signals) {
        List<Trade> calls = trades.stream().filter(t -> typeOf(t) == OptionType.CALL).toList();
        List<Trade> puts = trades.stream().filter(t -> typeOf(t) == OptionType.PUT).toList();

        metrics.put(METRIC_CALL_TRADES, BigDecimal.valueOf(calls.size()));
        metrics.put(METRIC_PUT_TRADES, BigDecimal.valueOf(puts.size()));
        metrics.put(METRIC_CALL_WIN_RATE, winRate(calls));
        metrics.put(METRIC_PUT_WIN_RATE, winRate(puts));

        long totalMinutes = trades.stream().mapToLong(Trade::getHoldingMinutes).sum();
        metrics.put(
                METRIC_AVG_HOLDING_MINUTES,
                trades.isEmpty()
                        ? BigDecimal.ZERO
                        : BigDecimal.valueOf(totalMinutes).divide(BigDecimal.valueOf(trades.size()), 2, RoundingMode.HALF_UP));
    }

    private static OptionType typeOf(Trade trade) {
        return trade.getLegs().get(0).getContract().getType();
    }

    private static BigDecimal winRate(List<Trade> trades) {
        int wins = (int) trades.stream().filter(Trade::isWin).count();
        return RegimePerformanceCalculator.percentage(wins, trades.size());
    }

    // A zero-premium fill would give a zero threshold and close on the first mark
    private static BigDecimal fractionOrDefault(BigDecimal premium, BigDecimal fraction, BigDecimal fallback) {
        BigDecimal amount = premium.multiply(fraction);
        return amount.signum() > 0 ? amount : fallback;
    }

    private static boolean isPositive(BigDecimal value) {
        return value != null && value.signum() > 0;
    }
}
