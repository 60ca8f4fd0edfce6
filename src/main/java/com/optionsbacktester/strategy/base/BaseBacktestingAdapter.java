package com.optionsbacktester.strategy.base;

import com.optionsbacktester.config.PricingConfig;
import com.optionsbacktester.core.exit.ExitDecisionEvaluator;
import com.optionsbacktester.core.exit.ExitRules;
import com.optionsbacktester.domain.enums.EntryFillModel;
import com.optionsbacktester.domain.enums.ExitReason;
import com.optionsbacktester.domain.enums.LegSide;
import com.optionsbacktester.domain.model.Bar;
import com.optionsbacktester.domain.model.ContractSpec;
import com.optionsbacktester.domain.model.Leg;
import com.optionsbacktester.domain.model.OptionQuote;
import com.optionsbacktester.domain.model.Position;
import com.optionsbacktester.domain.model.PositionMetadata;
import com.optionsbacktester.domain.model.Signal;
import com.optionsbacktester.domain.model.Trade;
import com.optionsbacktester.exception.ConfigurationException;
import com.optionsbacktester.exception.DataGapException;
import com.optionsbacktester.reporting.RegimePerformanceCalculator;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Abstract base for backtesting adapters.
 *
 * <p>Provides what every strategy family shares:
 * <ul>
 *   <li><b>Signal gating:</b> ENTER action and minimum confidence, plus a subclass hook</li>
 *   <li><b>Position assembly:</b> leg construction from quotes, entry cost, the initial
 *       mark and deterministic position ids</li>
 *   <li><b>Data gaps:</b> a missing leg quote aborts the entry for that bar only</li>
 *   <li><b>Exit evaluation:</b> the shared priority-ordered exit decision with this
 *       adapter's {@link ExitRules}</li>
 *   <li><b>Metrics:</b> win rate, regime table and signal efficiency</li>
 * </ul>
 *
 * <p>Subclasses implement {@link #selectLegs}, {@link #describeEntry} and
 * {@link #addStrategySpecificMetrics}, and usually {@link #requiredContracts}.
 *
 * <p>Thresholds are validated in the constructor; an invalid configuration throws
 * {@link ConfigurationException} and no adapter is created.
 */
public abstract class BaseBacktestingAdapter implements StrategyBacktestingAdapter {

    private static final Logger log = LoggerFactory.getLogger(BaseBacktestingAdapter.class);

    // ---- Configuration ----
    protected final BaseAdapterConfig config;
    protected final ExitRules exitRules;

    // ---- Services ----
    protected final AdapterContext context;

    private final AtomicInteger positionSequence = new AtomicInteger();

    protected BaseBacktestingAdapter(BaseAdapterConfig config, AdapterContext context) {
        this.config = config;
        this.context = context;
        validateCommon(config);
        this.exitRules = config.toExitRules().validate();
    }

    // ========================
    // ABSTRACT METHODS (each strategy family implements these)
    // ========================

    /**
     * Chooses and prices the legs for an accepted signal.
     *
     * @throws DataGapException when a required contract has no quote
     */
    protected abstract List<Leg> selectLegs(Signal signal, Collection<OptionQuote> quotes, double underlyingPrice);

    /** Entry metadata, including any per-position thresholds. */
    protected abstract PositionMetadata describeEntry(
            Signal signal, List<Leg> legs, BigDecimal entryCost, double underlyingPrice);

    /** Adds family-specific named values to the metrics map. */
    protected abstract void addStrategySpecificMetrics(
            Map<String, BigDecimal> metrics, List<Trade> trades, List<Signal> signals);

    /** Strategy-specific signal checks on top of action and confidence. */
    protected boolean acceptsSignal(Signal signal) {
        return true;
    }

    // ========================
    // POSITION LIFECYCLE
    // ========================

    @Override
    public boolean validateSignal(Signal signal) {
        if (!isQualifying(signal)) {
            return false;
        }
        if (signal.getTakeProfit() != null && signal.getTakeProfit().signum() <= 0
                || signal.getStopLoss() != null && signal.getStopLoss().signum() <= 0) {
            logDecision(
                    "SIGNAL_REJECTED",
                    "Signal thresholds must be positive amounts",
                    Map.of("takeProfit", String.valueOf(signal.getTakeProfit()), "stopLoss", String.valueOf(signal.getStopLoss())));
            return false;
        }
        return acceptsSignal(signal);
    }

    @Override
    public Optional<Position> buildPosition(
            Signal signal, Collection<OptionQuote> availableQuotes, double underlyingPrice) {
        if (!validateSignal(signal)) {
            return Optional.empty();
        }

        LocalDateTime entryTime = signal.getTimestamp();
        List<Leg> legs;
        try {
            legs = selectLegs(signal, availableQuotes, underlyingPrice);
        } catch (DataGapException e) {
            logDecision(
                    "DATA_GAP",
                    "Entry aborted, required leg has no quote",
                    Map.of("contract", e.getMissingContract().toString(), "time", String.valueOf(entryTime)));
            return Optional.empty();
        }

        Position position = Position.builder()
                .id(nextPositionId())
                .underlyingSymbol(config.getUnderlyingSymbol())
                .strategyName(strategyName())
                .legs(new ArrayList<>(legs))
                .entryTime(entryTime)
                .underlyingAtEntry(BigDecimal.valueOf(underlyingPrice))
                .contractMultiplier(config.getContractMultiplier())
                .build()
                .initializeEntry();
        position.setMetadata(describeEntry(signal, legs, position.getEntryCost(), underlyingPrice));

        // Initial mark against the same quotes; zero P&L under the MARK fill model
        context.getPositionValuator().mark(position, availableQuotes, underlyingPrice, entryTime);

        logDecision(
                "ENTRY",
                "Position opened",
                Map.of(
                        "positionId", position.getId(),
                        "legs", legs.size(),
                        "entryCost", position.getEntryCost().toPlainString(),
                        "regime", position.getMetadata().getRegime().name()));
        return Optional.of(position);
    }

    @Override
    public Position updatePosition(Position position, Bar bar, Collection<OptionQuote> quotes) {
        context.getPositionValuator().mark(position, quotes, bar.getClose(), bar.getTimestamp());
        return position;
    }

    @Override
    public Optional<ExitReason> evaluateExit(
            Position position, Bar bar, Collection<OptionQuote> quotes, long holdingMinutes) {
        Optional<ExitReason> reason = ExitDecisionEvaluator.evaluate(
                position.getUnrealizedPnl(), Duration.ofMinutes(holdingMinutes), exitRules, position.getMetadata());
        reason.ifPresent(r -> logDecision(
                "EXIT_REASON",
                r.name(),
                Map.of(
                        "positionId", position.getId(),
                        "unrealizedPnl", position.getUnrealizedPnl().toPlainString(),
                        "holdingMinutes", holdingMinutes)));
        return reason;
    }

    // ========================
    // METRICS
    // ========================

    @Override
    public StrategyMetrics strategyMetrics(List<Trade> trades, List<Signal> signals) {
        int total = trades.size();
        int wins = (int) trades.stream().filter(Trade::isWin).count();
        BigDecimal totalPnl = trades.stream().map(Trade::getRealizedPnl).reduce(BigDecimal.ZERO, BigDecimal::add);
        int qualifying = (int) signals.stream().filter(this::isQualifying).count();

        Map<String, BigDecimal> specific = new LinkedHashMap<>();
        addStrategySpecificMetrics(specific, trades, signals);

        return StrategyMetrics.builder()
                .strategyName(strategyName())
                .totalTrades(total)
                .winningTrades(wins)
                .losingTrades(total - wins)
                .winRate(RegimePerformanceCalculator.percentage(wins, total))
                .totalPnl(totalPnl)
                .avgTradePnl(total > 0
                        ? totalPnl.divide(BigDecimal.valueOf(total), 2, RoundingMode.HALF_UP)
                        : BigDecimal.ZERO)
                .regimePerformance(RegimePerformanceCalculator.breakdown(trades))
                .qualifyingSignals(qualifying)
                .profitableTrades(wins)
                .signalEfficiency(RegimePerformanceCalculator.percentage(wins, qualifying))
                .strategySpecific(specific)
                .build();
    }

    // ========================
    // HELPERS
    // ========================

    /** ENTER action with at least the configured confidence. */
    protected boolean isQualifying(Signal signal) {
        return signal != null && signal.isEntry() && signal.getConfidence() >= config.getMinConfidence();
    }

    /** Quote for the contract, or a {@link DataGapException}. */
    protected OptionQuote requireQuote(ContractSpec contract, Collection<OptionQuote> quotes) {
        return context.getPositionValuator().findQuote(contract, quotes).orElseThrow(() -> new DataGapException(contract));
    }

    /**
     * Builds a leg filled from the matching quote. The leg takes the quote's own
     * expiration so later marks match it exactly.
     */
    protected Leg openLeg(
            ContractSpec contract,
            LegSide side,
            int quantity,
            Collection<OptionQuote> quotes,
            double underlyingPrice,
            LocalDateTime asOf) {
        OptionQuote quote = requireQuote(contract, quotes);
        BigDecimal price = entryPrice(quote, side);
        return Leg.builder()
                .contract(quote.contract())
                .side(side)
                .quantity(quantity)
                .entryPrice(price)
                .entryVolatility(entryVolatility(quote, price, underlyingPrice, asOf))
                .build();
    }

    protected BigDecimal entryPrice(OptionQuote quote, LegSide side) {
        if (config.getFillModel() == EntryFillModel.CROSS_SPREAD) {
            BigDecimal crossed = side == LegSide.LONG ? quote.getAsk() : quote.getBid();
            if (crossed != null && crossed.signum() > 0) {
                return crossed;
            }
        }
        return quote.markPrice();
    }

    /** Quote IV when published, otherwise solved from the entry price. */
    protected double entryVolatility(OptionQuote quote, BigDecimal price, double underlyingPrice, LocalDateTime asOf) {
        PricingConfig pricing = context.getPricingConfig();
        if (quote.getImpliedVolatility() != null && quote.getImpliedVolatility().signum() > 0) {
            return quote.getImpliedVolatility().doubleValue();
        }
        double timeToExpiry = context.getPricingEngine().timeToExpiryYears(asOf, quote.getExpiration());
        return context.getVolatilitySolver()
                .solveOrDefault(
                        underlyingPrice,
                        quote.getStrike().doubleValue(),
                        timeToExpiry,
                        pricing.getRiskFreeRate(),
                        pricing.getDividendYield(),
                        price.doubleValue(),
                        quote.getType(),
                        pricing.getDefaultVolatility());
    }

    protected String nextPositionId() {
        return String.format("%s-%04d", strategyName(), positionSequence.incrementAndGet());
    }

    public ExitRules getExitRules() {
        return exitRules;
    }

    public BaseAdapterConfig getConfig() {
        return config;
    }

    protected void logDecision(String category, String message, Map<String, Object> details) {
        log.info("[{}] {} - {} | {}", strategyName(), category, message, details);
    }

    private static void validateCommon(BaseAdapterConfig config) {
        Map<String, Object> details = new LinkedHashMap<>();
        if (config.getQuantity() < 1) {
            details.put("quantity", config.getQuantity());
        }
        if (config.getMinConfidence() < 0 || config.getMinConfidence() > 100) {
            details.put("minConfidence", config.getMinConfidence());
        }
        if (config.getContractMultiplier() < 1) {
            details.put("contractMultiplier", config.getContractMultiplier());
        }
        if (config.getUnderlyingSymbol() == null || config.getUnderlyingSymbol().isBlank()) {
            details.put("underlyingSymbol", String.valueOf(config.getUnderlyingSymbol()));
        }
        if (!details.isEmpty()) {
            throw new ConfigurationException("Invalid adapter configuration: " + details.keySet(), details);
        }
    }
}
