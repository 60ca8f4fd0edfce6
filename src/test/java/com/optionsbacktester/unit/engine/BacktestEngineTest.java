package com.optionsbacktester.unit.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

import com.optionsbacktester.config.MarketDataConfig;
import com.optionsbacktester.config.PricingConfig;
import com.optionsbacktester.config.SimulationConfig;
import com.optionsbacktester.config.StrategyDefaultsConfig;
import com.optionsbacktester.core.engine.BacktestEngine;
import com.optionsbacktester.core.engine.BacktestResult;
import com.optionsbacktester.core.engine.BacktestSettings;
import com.optionsbacktester.core.processor.ImpliedVolatilitySolver;
import com.optionsbacktester.core.processor.OptionPricingEngine;
import com.optionsbacktester.domain.enums.BacktestStatus;
import com.optionsbacktester.domain.enums.ExitReason;
import com.optionsbacktester.domain.enums.OptionType;
import com.optionsbacktester.domain.enums.SignalAction;
import com.optionsbacktester.domain.enums.StrategyType;
import com.optionsbacktester.domain.model.Bar;
import com.optionsbacktester.domain.model.ContractSpec;
import com.optionsbacktester.domain.model.OptionQuote;
import com.optionsbacktester.domain.model.Signal;
import com.optionsbacktester.domain.model.Trade;
import com.optionsbacktester.exception.ConfigurationException;
import com.optionsbacktester.exception.MarketDataException;
import com.optionsbacktester.exception.UnrecoverableDataException;
import com.optionsbacktester.marketdata.FallbackQuoteProvider;
import com.optionsbacktester.marketdata.QuoteProvider;
import com.optionsbacktester.marketdata.RecordedQuoteProvider;
import com.optionsbacktester.marketdata.ScheduledSignalSource;
import com.optionsbacktester.marketdata.SignalSource;
import com.optionsbacktester.reporting.StrategyPerformanceCalculator;
import com.optionsbacktester.strategy.StrategyAdapterFactory;
import com.optionsbacktester.strategy.base.StrategyBacktestingAdapter;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Replays short intraday scripts through the momentum adapter: one ATM call bought at
 * 2.00 (entry cost 200, target +200, stop -100) with quotes scripted per bar.
 */
class BacktestEngineTest {

    private static final LocalDate DAY = LocalDate.of(2025, 9, 10);
    private static final LocalDateTime OPEN = DAY.atTime(9, 30);
    private static final ContractSpec ATM_CALL = ContractSpec.call(5000, DAY);
    private static final BigDecimal CAPITAL = BigDecimal.valueOf(100_000);

    private StrategyAdapterFactory factory;
    private BacktestEngine engine;

    @BeforeEach
    void setUp() {
        PricingConfig pricingConfig = new PricingConfig();
        OptionPricingEngine pricingEngine = new OptionPricingEngine(pricingConfig);
        factory = new StrategyAdapterFactory(
                pricingEngine, new ImpliedVolatilitySolver(pricingEngine), pricingConfig, new SimulationConfig(),
                new StrategyDefaultsConfig());
        engine = new BacktestEngine(new StrategyPerformanceCalculator());
    }

    // ========================
    // FIXTURES
    // ========================

    /** Serves the ATM call at a scripted price per bar; null means no quote, "FAIL" a provider error. */
    private static class ScriptedQuotes implements QuoteProvider {

        private final Map<LocalDateTime, String> prices = new HashMap<>();

        ScriptedQuotes at(int barIndex, String price) {
            prices.put(time(barIndex), price);
            return this;
        }

        @Override
        public String name() {
            return "scripted";
        }

        @Override
        public List<OptionQuote> fetch(Set<ContractSpec> contracts, Bar bar) {
            String price = prices.get(bar.getTimestamp());
            if ("FAIL".equals(price)) {
                throw new MarketDataException("scripted outage");
            }
            if (price == null) {
                return List.of();
            }
            return List.of(OptionQuote.builder()
                    .type(OptionType.CALL)
                    .strike(BigDecimal.valueOf(5000))
                    .expiration(DAY)
                    .last(new BigDecimal(price))
                    .impliedVolatility(new BigDecimal("0.04"))
                    .build());
        }
    }

    private static LocalDateTime time(int barIndex) {
        return OPEN.plusMinutes(5L * barIndex);
    }

    private static List<Bar> bars(int count) {
        List<Bar> bars = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            bars.add(bar(i, 5000));
        }
        return bars;
    }

    private static Bar bar(int index, double close) {
        return Bar.builder()
                .timestamp(time(index))
                .open(5000)
                .high(5000)
                .low(5000)
                .close(close)
                .vix(18.0)
                .build();
    }

    private static SignalSource enterAt(int... barIndexes) {
        List<Signal> signals = new ArrayList<>();
        for (int index : barIndexes) {
            signals.add(Signal.builder()
                    .action(SignalAction.ENTER)
                    .confidence(80)
                    .targetContracts(List.of(ATM_CALL))
                    .timestamp(time(index))
                    .build());
        }
        return new ScheduledSignalSource(signals);
    }

    private StrategyBacktestingAdapter momentum() {
        return factory.create(StrategyType.MOMENTUM, "SPY");
    }

    private BacktestResult run(List<Bar> bars, SignalSource signals, QuoteProvider quotes) {
        return engine.run(momentum(), bars, signals, quotes, BacktestSettings.builder().runId("test-run").build());
    }

    private static BigDecimal realizedTotal(BacktestResult result) {
        return result.getTrades().stream().map(Trade::getRealizedPnl).reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    // ========================
    // EXITS
    // ========================

    @Nested
    @DisplayName("Exits")
    class Exits {

        @Test
        @DisplayName("Closes at the profit target and books the value into cash")
        void profitTarget() {
            ScriptedQuotes quotes = new ScriptedQuotes().at(0, "2.00").at(1, "3.00").at(2, "4.00").at(3, "4.00");

            BacktestResult result = run(bars(4), enterAt(0), quotes);

            assertThat(result.getStatus()).isEqualTo(BacktestStatus.COMPLETED);
            assertThat(result.getTrades()).hasSize(1);
            Trade trade = result.getTrades().get(0);
            assertThat(trade.getPositionId()).isEqualTo("momentum-0001");
            assertThat(trade.getExitReason()).isEqualTo(ExitReason.PROFIT_TARGET);
            assertThat(trade.getExitTime()).isEqualTo(time(2));
            assertThat(trade.getRealizedPnl()).isEqualByComparingTo("200");
            assertThat(trade.getHoldingMinutes()).isEqualTo(10);
            assertThat(result.getFinalCash()).isEqualByComparingTo("100200");
            assertThat(result.getMaxDrawdown()).isEqualByComparingTo("0");
            assertThat(result.getBarsProcessed()).isEqualTo(4);
            assertThat(result.getSignalsReceived()).isEqualTo(1);
        }

        @Test
        @DisplayName("Closes at the stop loss")
        void stopLoss() {
            ScriptedQuotes quotes = new ScriptedQuotes().at(0, "2.00").at(1, "1.00").at(2, "1.00");

            BacktestResult result = run(bars(3), enterAt(0), quotes);

            assertThat(result.getTrades()).extracting(Trade::getExitReason).containsExactly(ExitReason.STOP_LOSS);
            assertThat(result.getFinalCash()).isEqualByComparingTo("99900");
            // Equity fell from 100000 to 99900
            assertThat(result.getMaxDrawdown()).isEqualByComparingTo("100");
        }

        @Test
        @DisplayName("Positions open after the last bar close at their last valuation")
        void endOfPeriod() {
            ScriptedQuotes quotes = new ScriptedQuotes().at(0, "2.00").at(1, "2.50").at(2, "2.50");

            BacktestResult result = run(bars(3), enterAt(0), quotes);

            Trade trade = result.getTrades().get(0);
            assertThat(trade.getExitReason()).isEqualTo(ExitReason.END_OF_PERIOD);
            assertThat(trade.getExitTime()).isEqualTo(time(2));
            assertThat(trade.getRealizedPnl()).isEqualByComparingTo("50");
            assertThat(result.getOpenPositionsAtAbort()).isEmpty();
        }

        @Test
        @DisplayName("End-of-period closes are timed at the final bar even when trailing bars were skipped")
        void endOfPeriodAfterSkippedBars() {
            ScriptedQuotes quotes = new ScriptedQuotes().at(0, "2.00").at(1, "2.50").at(2, "FAIL").at(3, "FAIL");

            BacktestResult result = run(bars(4), enterAt(0), quotes);

            Trade trade = result.getTrades().get(0);
            assertThat(result.getBarsSkipped()).isEqualTo(2);
            assertThat(trade.getExitReason()).isEqualTo(ExitReason.END_OF_PERIOD);
            assertThat(trade.getExitTime()).isEqualTo(time(3));
            assertThat(trade.getHoldingMinutes()).isEqualTo(15);
            // Valued at the last successful mark
            assertThat(trade.getRealizedPnl()).isEqualByComparingTo("50");
        }

        @Test
        @DisplayName("Re-enters after a close when the next signal arrives")
        void reentersAfterClose() {
            ScriptedQuotes quotes = new ScriptedQuotes()
                    .at(0, "2.00").at(1, "4.00").at(2, "2.00").at(3, "1.00");

            BacktestResult result = run(bars(4), enterAt(0, 1, 2), quotes);

            // Bar 1 closes the first position at the target, then the bar 1 signal opens a
            // second at 4.00; it stops out on bar 2. Bar 2's signal opens a third at 2.00.
            assertThat(result.getTrades()).extracting(Trade::getPositionId)
                    .containsExactly("momentum-0001", "momentum-0002", "momentum-0003");
            assertThat(result.getTrades()).extracting(Trade::getExitReason).containsExactly(
                    ExitReason.PROFIT_TARGET, ExitReason.STOP_LOSS, ExitReason.STOP_LOSS);
        }
    }

    // ========================
    // INVARIANTS
    // ========================

    @Nested
    @DisplayName("Accounting invariants")
    class Invariants {

        @Test
        @DisplayName("Final cash equals initial capital plus realized P&L")
        void cashConservation() {
            ScriptedQuotes quotes = new ScriptedQuotes()
                    .at(0, "2.00").at(1, "4.00").at(2, "2.00").at(3, "1.00");

            BacktestResult result = run(bars(4), enterAt(0, 1, 2), quotes);

            assertThat(result.getFinalCash()).isEqualByComparingTo(CAPITAL.add(realizedTotal(result)));
            assertThat(result.getReport().getTotalTrades()).isEqualTo(result.getTrades().size());
            assertThat(result.getReport().getTotalPnl()).isEqualByComparingTo(realizedTotal(result));
        }

        @Test
        @DisplayName("Same inputs give the same ledger")
        void deterministic() {
            ScriptedQuotes quotes = new ScriptedQuotes().at(0, "2.00").at(1, "2.60").at(2, "1.40").at(3, "3.10");

            BacktestResult first = run(bars(4), enterAt(0, 2), quotes);
            BacktestResult second = run(bars(4), enterAt(0, 2), quotes);

            assertThat(second.getTrades()).extracting(Trade::getRealizedPnl)
                    .usingElementComparator(BigDecimal::compareTo)
                    .containsExactlyElementsOf(first.getTrades().stream().map(Trade::getRealizedPnl).toList());
            assertThat(second.getTrades()).extracting(Trade::getExitTime)
                    .containsExactlyElementsOf(first.getTrades().stream().map(Trade::getExitTime).toList());
            assertThat(second.getFinalCash()).isEqualByComparingTo(first.getFinalCash());
        }

        @Test
        @DisplayName("Every opened position appears exactly once in the ledger")
        void ledgerCompleteness() {
            // 0001 and 0002 hit their +200 target on bar 2; 0003 opens there at 4.00 and
            // is still open after the last bar
            ScriptedQuotes quotes = new ScriptedQuotes()
                    .at(0, "2.00").at(1, "2.00").at(2, "4.00").at(3, "3.00");
            BacktestSettings settings = BacktestSettings.builder().maxConcurrentPositions(3).build();

            BacktestResult result = engine.run(momentum(), bars(4), enterAt(0, 1, 2), quotes, settings);

            assertThat(result.getSignalsReceived()).isEqualTo(3);
            assertThat(result.getTrades()).extracting(Trade::getPositionId)
                    .doesNotHaveDuplicates()
                    .containsExactlyInAnyOrder("momentum-0001", "momentum-0002", "momentum-0003");
            assertThat(result.getTrades()).extracting(Trade::getExitReason).containsExactly(
                    ExitReason.PROFIT_TARGET, ExitReason.PROFIT_TARGET, ExitReason.END_OF_PERIOD);
            assertThat(result.getOpenPositionsAtAbort()).isEmpty();
            assertThat(result.getFinalCash()).isEqualByComparingTo(CAPITAL.add(realizedTotal(result)));
        }

        @Test
        @DisplayName("A long recorded replay never skips a bar, however fast it runs")
        void longRecordedReplayIsNotThrottled() {
            List<Bar> bars = new ArrayList<>();
            Map<LocalDateTime, List<OptionQuote>> snapshots = new HashMap<>();
            for (int i = 0; i < 3000; i++) {
                Bar bar = bar(i, 5000);
                bars.add(bar);
                snapshots.put(bar.getTimestamp(), List.of(OptionQuote.builder()
                        .type(OptionType.CALL)
                        .strike(BigDecimal.valueOf(5000))
                        .expiration(bar.getTimestamp().toLocalDate())
                        .last(new BigDecimal("2.00"))
                        .build()));
            }
            QuoteProvider quotes = new FallbackQuoteProvider(
                    Map.of(RecordedQuoteProvider.NAME, new RecordedQuoteProvider(snapshots, 1)), new MarketDataConfig());

            BacktestResult result = run(bars, enterAt(), quotes);

            assertThat(result.getBarsSkipped()).isZero();
            assertThat(result.getBarsProcessed()).isEqualTo(3000);
        }

        @Test
        @DisplayName("A missing leg quote is estimated, counted and flagged on the trade")
        void degradedValuation() {
            // Bar 1 has no quote: the call is estimated from its 4% entry volatility
            ScriptedQuotes quotes = new ScriptedQuotes().at(0, "2.00").at(2, "4.00");

            BacktestResult result = run(bars(3), enterAt(0), quotes);

            assertThat(result.getDegradedValuations()).isEqualTo(1);
            assertThat(result.getTrades()).hasSize(1);
            assertThat(result.getTrades().get(0).isEstimated()).isTrue();
            assertThat(result.getTrades().get(0).getExitReason()).isEqualTo(ExitReason.PROFIT_TARGET);
            assertThat(result.getReport().getEstimatedTrades()).isEqualTo(1);
        }
    }

    // ========================
    // RUN CONTROL
    // ========================

    @Nested
    @DisplayName("Run control")
    class RunControl {

        @Test
        @DisplayName("A provider failure skips the bar without aborting the run")
        void providerFailureSkipsBar() {
            ScriptedQuotes quotes = new ScriptedQuotes().at(0, "2.00").at(1, "FAIL").at(2, "4.00");

            BacktestResult result = run(bars(3), enterAt(0), quotes);

            assertThat(result.getBarsSkipped()).isEqualTo(1);
            assertThat(result.getBarsProcessed()).isEqualTo(2);
            assertThat(result.getTrades().get(0).getExitTime()).isEqualTo(time(2));
        }

        @Test
        @DisplayName("Warm-up bars are never traded")
        void warmup() {
            ScriptedQuotes quotes = new ScriptedQuotes().at(0, "2.00").at(1, "2.00").at(2, "2.00");
            BacktestSettings settings = BacktestSettings.builder().warmupBars(2).build();

            BacktestResult result = engine.run(momentum(), bars(3), enterAt(0, 1), quotes, settings);

            assertThat(result.getTrades()).isEmpty();
            assertThat(result.getSignalsReceived()).isZero();
            assertThat(result.getBarsProcessed()).isEqualTo(1);
            assertThat(result.getFinalCash()).isEqualByComparingTo(CAPITAL);
        }

        @Test
        @DisplayName("Entries respect the minimum bar spacing")
        void entrySpacing() {
            ScriptedQuotes quotes = new ScriptedQuotes()
                    .at(0, "2.00").at(1, "4.00").at(2, "2.00").at(3, "2.00");
            BacktestSettings settings = BacktestSettings.builder().minBarsBetweenEntries(2).build();

            BacktestResult result = engine.run(momentum(), bars(4), enterAt(0, 1, 2), quotes, settings);

            // Bar 1 is one bar after the first entry, so its signal is never requested
            assertThat(result.getSignalsReceived()).isEqualTo(2);
            assertThat(result.getTrades()).extracting(Trade::getEntryTime).containsExactly(time(0), time(2));
        }

        @Test
        @DisplayName("Invalid settings fail before any bar is read")
        void invalidSettings() {
            BacktestSettings settings = BacktestSettings.builder().maxConcurrentPositions(0).build();

            assertThatThrownBy(() -> engine.run(momentum(), bars(2), enterAt(0), new ScriptedQuotes(), settings))
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessageContaining("maxConcurrentPositions");
        }

        @Test
        @DisplayName("A malformed bar aborts with the ledger recorded so far")
        void abortCarriesPartialLedger() {
            ScriptedQuotes quotes = new ScriptedQuotes().at(0, "2.00").at(1, "4.00").at(2, "2.00");
            List<Bar> bars = new ArrayList<>(bars(2));
            bars.add(bar(2, Double.NaN));

            UnrecoverableDataException error = catchThrowableOfType(
                    () -> run(bars, enterAt(0, 1), quotes), UnrecoverableDataException.class);

            assertThat(error).isNotNull();
            assertThat(error.hasPartialResult()).isTrue();
            BacktestResult partial = error.getPartialResult();
            assertThat(partial.getStatus()).isEqualTo(BacktestStatus.ABORTED);
            assertThat(partial.getId()).isEqualTo("test-run");
            assertThat(partial.getTrades()).extracting(Trade::getExitReason).containsExactly(ExitReason.PROFIT_TARGET);
            // The bar 1 re-entry is left open, not force-closed
            assertThat(partial.getOpenPositionsAtAbort()).hasSize(1);
            assertThat(partial.getFailureMessage()).contains("finite and positive");
        }

        @Test
        @DisplayName("Out-of-order timestamps abort the run")
        void nonMonotonicTimestamps() {
            List<Bar> bars = List.of(bar(1, 5000), bar(0, 5000));

            assertThatThrownBy(() -> run(bars, enterAt(), new ScriptedQuotes()))
                    .isInstanceOf(UnrecoverableDataException.class)
                    .hasMessageContaining("strictly increasing");
        }
    }
}
