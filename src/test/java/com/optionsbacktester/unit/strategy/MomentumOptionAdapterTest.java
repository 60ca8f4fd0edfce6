package com.optionsbacktester.unit.strategy;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.optionsbacktester.config.PricingConfig;
import com.optionsbacktester.config.SimulationConfig;
import com.optionsbacktester.config.StrategyDefaultsConfig;
import com.optionsbacktester.core.processor.ImpliedVolatilitySolver;
import com.optionsbacktester.core.processor.OptionPricingEngine;
import com.optionsbacktester.domain.enums.EntryFillModel;
import com.optionsbacktester.domain.enums.ExitReason;
import com.optionsbacktester.domain.enums.LegSide;
import com.optionsbacktester.domain.enums.OptionType;
import com.optionsbacktester.domain.enums.SignalAction;
import com.optionsbacktester.domain.enums.StrategyType;
import com.optionsbacktester.domain.model.Bar;
import com.optionsbacktester.domain.model.ContractSpec;
import com.optionsbacktester.domain.model.Leg;
import com.optionsbacktester.domain.model.OptionQuote;
import com.optionsbacktester.domain.model.Position;
import com.optionsbacktester.domain.model.Signal;
import com.optionsbacktester.domain.model.Trade;
import com.optionsbacktester.exception.ConfigurationException;
import com.optionsbacktester.strategy.StrategyAdapterFactory;
import com.optionsbacktester.strategy.base.StrategyBacktestingAdapter;
import com.optionsbacktester.strategy.base.StrategyMetrics;
import com.optionsbacktester.strategy.impl.MomentumOptionConfig;
import java.math.BigDecimal;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class MomentumOptionAdapterTest {

    private static final LocalDateTime ENTRY = LocalDateTime.of(2025, 9, 10, 9, 30);
    private static final LocalDate EXPIRY = LocalDate.of(2025, 9, 10);
    private static final ContractSpec ATM_CALL = ContractSpec.call(5000, EXPIRY);

    private StrategyAdapterFactory factory;
    private StrategyBacktestingAdapter adapter;

    @BeforeEach
    void setUp() {
        PricingConfig pricingConfig = new PricingConfig();
        OptionPricingEngine engine = new OptionPricingEngine(pricingConfig);
        factory = new StrategyAdapterFactory(
                engine, new ImpliedVolatilitySolver(engine), pricingConfig, new SimulationConfig(),
                new StrategyDefaultsConfig());
        adapter = factory.create(StrategyType.MOMENTUM, "SPY");
    }

    private static OptionQuote callQuote(String last) {
        BigDecimal price = new BigDecimal(last);
        return OptionQuote.builder()
                .type(OptionType.CALL)
                .strike(BigDecimal.valueOf(5000))
                .expiration(EXPIRY)
                .bid(price.subtract(new BigDecimal("0.05")))
                .ask(price.add(new BigDecimal("0.05")))
                .last(price)
                .impliedVolatility(new BigDecimal("0.04"))
                .build();
    }

    private static Bar bar(LocalDateTime time) {
        return Bar.builder().timestamp(time).open(5000).high(5000).low(5000).close(5000).build();
    }

    private static Signal.SignalBuilder enterCall() {
        return Signal.builder()
                .action(SignalAction.ENTER)
                .confidence(70)
                .targetContracts(List.of(ATM_CALL))
                .timestamp(ENTRY);
    }

    @Nested
    @DisplayName("Contract universe")
    class ContractUniverse {

        @Test
        @DisplayName("Requests calls and puts two strikes either side of ATM, same-day expiry")
        void atmNeighbourhood() {
            Set<ContractSpec> contracts = adapter.requiredContracts(5000.4, ENTRY);

            assertThat(contracts).hasSize(10);
            assertThat(contracts).contains(
                    ContractSpec.call(4998, EXPIRY),
                    ContractSpec.put(5000, EXPIRY),
                    ContractSpec.call(5002, EXPIRY));
            assertThat(contracts).doesNotContain(ContractSpec.call(5003, EXPIRY));
        }
    }

    @Nested
    @DisplayName("Entry")
    class EntryTests {

        @Test
        @DisplayName("Thresholds scale with the premium paid")
        void percentThresholds() {
            Position position = adapter.buildPosition(enterCall().build(), List.of(callQuote("2.50")), 5000)
                    .orElseThrow();

            assertThat(position.getEntryCost()).isEqualByComparingTo("250");
            assertThat(position.getMetadata().getProfitTarget()).isEqualByComparingTo("250");
            assertThat(position.getMetadata().getMaxLoss()).isEqualByComparingTo("125");
        }

        @Test
        @DisplayName("Signal stop loss overrides the percentage")
        void signalStopLoss() {
            Signal signal = enterCall().stopLoss(BigDecimal.valueOf(50)).build();

            Position position = adapter.buildPosition(signal, List.of(callQuote("2.50")), 5000).orElseThrow();

            assertThat(position.getMetadata().getMaxLoss()).isEqualByComparingTo("50");
            assertThat(position.getMetadata().getProfitTarget()).isEqualByComparingTo("250");
        }

        @Test
        @DisplayName("Only signals naming exactly one contract are accepted")
        void exactlyOneTarget() {
            Signal none = enterCall().targetContracts(List.of()).build();
            Signal two = enterCall().targetContracts(List.of(ATM_CALL, ContractSpec.put(5000, EXPIRY))).build();

            assertThat(adapter.validateSignal(none)).isFalse();
            assertThat(adapter.validateSignal(two)).isFalse();
            assertThat(adapter.validateSignal(enterCall().build())).isTrue();
        }

        @Test
        @DisplayName("Crossing the spread pays the ask and opens slightly under water")
        void crossSpreadFill() {
            MomentumOptionConfig config = MomentumOptionConfig.builder()
                    .underlyingSymbol("SPY")
                    .fillModel(EntryFillModel.CROSS_SPREAD)
                    .profitTarget(MomentumOptionConfig.DEFAULT_PROFIT_TARGET)
                    .maxLoss(MomentumOptionConfig.DEFAULT_MAX_LOSS)
                    .maxHoldingPeriod(MomentumOptionConfig.DEFAULT_MAX_HOLD)
                    .build();
            StrategyBacktestingAdapter crossing = factory.create(StrategyType.MOMENTUM, config);

            Position position = crossing.buildPosition(enterCall().build(), List.of(callQuote("2.50")), 5000)
                    .orElseThrow();

            // Paid 2.55 ask, marked at 2.50 last
            assertThat(position.getEntryCost()).isEqualByComparingTo("255");
            assertThat(position.getUnrealizedPnl()).isEqualByComparingTo("-5");
        }
    }

    @Nested
    @DisplayName("Exit")
    class ExitTests {

        @Test
        @DisplayName("Doubling the premium hits the profit target")
        void profitTarget() {
            Position position = adapter.buildPosition(enterCall().build(), List.of(callQuote("2.50")), 5000)
                    .orElseThrow();
            List<OptionQuote> later = List.of(callQuote("5.00"));

            adapter.updatePosition(position, bar(ENTRY.plusMinutes(30)), later);

            assertThat(position.getUnrealizedPnl()).isEqualByComparingTo("250");
            assertThat(adapter.evaluateExit(position, bar(ENTRY.plusMinutes(30)), later, 30))
                    .contains(ExitReason.PROFIT_TARGET);
        }

        @Test
        @DisplayName("Halving the premium hits the stop loss")
        void stopLoss() {
            Position position = adapter.buildPosition(enterCall().build(), List.of(callQuote("2.50")), 5000)
                    .orElseThrow();
            List<OptionQuote> later = List.of(callQuote("1.25"));

            adapter.updatePosition(position, bar(ENTRY.plusMinutes(30)), later);

            assertThat(adapter.shouldExit(position, bar(ENTRY.plusMinutes(30)), later, 30)).isTrue();
            assertThat(adapter.evaluateExit(position, bar(ENTRY.plusMinutes(30)), later, 30))
                    .contains(ExitReason.STOP_LOSS);
        }

        @Test
        @DisplayName("A flat position closes after 210 minutes")
        void maxHold() {
            Position position = adapter.buildPosition(enterCall().build(), List.of(callQuote("2.50")), 5000)
                    .orElseThrow();
            List<OptionQuote> flat = List.of(callQuote("2.50"));

            assertThat(adapter.evaluateExit(position, bar(ENTRY.plusMinutes(209)), flat, 209)).isEmpty();
            assertThat(adapter.evaluateExit(position, bar(ENTRY.plusMinutes(210)), flat, 210))
                    .contains(ExitReason.MAX_HOLD_REACHED);
        }
    }

    @Nested
    @DisplayName("Configuration and metrics")
    class ConfigurationAndMetrics {

        @Test
        @DisplayName("A zero strike interval is rejected")
        void rejectsZeroInterval() {
            MomentumOptionConfig config = MomentumOptionConfig.defaults("SPY");
            config.setStrikeInterval(0);

            assertThatThrownBy(() -> factory.create(StrategyType.MOMENTUM, config))
                    .isInstanceOf(ConfigurationException.class);
        }

        @Test
        @DisplayName("Splits trades by option type")
        void callPutSplit() {
            Trade callWin = trade("momentum-0001", ContractSpec.call(5000, EXPIRY), "120", 30);
            Trade callLoss = trade("momentum-0002", ContractSpec.call(5001, EXPIRY), "-60", 90);
            Trade putWin = trade("momentum-0003", ContractSpec.put(4999, EXPIRY), "40", 60);

            StrategyMetrics metrics = adapter.strategyMetrics(List.of(callWin, callLoss, putWin), List.of());

            assertThat(metrics.getStrategySpecific().get("callTrades")).isEqualByComparingTo("2");
            assertThat(metrics.getStrategySpecific().get("putTrades")).isEqualByComparingTo("1");
            assertThat(metrics.getStrategySpecific().get("callWinRate")).isEqualByComparingTo("50");
            assertThat(metrics.getStrategySpecific().get("putWinRate")).isEqualByComparingTo("100");
            assertThat(metrics.getStrategySpecific().get("avgHoldingMinutes")).isEqualByComparingTo("60");
            assertThat(metrics.getWinRate()).isEqualByComparingTo("66.67");
        }

        private Trade trade(String id, ContractSpec contract, String pnl, long minutes) {
            return Trade.builder()
                    .positionId(id)
                    .strategyName("momentum")
                    .entryTime(ENTRY)
                    .exitTime(ENTRY.plusMinutes(minutes))
                    .entryCost(BigDecimal.valueOf(200))
                    .exitValue(BigDecimal.valueOf(200).add(new BigDecimal(pnl)))
                    .realizedPnl(new BigDecimal(pnl))
                    .holdingDuration(Duration.ofMinutes(minutes))
                    .exitReason(ExitReason.MAX_HOLD_REACHED)
                    .legs(List.of(Leg.builder()
                            .contract(contract)
                            .side(LegSide.LONG)
                            .quantity(1)
                            .entryPrice(BigDecimal.valueOf(2))
                            .build()))
                    .build();
        }
    }
}
