package com.optionsbacktester.unit.strategy;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.optionsbacktester.config.PricingConfig;
import com.optionsbacktester.config.SimulationConfig;
import com.optionsbacktester.config.StrategyDefaultsConfig;
import com.optionsbacktester.core.processor.ImpliedVolatilitySolver;
import com.optionsbacktester.core.processor.OptionPricingEngine;
import com.optionsbacktester.domain.enums.StrategyType;
import com.optionsbacktester.exception.ConfigurationException;
import com.optionsbacktester.strategy.StrategyAdapterFactory;
import com.optionsbacktester.strategy.base.BaseAdapterConfig;
import com.optionsbacktester.strategy.base.BaseBacktestingAdapter;
import com.optionsbacktester.strategy.base.StrategyBacktestingAdapter;
import com.optionsbacktester.strategy.impl.FlyagonalAdapter;
import com.optionsbacktester.strategy.impl.FlyagonalConfig;
import com.optionsbacktester.strategy.impl.MomentumOptionAdapter;
import com.optionsbacktester.strategy.impl.MomentumOptionConfig;
import java.math.BigDecimal;
import java.time.Duration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class StrategyAdapterFactoryTest {

    private StrategyDefaultsConfig defaults;
    private StrategyAdapterFactory factory;

    @BeforeEach
    void setUp() {
        PricingConfig pricingConfig = new PricingConfig();
        OptionPricingEngine engine = new OptionPricingEngine(pricingConfig);
        defaults = new StrategyDefaultsConfig();
        factory = new StrategyAdapterFactory(
                engine, new ImpliedVolatilitySolver(engine), pricingConfig, new SimulationConfig(), defaults);
    }

    @Test
    @DisplayName("Creates a Flyagonal adapter with the configured thresholds")
    void createsFlyagonal() {
        StrategyBacktestingAdapter adapter = factory.create(StrategyType.FLYAGONAL, "SPX");

        assertThat(adapter).isInstanceOf(FlyagonalAdapter.class);
        assertThat(adapter.strategyType()).isEqualTo(StrategyType.FLYAGONAL);
        BaseBacktestingAdapter base = (BaseBacktestingAdapter) adapter;
        assertThat(base.getExitRules().getProfitTarget()).isEqualByComparingTo("750");
        assertThat(base.getExitRules().getMaxLoss()).isEqualByComparingTo("500");
        assertThat(base.getExitRules().getTargetHoldingPeriod()).isEqualTo(Duration.ofHours(108));
        assertThat(base.getExitRules().getMaxHoldingPeriod()).isEqualTo(Duration.ofDays(7));
        assertThat(base.getConfig().getUnderlyingSymbol()).isEqualTo("SPX");
    }

    @Test
    @DisplayName("Configured defaults flow into new adapters")
    void usesConfiguredDefaults() {
        defaults.getMomentum().setProfitTarget(BigDecimal.valueOf(400));

        BaseBacktestingAdapter adapter = (BaseBacktestingAdapter) factory.create(StrategyType.MOMENTUM, "SPY");

        assertThat(adapter).isInstanceOf(MomentumOptionAdapter.class);
        assertThat(adapter.getExitRules().getProfitTarget()).isEqualByComparingTo("400");
        assertThat(adapter.getExitRules().getMaxHoldingPeriod()).isEqualTo(Duration.ofMinutes(210));
    }

    @Test
    @DisplayName("Static Flyagonal defaults match the configured ones")
    void staticDefaultsMatch() {
        BaseAdapterConfig configured = factory.defaultConfig(StrategyType.FLYAGONAL, "SPX");
        FlyagonalConfig documented = FlyagonalConfig.defaults("SPX");

        assertThat(configured.toExitRules()).isEqualTo(documented.toExitRules());
        assertThat(configured.getMinConfidence()).isEqualTo(documented.getMinConfidence());
    }

    @Test
    @DisplayName("Rejects a config of the wrong family")
    void rejectsMismatchedConfig() {
        assertThatThrownBy(() -> factory.create(StrategyType.FLYAGONAL, MomentumOptionConfig.defaults("SPX")))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("FlyagonalConfig");
    }

    @Test
    @DisplayName("Rejects a missing strategy type")
    void rejectsNullType() {
        assertThatThrownBy(() -> factory.create(null, FlyagonalConfig.defaults("SPX")))
                .isInstanceOf(ConfigurationException.class);
    }

    @Test
    @DisplayName("Rejects invalid thresholds before any adapter exists")
    void rejectsInvalidThresholds() {
        FlyagonalConfig config = FlyagonalConfig.defaults("SPX");
        config.setTargetHoldingPeriod(Duration.ofDays(10));

        assertThatThrownBy(() -> factory.create(StrategyType.FLYAGONAL, config))
                .isInstanceOf(ConfigurationException.class);
    }

    @Test
    @DisplayName("Rejects an out-of-range confidence floor")
    void rejectsBadConfidence() {
        FlyagonalConfig config = FlyagonalConfig.defaults("SPX");
        config.setMinConfidence(101);

        assertThatThrownBy(() -> factory.create(StrategyType.FLYAGONAL, config))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("minConfidence");
    }
}
