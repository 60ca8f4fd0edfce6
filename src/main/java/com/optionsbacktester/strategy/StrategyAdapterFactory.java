package com.optionsbacktester.strategy;

import com.optionsbacktester.config.PricingConfig;
import com.optionsbacktester.config.SimulationConfig;
import com.optionsbacktester.config.StrategyDefaultsConfig;
import com.optionsbacktester.core.processor.ImpliedVolatilitySolver;
import com.optionsbacktester.core.processor.OptionPricingEngine;
import com.optionsbacktester.core.valuation.LegValueEstimator;
import com.optionsbacktester.core.valuation.PositionValuator;
import com.optionsbacktester.core.valuation.SimulatedLegEstimator;
import com.optionsbacktester.core.valuation.TheoreticalLegEstimator;
import com.optionsbacktester.domain.enums.StrategyType;
import com.optionsbacktester.exception.ConfigurationException;
import com.optionsbacktester.strategy.base.AdapterContext;
import com.optionsbacktester.strategy.base.BaseAdapterConfig;
import com.optionsbacktester.strategy.base.StrategyBacktestingAdapter;
import com.optionsbacktester.strategy.impl.FlyagonalAdapter;
import com.optionsbacktester.strategy.impl.FlyagonalConfig;
import com.optionsbacktester.strategy.impl.MomentumOptionAdapter;
import com.optionsbacktester.strategy.impl.MomentumOptionConfig;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Creates backtesting adapters from type + config.
 *
 * <p><b>Adding a new strategy family (4-step process):</b>
 * <ol>
 *   <li>Create the adapter class extending BaseBacktestingAdapter</li>
 *   <li>Create the config class extending BaseAdapterConfig</li>
 *   <li>Add a case in {@link #create(StrategyType, BaseAdapterConfig)} and
 *       {@link #defaultConfig(StrategyType, String)}</li>
 *   <li>Add the type to {@link StrategyType}</li>
 * </ol>
 *
 * <p>Adapters are plain Java objects with per-run state (the position id sequence and
 * the valuation services), so a new instance is created for every backtest.
 */
@Component
public class StrategyAdapterFactory {

    private static final Logger log = LoggerFactory.getLogger(StrategyAdapterFactory.class);

    private final OptionPricingEngine pricingEngine;
    private final ImpliedVolatilitySolver volatilitySolver;
    private final PricingConfig pricingConfig;
    private final SimulationConfig simulationConfig;
    private final StrategyDefaultsConfig defaults;

    public StrategyAdapterFactory(
            OptionPricingEngine pricingEngine,
            ImpliedVolatilitySolver volatilitySolver,
            PricingConfig pricingConfig,
            SimulationConfig simulationConfig,
            StrategyDefaultsConfig defaults) {
        this.pricingEngine = pricingEngine;
        this.volatilitySolver = volatilitySolver;
        this.pricingConfig = pricingConfig;
        this.simulationConfig = simulationConfig;
        this.defaults = defaults;
    }

    /** Creates an adapter with the configured defaults for the underlying. */
    public StrategyBacktestingAdapter create(StrategyType type, String underlyingSymbol) {
        return create(type, defaultConfig(type, underlyingSymbol));
    }

    /**
     * Creates an adapter for the given type and config.
     *
     * @throws ConfigurationException if the config does not match the type or its thresholds are invalid
     */
    public StrategyBacktestingAdapter create(StrategyType type, BaseAdapterConfig config) {
        if (type == null) {
            throw new ConfigurationException("Strategy type is required");
        }
        AdapterContext context = newContext();
        StrategyBacktestingAdapter adapter = switch (type) {
            case FLYAGONAL -> new FlyagonalAdapter(asConfig(config, FlyagonalConfig.class), context);
            case MOMENTUM -> new MomentumOptionAdapter(asConfig(config, MomentumOptionConfig.class), context);
        };
        log.info("Created adapter: type={}, name={}, underlying={}", type, adapter.strategyName(), config.getUnderlyingSymbol());
        return adapter;
    }

    public BaseAdapterConfig defaultConfig(StrategyType type, String underlyingSymbol) {
        return switch (type) {
            case FLYAGONAL -> {
                StrategyDefaultsConfig.Flyagonal f = defaults.getFlyagonal();
                yield FlyagonalConfig.builder()
                        .underlyingSymbol(underlyingSymbol)
                        .fillModel(defaults.getFillModel())
                        .quantity(f.getQuantity())
                        .minConfidence(f.getMinConfidence())
                        .maxLoss(f.getMaxLoss())
                        .profitTarget(f.getProfitTarget())
                        .targetHoldingPeriod(f.getTargetHoldingPeriod())
                        .maxHoldingPeriod(f.getMaxHoldingPeriod())
                        .minProfitZoneWidth(f.getMinProfitZoneWidth())
                        .build();
            }
            case MOMENTUM -> {
                StrategyDefaultsConfig.Momentum m = defaults.getMomentum();
                yield MomentumOptionConfig.builder()
                        .underlyingSymbol(underlyingSymbol)
                        .fillModel(defaults.getFillModel())
                        .quantity(m.getQuantity())
                        .minConfidence(m.getMinConfidence())
                        .stopLossPercent(m.getStopLossPercent())
                        .takeProfitPercent(m.getTakeProfitPercent())
                        .maxLoss(m.getMaxLoss())
                        .profitTarget(m.getProfitTarget())
                        .maxHoldingPeriod(m.getMaxHoldingPeriod())
                        .strikeInterval(m.getStrikeInterval())
                        .strikesAroundAtm(m.getStrikesAroundAtm())
                        .expiryDaysAhead(m.getExpiryDaysAhead())
                        .build();
            }
        };
    }

    /** Fresh valuation services for one run; the simulation estimator is reseeded each time. */
    AdapterContext newContext() {
        LegValueEstimator estimator = new TheoreticalLegEstimator(pricingEngine, pricingConfig);
        if (simulationConfig.isEnabled()) {
            estimator = new SimulatedLegEstimator(
                    estimator, simulationConfig.getSeed(), simulationConfig.getTimeValueNoise());
        }
        return AdapterContext.builder()
                .pricingEngine(pricingEngine)
                .volatilitySolver(volatilitySolver)
                .positionValuator(new PositionValuator(estimator, pricingConfig))
                .pricingConfig(pricingConfig)
                .build();
    }

    private <T extends BaseAdapterConfig> T asConfig(BaseAdapterConfig config, Class<T> expectedType) {
        if (!expectedType.isInstance(config)) {
            throw new ConfigurationException(
                    "Expected config type " + expectedType.getSimpleName(),
                    Map.of("actual", config == null ? "null" : config.getClass().getSimpleName()));
        }
        return expectedType.cast(config);
    }
}
