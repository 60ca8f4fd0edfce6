package com.optionsbacktester.service;

import com.optionsbacktester.api.dto.request.BacktestRequest;
import com.optionsbacktester.api.dto.request.BarRequest;
import com.optionsbacktester.api.dto.request.QuoteRequest;
import com.optionsbacktester.api.dto.request.SignalRequest;
import com.optionsbacktester.config.BacktestEngineConfig;
import com.optionsbacktester.config.MarketDataConfig;
import com.optionsbacktester.config.PricingConfig;
import com.optionsbacktester.core.engine.BacktestEngine;
import com.optionsbacktester.core.engine.BacktestResult;
import com.optionsbacktester.core.engine.BacktestSettings;
import com.optionsbacktester.core.processor.OptionPricingEngine;
import com.optionsbacktester.domain.model.Bar;
import com.optionsbacktester.domain.model.ContractSpec;
import com.optionsbacktester.domain.model.OptionQuote;
import com.optionsbacktester.domain.model.Signal;
import com.optionsbacktester.domain.model.Trade;
import com.optionsbacktester.exception.ResourceNotFoundException;
import com.optionsbacktester.exception.UnrecoverableDataException;
import com.optionsbacktester.marketdata.FallbackQuoteProvider;
import com.optionsbacktester.marketdata.QuoteProvider;
import com.optionsbacktester.marketdata.RecordedQuoteProvider;
import com.optionsbacktester.marketdata.ScheduledSignalSource;
import com.optionsbacktester.marketdata.SignalSource;
import com.optionsbacktester.marketdata.TheoreticalQuoteProvider;
import com.optionsbacktester.marketdata.VolatilityRegimeSignalSource;
import com.optionsbacktester.reporting.TradeLedgerWriter;
import com.optionsbacktester.strategy.StrategyAdapterFactory;
import com.optionsbacktester.strategy.base.StrategyBacktestingAdapter;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Orchestrates a backtest request: maps the payload to domain objects, assembles the
 * quote provider chain and signal source, runs the engine and stores the result.
 *
 * <p>Aborted runs are stored too, so their partial ledger can be fetched by id.
 */
@Slf4j
@Service
public class BacktestService {

    private final BacktestEngine engine;
    private final StrategyAdapterFactory adapterFactory;
    private final BacktestResultStore resultStore;
    private final TradeLedgerWriter ledgerWriter;
    private final OptionPricingEngine pricingEngine;
    private final PricingConfig pricingConfig;
    private final MarketDataConfig marketDataConfig;
    private final BacktestEngineConfig engineConfig;

    public BacktestService(
            BacktestEngine engine,
            StrategyAdapterFactory adapterFactory,
            BacktestResultStore resultStore,
            TradeLedgerWriter ledgerWriter,
            OptionPricingEngine pricingEngine,
            PricingConfig pricingConfig,
            MarketDataConfig marketDataConfig,
            BacktestEngineConfig engineConfig) {
        this.engine = engine;
        this.adapterFactory = adapterFactory;
        this.resultStore = resultStore;
        this.ledgerWriter = ledgerWriter;
        this.pricingEngine = pricingEngine;
        this.pricingConfig = pricingConfig;
        this.marketDataConfig = marketDataConfig;
        this.engineConfig = engineConfig;
    }

    // ========================
    // RUN
    // ========================

    /**
     * Runs the requested backtest synchronously.
     *
     * @throws com.optionsbacktester.exception.ConfigurationException for invalid settings or no usable quote provider
     * @throws UnrecoverableDataException for a malformed bar; the partial result is stored first
     */
    public BacktestResult run(BacktestRequest request) {
        StrategyBacktestingAdapter adapter = adapterFactory.create(request.getStrategy(), request.getUnderlyingSymbol());
        List<Bar> bars = request.getBars().stream().map(BacktestService::toBar).toList();
        QuoteProvider quoteProvider = buildQuoteProvider(request.getQuotes());
        SignalSource signalSource = buildSignalSource(request.getSignals());
        BacktestSettings settings = buildSettings(request);

        log.info(
                "Backtest request: strategy={}, underlying={}, bars={}, quotes={}, signals={}",
                request.getStrategy(),
                request.getUnderlyingSymbol(),
                bars.size(),
                request.getQuotes().size(),
                request.getSignals().size());

        BacktestResult result;
        try {
            result = engine.run(adapter, bars, signalSource, quoteProvider, settings);
        } catch (UnrecoverableDataException e) {
            if (e.hasPartialResult()) {
                resultStore.save(e.getPartialResult());
            }
            throw e;
        }
        resultStore.save(result);
        return result;
    }

    // ========================
    // QUERIES
    // ========================

    public BacktestResult getResult(String id) {
        return resultStore.find(id).orElseThrow(() -> new ResourceNotFoundException("Backtest", id));
    }

    public List<Trade> getTrades(String id) {
        return getResult(id).getTrades();
    }

    /** The ledger of a stored run as delimited text with a header row. */
    public String exportLedger(String id) {
        return ledgerWriter.toDelimitedText(getTrades(id));
    }

    // ========================
    // ASSEMBLY
    // ========================

    QuoteProvider buildQuoteProvider(List<QuoteRequest> quotes) {
        Map<String, QuoteProvider> available = new LinkedHashMap<>();
        if (!quotes.isEmpty()) {
            Map<LocalDateTime, List<OptionQuote>> snapshots = quotes.stream()
                    .collect(Collectors.groupingBy(
                            QuoteRequest::getTimestamp,
                            LinkedHashMap::new,
                            Collectors.mapping(BacktestService::toQuote, Collectors.toList())));
            available.put(
                    RecordedQuoteProvider.NAME,
                    new RecordedQuoteProvider(snapshots, pricingConfig.getExpirationToleranceDays()));
        }
        if (marketDataConfig.isTheoreticalFallbackEnabled()) {
            available.put(TheoreticalQuoteProvider.NAME, new TheoreticalQuoteProvider(pricingEngine, pricingConfig));
        }
        return new FallbackQuoteProvider(available, marketDataConfig);
    }

    SignalSource buildSignalSource(List<SignalRequest> signals) {
        if (signals.isEmpty()) {
            return new VolatilityRegimeSignalSource();
        }
        return new ScheduledSignalSource(signals.stream().map(BacktestService::toSignal).toList());
    }

    BacktestSettings buildSettings(BacktestRequest request) {
        return BacktestSettings.builder()
                .runId(UUID.randomUUID().toString())
                .initialCapital(request.getInitialCapital() != null
                        ? request.getInitialCapital()
                        : engineConfig.getInitialCapital())
                .maxConcurrentPositions(request.getMaxConcurrentPositions() != null
                        ? request.getMaxConcurrentPositions()
                        : engineConfig.getMaxConcurrentPositions())
                .warmupBars(request.getWarmupBars() != null ? request.getWarmupBars() : engineConfig.getWarmupBars())
                .minBarsBetweenEntries(request.getMinBarsBetweenEntries() != null
                        ? request.getMinBarsBetweenEntries()
                        : engineConfig.getMinBarsBetweenEntries())
                .build();
    }

    private static Bar toBar(BarRequest request) {
        return Bar.builder()
                .timestamp(request.getTimestamp())
                .open(request.getOpen())
                .high(request.getHigh())
                .low(request.getLow())
                .close(request.getClose())
                .volume(request.getVolume())
                .vix(request.getVix())
                .build();
    }

    private static OptionQuote toQuote(QuoteRequest request) {
        return OptionQuote.builder()
                .type(request.getType())
                .strike(request.getStrike())
                .expiration(request.getExpiration())
                .bid(request.getBid())
                .ask(request.getAsk())
                .last(request.getLast())
                .volume(request.getVolume())
                .openInterest(request.getOpenInterest())
                .impliedVolatility(request.getImpliedVolatility())
                .build();
    }

    private static Signal toSignal(SignalRequest request) {
        return Signal.builder()
                .timestamp(request.getTimestamp())
                .action(request.getAction())
                .confidence(request.getConfidence())
                .targetContracts(request.getTargetContracts().stream()
                        .map(c -> ContractSpec.of(c.getType(), c.getStrike(), c.getExpiration()))
                        .toList())
                .stopLoss(request.getStopLoss())
                .takeProfit(request.getTakeProfit())
                .vixLevel(request.getVixLevel())
                .profitZoneWidth(request.getProfitZoneWidth())
                .build();
    }
}
