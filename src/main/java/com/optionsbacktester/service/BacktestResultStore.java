package com.optionsbacktester.service;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.RemovalCause;
import com.optionsbacktester.config.BacktestEngineConfig;
import com.optionsbacktester.core.engine.BacktestResult;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * In-memory store of finished backtest results, completed and aborted alike.
 *
 * <p>Caffeine cache bounded by {@code backtester.engine.max-stored-results}. Size
 * eviction is run on every save, so the store never reports more results than the
 * bound and the result just saved is always retrievable.
 */
@Slf4j
@Component
public class BacktestResultStore {

    /** Caffeine cache: key = backtest id, value = finished result. */
    private final Cache<String, BacktestResult> results;

    public BacktestResultStore(BacktestEngineConfig engineConfig) {
        this.results = Caffeine.newBuilder()
                .maximumSize(Math.max(1, engineConfig.getMaxStoredResults()))
                .evictionListener((String id, BacktestResult result, RemovalCause cause) ->
                        log.debug("Evicted backtest result {} ({})", id, cause))
                .build();
    }

    public void save(BacktestResult result) {
        results.put(result.getId(), result);
        results.cleanUp();
    }

    public Optional<BacktestResult> find(String id) {
        return Optional.ofNullable(results.getIfPresent(id));
    }

    public long size() {
        results.cleanUp();
        return results.estimatedSize();
    }
}
