package com.optionsbacktester.api.controller;

import com.optionsbacktester.api.dto.request.BacktestRequest;
import com.optionsbacktester.api.dto.response.ApiResponse;
import com.optionsbacktester.api.dto.response.BacktestResponse;
import com.optionsbacktester.api.dto.response.TradeResponse;
import com.optionsbacktester.core.engine.BacktestResult;
import com.optionsbacktester.domain.model.Trade;
import com.optionsbacktester.service.BacktestService;
import jakarta.validation.Valid;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API for running backtests and reading their ledgers.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>{@code POST /api/backtests} -- run a backtest synchronously</li>
 *   <li>{@code GET /api/backtests/{id}} -- summary of a stored run</li>
 *   <li>{@code GET /api/backtests/{id}/trades} -- trade ledger</li>
 *   <li>{@code GET /api/backtests/{id}/trades.csv} -- trade ledger as CSV</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/backtests")
public class BacktestController {

    private static final Logger log = LoggerFactory.getLogger(BacktestController.class);

    private final BacktestService backtestService;

    public BacktestController(BacktestService backtestService) {
        this.backtestService = backtestService;
    }

    @PostMapping
    public Object runBacktest(@Valid @RequestBody BacktestRequest request) {
        log.info("Backtest requested: strategy={}, underlying={}", request.getStrategy(), request.getUnderlyingSymbol());
        BacktestResult result = backtestService.run(request);
        BacktestResponse response = BacktestResponse.from(result);

        List<String> warnings = warningsFor(result);
        return warnings.isEmpty() ? response : ApiResponse.withWarnings(response, warnings);
    }

    @GetMapping("/{id}")
    public BacktestResponse getBacktest(@PathVariable String id) {
        return BacktestResponse.from(backtestService.getResult(id));
    }

    @GetMapping("/{id}/trades")
    public List<TradeResponse> getTrades(@PathVariable String id) {
        return backtestService.getTrades(id).stream().map(TradeResponse::from).toList();
    }

    @GetMapping(value = "/{id}/trades.csv", produces = "text/csv")
    public ResponseEntity<String> exportTrades(@PathVariable String id) {
        String csv = backtestService.exportLedger(id);
        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"backtest-" + id + "-trades.csv\"")
                .contentType(MediaType.parseMediaType("text/csv"))
                .body(csv);
    }

    private List<String> warningsFor(BacktestResult result) {
        List<String> warnings = new ArrayList<>();
        if (result.getDegradedValuations() > 0) {
            warnings.add(result.getDegradedValuations() + " position valuations used estimated leg prices");
        }
        long estimatedTrades = result.getTrades().stream().filter(Trade::isEstimated).count();
        if (estimatedTrades > 0) {
            warnings.add(estimatedTrades + " trades were valued with estimated leg prices");
        }
        if (result.getBarsSkipped() > 0) {
            warnings.add(result.getBarsSkipped() + " bars skipped for missing quotes");
        }
        return warnings;
    }
}
