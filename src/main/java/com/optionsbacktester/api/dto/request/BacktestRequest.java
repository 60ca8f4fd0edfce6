package com.optionsbacktester.api.dto.request;

import com.optionsbacktester.domain.enums.StrategyType;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for POST /api/backtests.
 *
 * <p>{@code quotes} is optional: without recorded quotes the run is priced from the
 * pricing engine (when the theoretical fallback is enabled). {@code signals} is
 * optional: without it the volatility-regime reference source is used. Run settings
 * left null take the configured defaults.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BacktestRequest {

    @NotNull
    private StrategyType strategy;

    @NotBlank
    private String underlyingSymbol;

    @NotEmpty
    @Valid
    private List<BarRequest> bars;

    @Valid
    @Builder.Default
    private List<QuoteRequest> quotes = new ArrayList<>();

    @Valid
    @Builder.Default
    private List<SignalRequest> signals = new ArrayList<>();

    @Positive
    private BigDecimal initialCapital;

    @Min(1)
    private Integer maxConcurrentPositions;

    @Min(0)
    private Integer warmupBars;

    @Min(0)
    private Integer minBarsBetweenEntries;
}
