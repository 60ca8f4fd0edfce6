package com.optionsbacktester.api.dto.request;

import com.optionsbacktester.domain.enums.SignalAction;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A precomputed entry signal, delivered on the bar with the same timestamp.
 *
 * <p>{@code stopLoss} and {@code takeProfit} are currency amounts of P&L.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SignalRequest {

    @NotNull
    private LocalDateTime timestamp;

    @NotNull
    private SignalAction action;

    @Min(0)
    @Max(100)
    private int confidence;

    @Valid
    @Builder.Default
    private List<ContractRequest> targetContracts = new ArrayList<>();

    @Positive
    private BigDecimal stopLoss;

    @Positive
    private BigDecimal takeProfit;

    private Double vixLevel;

    @Positive
    private BigDecimal profitZoneWidth;
}
