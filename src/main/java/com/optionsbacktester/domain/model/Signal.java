package com.optionsbacktester.domain.model;

import com.optionsbacktester.domain.enums.SignalAction;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import lombok.Builder;
import lombok.Value;

/**
 * Entry signal produced by an upstream strategy-logic collaborator.
 *
 * <p>{@code stopLoss} and {@code takeProfit}, when present, are P&L amounts in currency
 * and override the adapter's default thresholds for the resulting position.
 * {@code targetContracts} may be empty, in which case the adapter selects contracts
 * itself.
 */
@Value
@Builder(toBuilder = true)
public class Signal {

    SignalAction action;

    /** 0 to 100. */
    int confidence;

    @Builder.Default
    List<ContractSpec> targetContracts = List.of();

    BigDecimal stopLoss;
    BigDecimal takeProfit;
    LocalDateTime timestamp;
    Double vixLevel;
    BigDecimal profitZoneWidth;

    public boolean isEntry() {
        return action == SignalAction.ENTER;
    }
}
