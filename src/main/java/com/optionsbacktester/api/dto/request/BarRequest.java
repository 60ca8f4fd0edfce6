package com.optionsbacktester.api.dto.request;

import jakarta.validation.constraints.NotNull;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One underlying bar. Price ranges are not checked here: a malformed bar aborts the
 * run with its partial ledger instead of rejecting the whole request.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BarRequest {

    @NotNull
    private LocalDateTime timestamp;

    @NotNull
    private Double open;

    @NotNull
    private Double high;

    @NotNull
    private Double low;

    @NotNull
    private Double close;

    private long volume;

    /** Volatility-index level at this bar, when known. */
    private Double vix;
}
