package com.optionsbacktester.api.dto.request;

import com.optionsbacktester.domain.enums.OptionType;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One recorded option quote, attached to the bar with the same timestamp.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QuoteRequest {

    @NotNull
    private LocalDateTime timestamp;

    @NotNull
    private OptionType type;

    @NotNull
    @Positive
    private BigDecimal strike;

    @NotNull
    private LocalDate expiration;

    @PositiveOrZero
    private BigDecimal bid;

    @PositiveOrZero
    private BigDecimal ask;

    @PositiveOrZero
    private BigDecimal last;

    private long volume;
    private long openInterest;

    /** Decimal, e.g. 0.18 for 18%. */
    @Positive
    private BigDecimal impliedVolatility;
}
