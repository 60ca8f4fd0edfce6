package com.optionsbacktester.api.dto.request;

import com.optionsbacktester.domain.enums.OptionType;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.math.BigDecimal;
import java.time.LocalDate;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ContractRequest {

    @NotNull
    private OptionType type;

    @NotNull
    @Positive
    private BigDecimal strike;

    @NotNull
    private LocalDate expiration;
}
