package com.optionsbacktester.domain.model;

import com.optionsbacktester.domain.enums.OptionType;
import java.math.BigDecimal;
import java.time.LocalDate;
import lombok.Builder;
import lombok.Value;

/**
 * Immutable snapshot of one option contract at one timestamp.
 *
 * <p>{@code impliedVolatility} is a decimal (0.20 = 20%) and may be null when the
 * source does not publish it. {@code estimated} marks a synthetic quote priced by the
 * degraded approximation; any position valued from it is flagged as estimated.
 */
@Value
@Builder
public class OptionQuote {

    private static final BigDecimal TWO = BigDecimal.valueOf(2);

    OptionType type;
    BigDecimal strike;
    LocalDate expiration;
    BigDecimal bid;
    BigDecimal ask;
    BigDecimal last;
    long volume;
    long openInterest;
    BigDecimal impliedVolatility;
    boolean estimated;

    public ContractSpec contract() {
        return ContractSpec.of(type, strike, expiration);
    }

    /** Last traded price when positive, otherwise the bid/ask midpoint. */
    public BigDecimal markPrice() {
        if (last != null && last.signum() > 0) {
            return last;
        }
        return mid();
    }

    public BigDecimal mid() {
        BigDecimal b = bid != null ? bid : BigDecimal.ZERO;
        BigDecimal a = ask != null ? ask : BigDecimal.ZERO;
        return b.add(a).divide(TWO);
    }
}
