package com.optionsbacktester.domain.model;

import com.optionsbacktester.domain.enums.OptionType;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.Objects;
import lombok.Value;

/**
 * Identifies an option contract by type, strike and expiration date.
 *
 * <p>Strikes are normalised with {@link BigDecimal#stripTrailingZeros()} so that
 * {@code 6420} and {@code 6420.00} are the same contract in hash-based sets.
 */
@Value
public class ContractSpec {

    OptionType type;
    BigDecimal strike;
    LocalDate expiration;

    private ContractSpec(OptionType type, BigDecimal strike, LocalDate expiration) {
        this.type = Objects.requireNonNull(type, "type");
        this.strike = Objects.requireNonNull(strike, "strike").stripTrailingZeros();
        this.expiration = Objects.requireNonNull(expiration, "expiration");
    }

    public static ContractSpec of(OptionType type, BigDecimal strike, LocalDate expiration) {
        return new ContractSpec(type, strike, expiration);
    }

    public static ContractSpec call(long strike, LocalDate expiration) {
        return new ContractSpec(OptionType.CALL, BigDecimal.valueOf(strike), expiration);
    }

    public static ContractSpec put(long strike, LocalDate expiration) {
        return new ContractSpec(OptionType.PUT, BigDecimal.valueOf(strike), expiration);
    }

    /**
     * True when the quote has the same type and strike and its expiration lies within
     * {@code toleranceDays} of this contract's expiration.
     */
    public boolean matches(OptionQuote quote, int toleranceDays) {
        if (quote.getType() != type || quote.getStrike().compareTo(strike) != 0) {
            return false;
        }
        long dayGap = Math.abs(ChronoUnit.DAYS.between(expiration, quote.getExpiration()));
        return dayGap <= toleranceDays;
    }

    @Override
    public String toString() {
        return type + " " + strike.toPlainString() + " " + expiration;
    }
}
