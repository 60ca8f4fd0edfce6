package com.optionsbacktester.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Trade ledger export format.
 *
 * <p>Binds to the {@code backtester.ledger.*} prefix in application.properties.
 */
@Configuration
@ConfigurationProperties(prefix = "backtester.ledger")
@Getter
@Setter
public class LedgerConfig {

    /** Field separator; a single character such as {@code ,} or {@code ;}. */
    private String delimiter = ",";

    /** Decimal places for money columns. */
    private int moneyScale = 2;
}
