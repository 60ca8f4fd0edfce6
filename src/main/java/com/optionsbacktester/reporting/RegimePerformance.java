package com.optionsbacktester.reporting;

import com.optionsbacktester.domain.enums.VolatilityRegime;
import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/** Win rate and P&L of the trades entered in one volatility regime. */
@Value
@Builder
public class RegimePerformance {

    VolatilityRegime regime;
    int trades;
    int wins;
    int losses;

    /** Percentage, 0 to 100. */
    BigDecimal winRate;

    BigDecimal totalPnl;
    BigDecimal avgPnl;
}
