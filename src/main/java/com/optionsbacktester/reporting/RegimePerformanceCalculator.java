package com.optionsbacktester.reporting;

import com.optionsbacktester.domain.enums.VolatilityRegime;
import com.optionsbacktester.domain.model.Trade;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Groups ledger trades by the regime recorded at entry. Only regimes with at least one
 * trade are reported, in {@link VolatilityRegime} declaration order.
 */
public final class RegimePerformanceCalculator {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private RegimePerformanceCalculator() {}

    public static List<RegimePerformance> breakdown(List<Trade> trades) {
        Map<VolatilityRegime, List<Trade>> byRegime = new EnumMap<>(VolatilityRegime.class);
        for (Trade trade : trades) {
            VolatilityRegime regime = trade.getRegimeAtEntry() != null ? trade.getRegimeAtEntry() : VolatilityRegime.UNKNOWN;
            byRegime.computeIfAbsent(regime, r -> new ArrayList<>()).add(trade);
        }

        List<RegimePerformance> result = new ArrayList<>();
        byRegime.forEach((regime, regimeTrades) -> {
            int count = regimeTrades.size();
            int wins = (int) regimeTrades.stream().filter(Trade::isWin).count();
            BigDecimal total = regimeTrades.stream().map(Trade::getRealizedPnl).reduce(BigDecimal.ZERO, BigDecimal::add);
            result.add(RegimePerformance.builder()
                    .regime(regime)
                    .trades(count)
                    .wins(wins)
                    .losses(count - wins)
                    .winRate(percentage(wins, count))
                    .totalPnl(total)
                    .avgPnl(total.divide(BigDecimal.valueOf(count), 2, RoundingMode.HALF_UP))
                    .build());
        });
        return result;
    }

    /** {@code part / whole x 100} at two decimals; zero when {@code whole} is zero. */
    public static BigDecimal percentage(long part, long whole) {
        if (whole == 0) {
            return BigDecimal.ZERO;
        }
        return BigDecimal.valueOf(part)
                .divide(BigDecimal.valueOf(whole), 4, RoundingMode.HALF_UP)
                .multiply(HUNDRED)
                .setScale(2, RoundingMode.HALF_UP);
    }
}
