package com.optionsbacktester.api.dto.response;

import com.optionsbacktester.domain.enums.ExitReason;
import com.optionsbacktester.domain.enums.LegSide;
import com.optionsbacktester.domain.enums.OptionType;
import com.optionsbacktester.domain.enums.VolatilityRegime;
import com.optionsbacktester.domain.model.Leg;
import com.optionsbacktester.domain.model.Trade;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import lombok.Builder;
import lombok.Data;

/**
 * Response DTO for one ledger entry of GET /api/backtests/{id}/trades.
 */
@Data
@Builder
public class TradeResponse {

    private String positionId;
    private String strategyName;
    private LocalDateTime entryTime;
    private LocalDateTime exitTime;
    private BigDecimal entryCost;
    private BigDecimal exitValue;
    private BigDecimal realizedPnl;
    private long holdingMinutes;
    private ExitReason exitReason;
    private VolatilityRegime regime;
    private boolean estimated;
    private BigDecimal maxUnrealizedPnl;
    private BigDecimal minUnrealizedPnl;
    private List<LegResponse> legs;

    @Data
    @Builder
    public static class LegResponse {
        private OptionType type;
        private BigDecimal strike;
        private LocalDate expiration;
        private LegSide side;
        private int quantity;
        private BigDecimal entryPrice;

        static LegResponse from(Leg leg) {
            return LegResponse.builder()
                    .type(leg.getContract().getType())
                    .strike(leg.getContract().getStrike())
                    .expiration(leg.getContract().getExpiration())
                    .side(leg.getSide())
                    .quantity(leg.getQuantity())
                    .entryPrice(leg.getEntryPrice())
                    .build();
        }
    }

    public static TradeResponse from(Trade trade) {
        return TradeResponse.builder()
                .positionId(trade.getPositionId())
                .strategyName(trade.getStrategyName())
                .entryTime(trade.getEntryTime())
                .exitTime(trade.getExitTime())
                .entryCost(trade.getEntryCost())
                .exitValue(trade.getExitValue())
                .realizedPnl(trade.getRealizedPnl())
                .holdingMinutes(trade.getHoldingMinutes())
                .exitReason(trade.getExitReason())
                .regime(trade.getRegimeAtEntry())
                .estimated(trade.isEstimated())
                .maxUnrealizedPnl(trade.getMaxUnrealizedPnl())
                .minUnrealizedPnl(trade.getMinUnrealizedPnl())
                .legs(trade.getLegs().stream().map(LegResponse::from).toList())
                .build();
    }
}
