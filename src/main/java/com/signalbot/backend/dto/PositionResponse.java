package com.signalbot.backend.dto;

import com.signalbot.backend.entity.TrackedPosition;
import lombok.Builder;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

@Builder
public record PositionResponse(
        String tradeId,
        String symbol,
        String marketType,
        String direction,
        BigDecimal entryPrice,
        BigDecimal quantity,
        BigDecimal initialQuantity,
        int leverage,
        String state,
        String stopOrderId,
        List<String> takeProfitOrderIds,
        String closeOrderId,
        BigDecimal realizedPnl,
        BigDecimal lastMarkPrice,
        Instant openedAt
) {
    public static PositionResponse from(TrackedPosition position) {
        return PositionResponse.builder()
                .tradeId(position.getTradeId())
                .symbol(position.getSymbol())
                .marketType(position.getMarketType().name())
                .direction(position.getDirection().name())
                .entryPrice(position.getEntryPrice())
                .quantity(position.getQuantity())
                .initialQuantity(position.getInitialQuantity())
                .leverage(position.getLeverage())
                .state(position.getState().name())
                .stopOrderId(position.getStopOrderId())
                .takeProfitOrderIds(List.copyOf(position.getTakeProfitOrderIds()))
                .closeOrderId(position.getCloseOrderId())
                .realizedPnl(position.getRealizedPnl())
                .lastMarkPrice(position.getLastMarkPrice())
                .openedAt(position.getOpenedAt())
                .build();
    }
}
