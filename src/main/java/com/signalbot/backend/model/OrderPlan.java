package com.signalbot.backend.model;

import java.math.BigDecimal;
import java.util.List;

/**
 * Concrete order ladder for one trade. The entry is always a limit order; the stop-loss covers
 * the full quantity and the take-profit quantities sum to at most the entry quantity.
 */
public record OrderPlan(
        String tradeId,
        String symbol,
        Direction direction,
        MarketType marketType,
        BigDecimal entryPrice,
        BigDecimal quantity,
        int leverage,
        StopLossOrderSpec stopLoss,
        List<TakeProfitOrderSpec> takeProfits
) {
    public OrderPlan {
        takeProfits = List.copyOf(takeProfits);
    }

    public OrderSide entrySide() {
        return direction.entrySide();
    }

    public OrderSide exitSide() {
        return direction.exitSide();
    }

    public BigDecimal takeProfitQuantity() {
        return takeProfits.stream()
                .map(TakeProfitOrderSpec::quantity)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    public record StopLossOrderSpec(BigDecimal triggerPrice, BigDecimal quantity) {}

    public record TakeProfitOrderSpec(int level, BigDecimal signalPrice, BigDecimal triggerPrice,
                                      BigDecimal fraction, BigDecimal quantity) {}
}
