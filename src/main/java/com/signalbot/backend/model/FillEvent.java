package com.signalbot.backend.model;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Incremental fill reported by the exchange for one protective or operator close order.
 * {@code quantity} is the newly filled amount, not the cumulative one.
 */
public record FillEvent(String orderId, ProtectiveOrderType orderType, BigDecimal quantity,
                        BigDecimal price, Instant filledAt) {

    public enum ProtectiveOrderType {
        STOP_LOSS,
        TAKE_PROFIT,
        MANUAL_CLOSE
    }
}
