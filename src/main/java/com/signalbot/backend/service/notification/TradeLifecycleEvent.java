package com.signalbot.backend.service.notification;

import java.time.Instant;
import java.util.Map;

public record TradeLifecycleEvent(TradeEventType type, String tradeId, String symbol, String message,
                                  Map<String, Object> details, Instant occurredAt) {

    public TradeLifecycleEvent {
        details = details == null ? Map.of() : Map.copyOf(details);
    }

    public boolean isCritical() {
        return type == TradeEventType.UNPROTECTED_POSITION || type == TradeEventType.DAILY_LOSS_HALT;
    }
}
