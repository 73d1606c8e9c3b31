package com.signalbot.backend.exception;

import com.signalbot.backend.model.RejectionReason;

public class OrderPlanningException extends TradingException {
    private final RejectionReason reason;

    public OrderPlanningException(RejectionReason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public RejectionReason getReason() {
        return reason;
    }
}
