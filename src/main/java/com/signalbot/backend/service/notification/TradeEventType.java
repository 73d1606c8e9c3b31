package com.signalbot.backend.service.notification;

public enum TradeEventType {
    SIGNAL_REJECTED,
    TRADE_ENTERED,
    POSITION_PROTECTED,
    POSITION_CLOSED,
    RECONCILIATION_DISCREPANCY,
    DAILY_LOSS_HALT,
    UNPROTECTED_POSITION
}
