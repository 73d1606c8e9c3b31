package com.signalbot.backend.model;

public enum RejectionReason {
    TRADING_HALTED,
    BLACKLISTED,
    LOW_CONFIDENCE,
    MARKET_ENTRY_REJECTED,
    INVALID_STOP_LOSS,
    STOP_TOO_FAR,
    RISK_REWARD_EXCEEDED,
    EXCESSIVE_LEVERAGE,
    MARKET_TYPE_UNSUPPORTED,
    INVALID_TAKE_PROFIT,
    DUPLICATE_POSITION,
    MAX_POSITIONS_REACHED,
    DUPLICATE_SIGNAL,
    // planning
    NO_TAKE_PROFIT,
    ORDER_TOO_SMALL,
    // intake
    EXTRACTOR_RATE_LIMITED,
    QUEUE_FULL,
    // execution
    EXCHANGE_REJECTED,
    ENTRY_EXPIRED,
    ENTRY_CANCELLED,
    TRANSPORT_FAILURE
}
