package com.signalbot.backend.exception;

public enum ExchangeErrorType {
    RATE_LIMITED,
    NETWORK,
    REJECTED,
    INSUFFICIENT_FUNDS,
    SYMBOL_SUSPENDED,
    UNKNOWN;

    public boolean isTransient() {
        return this == RATE_LIMITED || this == NETWORK;
    }
}
