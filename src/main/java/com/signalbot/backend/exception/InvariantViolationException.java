package com.signalbot.backend.exception;

public class InvariantViolationException extends TradingException {
    public InvariantViolationException(String message) {
        super(message);
    }
}
