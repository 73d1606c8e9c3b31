package com.signalbot.backend.exception;

public class ExchangeException extends TradingException {
    private final ExchangeErrorType errorType;

    public ExchangeException(ExchangeErrorType errorType, String message) {
        super(message);
        this.errorType = errorType;
    }

    public ExchangeException(ExchangeErrorType errorType, String message, Throwable cause) {
        super(message, cause);
        this.errorType = errorType;
    }

    public ExchangeErrorType getErrorType() {
        return errorType;
    }

    public boolean isTransient() {
        return errorType.isTransient();
    }
}
