package com.signalbot.backend.exception;

/**
 * Order refused by the venue (suspended symbol, insufficient margin, invalid order). Not retried.
 */
public class ExchangeRejectionException extends ExchangeException {
    public ExchangeRejectionException(ExchangeErrorType errorType, String message) {
        super(errorType, message);
    }

    public static ExchangeRejectionException rejected(String message) {
        return new ExchangeRejectionException(ExchangeErrorType.REJECTED, message);
    }

    public static ExchangeRejectionException insufficientFunds(String message) {
        return new ExchangeRejectionException(ExchangeErrorType.INSUFFICIENT_FUNDS, message);
    }

    public static ExchangeRejectionException suspended(String message) {
        return new ExchangeRejectionException(ExchangeErrorType.SYMBOL_SUSPENDED, message);
    }
}
