package com.signalbot.backend.exception;

/**
 * Network failure or rate limiting. Safe to retry with backoff.
 */
public class TransientTransportException extends ExchangeException {
    public TransientTransportException(ExchangeErrorType errorType, String message) {
        super(errorType, message);
    }

    public TransientTransportException(ExchangeErrorType errorType, String message, Throwable cause) {
        super(errorType, message, cause);
    }

    public static TransientTransportException rateLimited(String message) {
        return new TransientTransportException(ExchangeErrorType.RATE_LIMITED, message);
    }

    public static TransientTransportException network(String message, Throwable cause) {
        return new TransientTransportException(ExchangeErrorType.NETWORK, message, cause);
    }
}
