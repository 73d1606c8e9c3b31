package com.signalbot.backend.service.signal;

/**
 * Turns a raw message into a candidate signal. Implementations may call an external model; callers apply
 * the extractor rate limit.
 */
public interface SignalExtractor {

    ExtractionResult extract(IncomingMessage message);
}
