package com.signalbot.backend.model;

import lombok.Builder;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Structured trade instruction as produced by the extraction collaborator. Immutable.
 * {@code entryPrice} is null when the alert only said "market".
 */
@Builder(toBuilder = true)
public record CandidateSignal(
        String symbol,
        Direction direction,
        MarketType marketType,
        BigDecimal entryPrice,
        boolean marketEntry,
        BigDecimal stopLoss,
        List<BigDecimal> takeProfits,
        Integer leverage,
        double confidence,
        String sourceMessageId,
        Instant receivedAt
) {
    public CandidateSignal {
        Objects.requireNonNull(symbol, "symbol");
        Objects.requireNonNull(direction, "direction");
        Objects.requireNonNull(receivedAt, "receivedAt");
        symbol = symbol.trim().toUpperCase();
        marketType = marketType == null ? MarketType.FUTURES : marketType;
        takeProfits = takeProfits == null ? List.of() : List.copyOf(takeProfits);
    }

    public boolean hasExplicitEntry() {
        return !marketEntry && entryPrice != null && entryPrice.signum() > 0;
    }
}
