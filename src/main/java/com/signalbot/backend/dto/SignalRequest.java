package com.signalbot.backend.dto;

import com.signalbot.backend.model.CandidateSignal;
import com.signalbot.backend.model.Direction;
import com.signalbot.backend.model.MarketType;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Structured candidate posted by an upstream extractor. A null {@code entryPrice} means a market entry.
 */
@Data
public class SignalRequest {

    @NotBlank
    private String symbol;

    @NotBlank
    private String direction;

    private String marketType;

    private BigDecimal entryPrice;

    private BigDecimal stopLoss;

    private List<BigDecimal> takeProfits = new ArrayList<>();

    private Integer leverage;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double confidence;

    private String sourceMessageId;

    public CandidateSignal toCandidate(Instant receivedAt) {
        return CandidateSignal.builder()
                .symbol(symbol)
                .direction(Direction.fromString(direction))
                .marketType(MarketType.fromString(marketType))
                .entryPrice(entryPrice)
                .marketEntry(entryPrice == null)
                .stopLoss(stopLoss)
                .takeProfits(takeProfits)
                .leverage(leverage)
                .confidence(confidence)
                .sourceMessageId(sourceMessageId)
                .receivedAt(receivedAt)
                .build();
    }
}
