package com.signalbot.backend.service.signal;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.signalbot.backend.model.CandidateSignal;
import com.signalbot.backend.model.Direction;
import com.signalbot.backend.model.MarketType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads already-structured signals, the same JSON shape the extraction model is asked to return:
 * <pre>{"symbol":"BTCUSDT","direction":"long","entry_price":50000,"stop_loss":49000,
 *  "take_profits":[50500,51000],"leverage":10,"trade_type":"futures","confidence":0.9}</pre>
 * A payload fenced as a markdown code block is accepted. Plain text is not a signal.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JsonSignalExtractor implements SignalExtractor {

    private static final String QUOTE_SUFFIX = "USDT";

    private final ObjectMapper objectMapper;

    @Override
    public ExtractionResult extract(IncomingMessage message) {
        String payload = stripFence(message.text());
        if (!payload.startsWith("{")) {
            return ExtractionResult.notASignal("No structured payload");
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(payload);
        } catch (JsonProcessingException e) {
            return ExtractionResult.parseFailed("Malformed JSON: " + e.getOriginalMessage());
        }
        if (root.hasNonNull("error")) {
            return ExtractionResult.notASignal(root.get("error").asText());
        }
        try {
            return ExtractionResult.signal(toCandidate(root, message));
        } catch (IllegalArgumentException | NullPointerException e) {
            return ExtractionResult.parseFailed(e.getMessage());
        }
    }

    private CandidateSignal toCandidate(JsonNode root, IncomingMessage message) {
        String symbol = requiredText(root, "symbol").trim().toUpperCase();
        if (!symbol.endsWith(QUOTE_SUFFIX)) {
            symbol = symbol + QUOTE_SUFFIX;
        }
        JsonNode entry = field(root, "entry_price", "entryPrice");
        boolean marketEntry = entry == null || entry.isNull()
                || (entry.isTextual() && "market".equalsIgnoreCase(entry.asText().trim()));

        List<BigDecimal> takeProfits = new ArrayList<>();
        JsonNode tps = field(root, "take_profits", "takeProfits");
        if (tps != null && tps.isArray()) {
            tps.forEach(tp -> takeProfits.add(decimal(tp)));
        }
        JsonNode leverage = root.get("leverage");
        JsonNode marketType = field(root, "trade_type", "market_type", "marketType");
        JsonNode confidence = root.get("confidence");

        return CandidateSignal.builder()
                .symbol(symbol)
                .direction(Direction.fromString(requiredText(root, "direction")))
                .marketType(MarketType.fromString(marketType == null ? null : marketType.asText()))
                .entryPrice(marketEntry ? null : decimal(entry))
                .marketEntry(marketEntry)
                .stopLoss(decimal(field(root, "stop_loss", "stopLoss")))
                .takeProfits(takeProfits)
                .leverage(leverage == null || leverage.isNull() ? null : leverage.asInt())
                .confidence(confidence == null ? 0.0 : confidence.asDouble())
                .sourceMessageId(message.messageId())
                .receivedAt(message.receivedAt() != null ? message.receivedAt() : Instant.now())
                .build();
    }

    private String stripFence(String text) {
        String clean = text.trim();
        if (clean.startsWith("```json")) {
            clean = clean.substring(7);
        } else if (clean.startsWith("```")) {
            clean = clean.substring(3);
        }
        if (clean.endsWith("```")) {
            clean = clean.substring(0, clean.length() - 3);
        }
        return clean.trim();
    }

    private JsonNode field(JsonNode root, String... names) {
        for (String name : names) {
            if (root.has(name)) {
                return root.get(name);
            }
        }
        return null;
    }

    private String requiredText(JsonNode root, String name) {
        JsonNode node = root.get(name);
        if (node == null || node.isNull() || node.asText().isBlank()) {
            throw new IllegalArgumentException("Missing required field: " + name);
        }
        return node.asText();
    }

    private BigDecimal decimal(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isNumber()) {
            return node.decimalValue();
        }
        return new BigDecimal(node.asText().trim());
    }
}
