package com.signalbot.backend.util;

import com.signalbot.backend.config.ExecutionProperties;
import com.signalbot.backend.config.TradingConfigSnapshot;
import com.signalbot.backend.config.TradingMode;
import com.signalbot.backend.entity.TrackedPosition;
import com.signalbot.backend.model.CandidateSignal;
import com.signalbot.backend.model.Direction;
import com.signalbot.backend.model.MarketType;
import com.signalbot.backend.model.TradeState;
import com.signalbot.backend.model.ValidatedTrade;
import com.signalbot.backend.repository.TrackedPositionRepository;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

public final class TestSignalFactory {

    public static final Instant NOW = Instant.parse("2026-03-02T10:00:00Z");

    private TestSignalFactory() {
    }

    public static CandidateSignal btcLong() {
        return CandidateSignal.builder()
                .symbol("BTCUSDT")
                .direction(Direction.LONG)
                .marketType(MarketType.FUTURES)
                .entryPrice(new BigDecimal("50000"))
                .stopLoss(new BigDecimal("49000"))
                .takeProfits(List.of(new BigDecimal("50500"), new BigDecimal("51000"), new BigDecimal("51500"),
                        new BigDecimal("52000"), new BigDecimal("52500")))
                .leverage(10)
                .confidence(0.9)
                .sourceMessageId("msg-1")
                .receivedAt(NOW)
                .build();
    }

    public static CandidateSignal ethShort() {
        return CandidateSignal.builder()
                .symbol("ETHUSDT")
                .direction(Direction.SHORT)
                .marketType(MarketType.FUTURES)
                .entryPrice(new BigDecimal("3000"))
                .stopLoss(new BigDecimal("3100"))
                .takeProfits(List.of(new BigDecimal("2950"), new BigDecimal("2900")))
                .leverage(5)
                .confidence(0.85)
                .sourceMessageId("msg-2")
                .receivedAt(NOW)
                .build();
    }

    public static TradingConfigSnapshot config() {
        return TradingConfigSnapshot.builder()
                .version(1)
                .mode(TradingMode.DEMO)
                .leverageOverride(0)
                .futuresPositionSize(new BigDecimal("150"))
                .spotPositionSize(new BigDecimal("100"))
                .maxFuturesPositions(2)
                .maxSpotPositions(1)
                .maxDailyLoss(new BigDecimal("300"))
                .blacklist(Set.of())
                .minConfidenceThreshold(0.7)
                .maxRiskRewardRatio(new BigDecimal("5.0"))
                .tradingEnabled(true)
                .allowHedging(false)
                .spotEnabled(true)
                .maxLeverage(100)
                .defaultLeverage(1)
                .maxStopDistancePct(new BigDecimal("20"))
                .dayZone(ZoneId.of("UTC"))
                .build();
    }

    public static ExecutionProperties executionProperties() {
        ExecutionProperties properties = new ExecutionProperties();
        properties.setEntryTimeoutSeconds(5);
        properties.setPollDelayMs(0);
        return properties;
    }

    public static ValidatedTrade validated(String tradeId, CandidateSignal signal, int leverage, BigDecimal size) {
        return new ValidatedTrade(tradeId, signal, "fp-" + tradeId, new BigDecimal("0.5"), leverage, size);
    }

    public static TrackedPosition openPosition(String tradeId, String symbol, Direction direction, String entry,
                                               String quantity) {
        return TrackedPosition.builder()
                .tradeId(tradeId)
                .symbol(symbol)
                .marketType(MarketType.FUTURES)
                .direction(direction)
                .entryPrice(MoneyUtils.bd(entry))
                .quantity(MoneyUtils.bd(quantity))
                .initialQuantity(MoneyUtils.bd(quantity))
                .leverage(10)
                .state(TradeState.PROTECTED)
                .lastMarkPrice(MoneyUtils.bd(entry))
                .build();
    }

    /**
     * Mocked repository backed by a map, assigning ids on first save.
     */
    public static TrackedPositionRepository inMemoryPositionRepo() {
        TrackedPositionRepository repo = mock(TrackedPositionRepository.class);
        Map<Long, TrackedPosition> rows = new ConcurrentHashMap<>();
        AtomicLong ids = new AtomicLong();
        when(repo.save(any())).thenAnswer(invocation -> {
            TrackedPosition position = invocation.getArgument(0);
            if (position.getId() == null) {
                position.setId(ids.incrementAndGet());
            }
            rows.put(position.getId(), position.toBuilder()
                    .takeProfitOrderIds(new ArrayList<>(position.getTakeProfitOrderIds()))
                    .appliedFills(new ArrayList<>(position.getAppliedFills()))
                    .build());
            return position;
        });
        when(repo.findByStateNotIn(anyCollection())).thenAnswer(invocation -> {
            Collection<TradeState> excluded = invocation.getArgument(0);
            return rows.values().stream().filter(p -> !excluded.contains(p.getState())).toList();
        });
        when(repo.findByState(any())).thenAnswer(invocation -> {
            TradeState state = invocation.getArgument(0);
            return rows.values().stream().filter(p -> p.getState() == state).toList();
        });
        when(repo.findByTradeId(anyString())).thenAnswer(invocation -> {
            String tradeId = invocation.getArgument(0);
            return rows.values().stream().filter(p -> p.getTradeId().equals(tradeId)).findFirst();
        });
        when(repo.findAll()).thenAnswer(invocation -> List.copyOf(rows.values()));
        return repo;
    }
}
