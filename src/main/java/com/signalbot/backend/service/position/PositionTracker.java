package com.signalbot.backend.service.position;

import com.signalbot.backend.config.TradingConfigHolder;
import com.signalbot.backend.entity.TrackedPosition;
import com.signalbot.backend.exception.InvariantViolationException;
import com.signalbot.backend.exception.NotFoundException;
import com.signalbot.backend.model.CloseReason;
import com.signalbot.backend.model.FillEvent;
import com.signalbot.backend.model.MarketType;
import com.signalbot.backend.model.PositionKey;
import com.signalbot.backend.model.TradeState;
import com.signalbot.backend.repository.TrackedPositionRepository;
import com.signalbot.backend.util.MoneyUtils;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Owner of the open-position map. Every mutation runs under the tracker's monitor and is written through
 * to the repository, so the map survives a restart. Callers receive detached copies.
 * <p>
 * Slots can be reserved for a trade between acceptance and entry fill; reserved slots count towards the
 * per-market limits and the duplicate-position check.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PositionTracker {

    private static final List<TradeState> TERMINAL = List.of(TradeState.CLOSED, TradeState.ABORTED);

    private final TrackedPositionRepository repository;
    private final TradingConfigHolder configHolder;
    private final Clock clock;

    private final Map<PositionKey, TrackedPosition> open = new LinkedHashMap<>();
    private final Map<PositionKey, String> reservations = new LinkedHashMap<>();

    @PostConstruct
    public synchronized void reload() {
        open.clear();
        boolean hedging = configHolder.current().allowHedging();
        for (TrackedPosition position : repository.findByStateNotIn(TERMINAL)) {
            PositionKey key = position.positionKey(hedging);
            if (open.containsKey(key)) {
                log.error("Persisted state holds two open positions for {}: trades {} and {}",
                        key, open.get(key).getTradeId(), position.getTradeId());
                continue;
            }
            open.put(key, position);
        }
        log.info("Position tracker loaded {} open position(s)", open.size());
    }

    /**
     * Holds a slot for a trade that has not filled yet.
     *
     * @return false when the key is already open or reserved
     */
    public synchronized boolean reserve(PositionKey key, String tradeId) {
        if (open.containsKey(key) || reservations.containsKey(key)) {
            return false;
        }
        reservations.put(key, tradeId);
        return true;
    }

    public synchronized void release(PositionKey key, String tradeId) {
        reservations.remove(key, tradeId);
    }

    public synchronized TrackedPosition open(PositionKey key, TrackedPosition position) {
        TrackedPosition existing = open.get(key);
        if (existing != null) {
            log.error("INVARIANT VIOLATION: position {} already open by trade {}, refusing trade {}",
                    key, existing.getTradeId(), position.getTradeId());
            throw new InvariantViolationException("Position already open for " + key);
        }
        String reservedBy = reservations.get(key);
        if (reservedBy != null && !reservedBy.equals(position.getTradeId())) {
            log.error("INVARIANT VIOLATION: slot {} reserved by trade {}, refusing trade {}",
                    key, reservedBy, position.getTradeId());
            throw new InvariantViolationException("Position slot reserved by another trade for " + key);
        }
        position.setOpenedAt(position.getOpenedAt() != null ? position.getOpenedAt() : Instant.now(clock));
        if (position.getRealizedPnl() == null) {
            position.setRealizedPnl(MoneyUtils.ZERO);
        }
        TrackedPosition saved = repository.save(position);
        reservations.remove(key);
        open.put(key, saved);
        log.info("Position opened {} qty={} @ {} trade={}", key, saved.getQuantity(), saved.getEntryPrice(),
                saved.getTradeId());
        return copy(saved);
    }

    /**
     * Applies an incremental protective fill: reduces the open quantity and books the realized PnL of the
     * filled slice.
     */
    public synchronized TrackedPosition mutate(PositionKey key, FillEvent fill) {
        TrackedPosition position = require(key);
        BigDecimal quantity = fill.quantity().min(position.getQuantity());
        if (quantity.compareTo(fill.quantity()) < 0) {
            log.warn("Fill {} of {} exceeds open quantity {} on {}, clamped",
                    fill.orderId(), fill.quantity(), position.getQuantity(), key);
        }
        BigDecimal pnl = MoneyUtils.multiply(
                position.getDirection().favourableMove(position.getEntryPrice(), fill.price()), quantity);
        position.setQuantity(MoneyUtils.subtract(position.getQuantity(), quantity));
        position.setRealizedPnl(MoneyUtils.add(position.getRealizedPnl(), pnl));
        position.setLastMarkPrice(fill.price());
        position.recordApplied(fill.orderId(), position.appliedQuantity(fill.orderId()).add(quantity));
        TrackedPosition saved = repository.save(position);
        open.put(key, saved);
        log.info("Position {} reduced by {} via {} {} @ {}, remaining {}", key, quantity, fill.orderType(),
                fill.orderId(), fill.price(), saved.getQuantity());
        return copy(saved);
    }

    public synchronized TrackedPosition update(PositionKey key, Consumer<TrackedPosition> change) {
        TrackedPosition position = require(key);
        change.accept(position);
        TrackedPosition saved = repository.save(position);
        open.put(key, saved);
        return copy(saved);
    }

    public synchronized TrackedPosition close(PositionKey key, CloseReason reason) {
        TrackedPosition position = require(key);
        position.setState(TradeState.CLOSED);
        position.setCloseReason(reason);
        position.setClosedAt(Instant.now(clock));
        TrackedPosition saved = repository.save(position);
        open.remove(key);
        log.info("Position closed {} reason={} realizedPnl={}", key, reason, saved.getRealizedPnl());
        return copy(saved);
    }

    public synchronized TrackedPosition get(PositionKey key) {
        TrackedPosition position = open.get(key);
        return position == null ? null : copy(position);
    }

    public synchronized PositionKey findKeyByTradeId(String tradeId) {
        return open.entrySet().stream()
                .filter(entry -> entry.getValue().getTradeId().equals(tradeId))
                .map(Map.Entry::getKey)
                .findFirst()
                .orElse(null);
    }

    public synchronized List<TrackedPosition> snapshot() {
        List<TrackedPosition> result = new ArrayList<>(open.size());
        open.values().forEach(position -> result.add(copy(position)));
        return result;
    }

    public synchronized Map<PositionKey, TrackedPosition> snapshotByKey() {
        Map<PositionKey, TrackedPosition> result = new LinkedHashMap<>();
        open.forEach((key, position) -> result.put(key, copy(position)));
        return result;
    }

    /** Open plus reserved slots for one market type. */
    public synchronized int activeCount(MarketType marketType) {
        long openCount = open.keySet().stream().filter(key -> key.marketType() == marketType).count();
        long reserved = reservations.keySet().stream()
                .filter(key -> key.marketType() == marketType && !open.containsKey(key))
                .count();
        return (int) (openCount + reserved);
    }

    public synchronized Set<PositionKey> occupiedKeys() {
        Set<PositionKey> keys = new HashSet<>(open.keySet());
        keys.addAll(reservations.keySet());
        return keys;
    }

    public List<TrackedPosition> closedPositions() {
        return repository.findByState(TradeState.CLOSED);
    }

    private TrackedPosition require(PositionKey key) {
        TrackedPosition position = open.get(key);
        if (position == null) {
            throw new NotFoundException("No open position for " + key);
        }
        return position;
    }

    private TrackedPosition copy(TrackedPosition position) {
        return position.toBuilder()
                .takeProfitOrderIds(new ArrayList<>(position.getTakeProfitOrderIds()))
                .appliedFills(new ArrayList<>(position.getAppliedFills()))
                .build();
    }
}
