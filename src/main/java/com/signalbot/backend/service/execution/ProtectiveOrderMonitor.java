package com.signalbot.backend.service.execution;

import com.signalbot.backend.entity.TrackedPosition;
import com.signalbot.backend.exception.ExchangeException;
import com.signalbot.backend.exchange.ExchangeGateway;
import com.signalbot.backend.exchange.ExchangeGateway.ExchangeOrder;
import com.signalbot.backend.model.FillEvent;
import com.signalbot.backend.model.PositionKey;
import com.signalbot.backend.model.TradeState;
import com.signalbot.backend.service.position.PositionTracker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.Map;

/**
 * Polls the protective orders of open positions, plus any resting operator close order, and feeds newly
 * filled quantity to the execution engine as incremental {@link FillEvent}s.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ProtectiveOrderMonitor {

    private final PositionTracker positionTracker;
    private final ExecutionEngine executionEngine;
    private final ExchangeGateway exchangeGateway;
    private final Clock clock;

    @Value("${execution.protective-monitor.enabled:true}")
    private boolean enabled;

    @Value("${execution.protective-monitor.unprotected-grace-seconds:60}")
    private long unprotectedGraceSeconds;

    @Scheduled(fixedDelayString = "${execution.protective-monitor.interval-ms:5000}")
    public void runScheduled() {
        if (!enabled) {
            return;
        }
        try {
            poll();
        } catch (Exception e) {
            log.error("Protective order poll failed", e);
        }
    }

    public void poll() {
        for (Map.Entry<PositionKey, TrackedPosition> entry : positionTracker.snapshotByKey().entrySet()) {
            PositionKey key = entry.getKey();
            TrackedPosition position = entry.getValue();
            if (position.getState() == TradeState.ENTRY_FILLED) {
                checkStaleFill(key, position);
                continue;
            }
            if (position.getStopOrderId() != null) {
                if (check(key, position, position.getStopOrderId(), FillEvent.ProtectiveOrderType.STOP_LOSS)) {
                    continue;
                }
            }
            boolean closed = false;
            for (String orderId : position.getTakeProfitOrderIds()) {
                if (check(key, position, orderId, FillEvent.ProtectiveOrderType.TAKE_PROFIT)) {
                    closed = true;
                    break;
                }
            }
            if (!closed && position.getCloseOrderId() != null) {
                checkCloseOrder(key, position);
            }
        }
    }

    private boolean check(PositionKey key, TrackedPosition position, String orderId,
                          FillEvent.ProtectiveOrderType type) {
        ExchangeOrder order = fetch(position, orderId, type);
        return order != null && apply(key, position, orderId, order, type);
    }

    private void checkCloseOrder(PositionKey key, TrackedPosition position) {
        String orderId = position.getCloseOrderId();
        ExchangeOrder order = fetch(position, orderId, FillEvent.ProtectiveOrderType.MANUAL_CLOSE);
        if (order == null || apply(key, position, orderId, order, FillEvent.ProtectiveOrderType.MANUAL_CLOSE)) {
            return;
        }
        if (order.status().isTerminal()) {
            executionEngine.onCloseOrderEnded(key, orderId, order.status());
        }
    }

    private ExchangeOrder fetch(TrackedPosition position, String orderId, FillEvent.ProtectiveOrderType type) {
        try {
            return exchangeGateway.fetchOrderStatus(position.getSymbol(), position.getMarketType(), orderId);
        } catch (ExchangeException e) {
            log.warn("Status of {} order {} unavailable: {}", type, orderId, e.getMessage());
            return null;
        }
    }

    /**
     * @return true when the position is gone after applying the fill
     */
    private boolean apply(PositionKey key, TrackedPosition position, String orderId, ExchangeOrder order,
                          FillEvent.ProtectiveOrderType type) {
        BigDecimal cumulative = order.filledQuantity() == null ? BigDecimal.ZERO : order.filledQuantity();
        BigDecimal delta = cumulative.subtract(position.appliedQuantity(orderId));
        if (delta.signum() <= 0) {
            return false;
        }
        BigDecimal price = order.averagePrice() != null ? order.averagePrice() : position.getLastMarkPrice();
        executionEngine.onProtectiveFill(key, new FillEvent(orderId, type, delta, price, Instant.now(clock)));
        return positionTracker.get(key) == null;
    }

    private void checkStaleFill(PositionKey key, TrackedPosition position) {
        if (executionEngine.isExecuting(position.getTradeId())) {
            return;
        }
        Instant openedAt = position.getOpenedAt();
        if (openedAt != null && openedAt.plusSeconds(unprotectedGraceSeconds).isBefore(Instant.now(clock))) {
            executionEngine.escalateUnprotected(key, "Filled position has no protective orders and no running execution");
        }
    }
}
