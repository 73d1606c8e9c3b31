package com.signalbot.backend.service.execution;

import com.signalbot.backend.config.ExecutionProperties;
import com.signalbot.backend.entity.TrackedPosition;
import com.signalbot.backend.exception.ExchangeException;
import com.signalbot.backend.exception.ExchangeRejectionException;
import com.signalbot.backend.exception.InvariantViolationException;
import com.signalbot.backend.exception.NotFoundException;
import com.signalbot.backend.exception.TransientTransportException;
import com.signalbot.backend.exchange.ExchangeGateway;
import com.signalbot.backend.exchange.ExchangeGateway.ExchangeOrder;
import com.signalbot.backend.exchange.ExchangeGateway.OrderRequest;
import com.signalbot.backend.exchange.ExchangeOrderStatus;
import com.signalbot.backend.model.CloseReason;
import com.signalbot.backend.model.FillEvent;
import com.signalbot.backend.model.OrderPlan;
import com.signalbot.backend.model.PositionKey;
import com.signalbot.backend.model.Rejection;
import com.signalbot.backend.model.RejectionReason;
import com.signalbot.backend.model.TradeState;
import com.signalbot.backend.model.ValidatedTrade;
import com.signalbot.backend.service.AsyncDelayService;
import com.signalbot.backend.service.MetricsService;
import com.signalbot.backend.service.notification.TradeNotifier;
import com.signalbot.backend.service.planner.OrderPlanner;
import com.signalbot.backend.service.position.PositionTracker;
import com.signalbot.backend.service.risk.RiskStateService;
import com.signalbot.backend.util.MoneyUtils;
import io.github.resilience4j.retry.Retry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Drives one trade from plan to protected position, then books protective fills until the position closes.
 * <pre>
 * PLANNED -> ENTRY_SUBMITTED -> ENTRY_FILLED -> PROTECTED -> PARTIALLY_CLOSED* -> CLOSED
 *    \------------\--> ABORTED                \-> UNPROTECTED (critical alert, automation halted)
 * </pre>
 * Each trade id is executed at most once. Transitions of a single trade happen on the thread running it.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ExecutionEngine {

    private final ExchangeGateway exchangeGateway;
    private final OrderPlanner orderPlanner;
    private final PositionTracker positionTracker;
    private final RiskStateService riskStateService;
    private final TradeNotifier tradeNotifier;
    private final MetricsService metricsService;
    private final AsyncDelayService delayService;
    private final ExecutionProperties executionProperties;
    @Qualifier("protectiveOrderRetry")
    private final Retry protectiveOrderRetry;
    private final Clock clock;

    private final Set<String> startedTradeIds = ConcurrentHashMap.newKeySet();
    private final Map<String, TradeExecution> activeExecutions = new ConcurrentHashMap<>();
    private final Object closeLock = new Object();

    public ExecutionResult execute(ValidatedTrade trade, OrderPlan plan, PositionKey key) {
        if (!startedTradeIds.add(trade.tradeId())) {
            log.error("INVARIANT VIOLATION: trade {} submitted for execution twice", trade.tradeId());
            throw new InvariantViolationException("Trade " + trade.tradeId() + " already executed");
        }
        TradeExecution execution = new TradeExecution(trade.tradeId(), key, plan, Instant.now(clock));
        activeExecutions.put(trade.tradeId(), execution);
        MDC.put("tradeId", trade.tradeId());
        MDC.put("signalId", String.valueOf(trade.signal().sourceMessageId()));
        try {
            run(trade, execution);
            return execution.toResult();
        } catch (RuntimeException e) {
            log.error("Execution of trade {} failed in state {}", trade.tradeId(), execution.getState(), e);
            if (execution.getState().isCancellable()) {
                if (execution.getEntryOrderId() != null) {
                    cancelQuietly(execution.getPlan(), execution.getEntryOrderId());
                }
                abort(execution, RejectionReason.TRANSPORT_FAILURE, e.getMessage());
                return execution.toResult();
            }
            throw e;
        } finally {
            if (!execution.getState().isEntryFilled()) {
                positionTracker.release(key, trade.tradeId());
            }
            activeExecutions.remove(trade.tradeId());
            MDC.remove("tradeId");
            MDC.remove("signalId");
        }
    }

    /**
     * Requests cancellation of a trade that has not filled yet.
     *
     * @return false when the trade is past the point where it can be abandoned
     */
    public boolean cancel(String tradeId) {
        TradeExecution execution = activeExecutions.get(tradeId);
        if (execution == null) {
            throw new NotFoundException("No running execution for trade " + tradeId);
        }
        boolean accepted = execution.requestCancel();
        log.info("Cancel request for trade {} in state {}: {}", tradeId, execution.getState(),
                accepted ? "accepted" : "refused");
        return accepted;
    }

    public boolean isExecuting(String tradeId) {
        return activeExecutions.containsKey(tradeId);
    }

    public List<ExecutionResult> activeExecutions() {
        return activeExecutions.values().stream().map(TradeExecution::toResult).toList();
    }

    private void run(ValidatedTrade trade, TradeExecution execution) {
        OrderPlan plan = execution.getPlan();
        if (execution.isCancelRequested()) {
            abort(execution, RejectionReason.ENTRY_CANCELLED, "Cancelled before submission");
            return;
        }
        try {
            if (plan.marketType().supportsLeverage()) {
                exchangeGateway.setLeverage(plan.symbol(), plan.leverage());
            }
            ExchangeOrder entry = exchangeGateway.placeLimitOrder(new OrderRequest(plan.symbol(), plan.marketType(),
                    plan.entrySide(), plan.quantity(), plan.entryPrice(), plan.tradeId() + "-E", false));
            metricsService.incrementOrdersPlaced();
            execution.entrySubmitted(entry.orderId());
            log.info("Entry {} submitted {} {} {} @ {}", entry.orderId(), plan.symbol(), plan.entrySide(),
                    plan.quantity(), plan.entryPrice());
        } catch (ExchangeException e) {
            log.warn("Entry submission for {} failed: {} {}", plan.symbol(), e.getErrorType(), e.getMessage());
            abort(execution, rejectionFor(e), e.getErrorType() + ": " + e.getMessage());
            return;
        }

        ExchangeOrder filled = awaitEntryFill(execution);
        if (filled == null) {
            return;
        }
        BigDecimal filledQty = filled.filledQuantity();
        BigDecimal fillPrice = filled.averagePrice() != null ? filled.averagePrice() : plan.entryPrice();
        execution.entryFilled(filledQty, fillPrice);
        if (filledQty.compareTo(plan.quantity()) < 0) {
            log.warn("Entry partially filled {} of {}, protecting filled quantity only", filledQty, plan.quantity());
            execution.replacePlan(orderPlanner.rescale(plan, filledQty));
        }

        PositionKey key = execution.getPositionKey();
        positionTracker.open(key, TrackedPosition.builder()
                .tradeId(trade.tradeId())
                .symbol(plan.symbol())
                .marketType(plan.marketType())
                .direction(plan.direction())
                .entryPrice(fillPrice)
                .quantity(execution.getPlan().quantity())
                .initialQuantity(execution.getPlan().quantity())
                .leverage(plan.leverage())
                .sourceSignalId(trade.signal().sourceMessageId())
                .state(TradeState.ENTRY_FILLED)
                .lastMarkPrice(fillPrice)
                .build());
        tradeNotifier.tradeEntered(trade.tradeId(), plan.symbol(), filledQty, fillPrice);

        protect(execution);
    }

    private ExchangeOrder awaitEntryFill(TradeExecution execution) {
        OrderPlan plan = execution.getPlan();
        String orderId = execution.getEntryOrderId();
        Instant deadline = Instant.now(clock).plusSeconds(executionProperties.getEntryTimeoutSeconds());
        while (Instant.now(clock).isBefore(deadline)) {
            ExchangeOrder status = pollEntry(plan, orderId);
            if (status != null) {
                if (status.status() == ExchangeOrderStatus.FILLED) {
                    return status;
                }
                if (status.status().isDeadUnfilled()) {
                    return finishUnfilled(execution, status, RejectionReason.ENTRY_EXPIRED,
                            "Entry order " + status.status());
                }
            }
            if (execution.isCancelRequested()) {
                return cancelEntry(execution, RejectionReason.ENTRY_CANCELLED, "Cancelled while resting");
            }
            if (!delayService.awaitMillis(executionProperties.getPollDelayMs())) {
                return cancelEntry(execution, RejectionReason.ENTRY_CANCELLED, "Interrupted while waiting for fill");
            }
        }
        log.warn("Entry {} not filled within {}s", orderId, executionProperties.getEntryTimeoutSeconds());
        return cancelEntry(execution, RejectionReason.ENTRY_EXPIRED,
                "Not filled within " + executionProperties.getEntryTimeoutSeconds() + "s");
    }

    private ExchangeOrder pollEntry(OrderPlan plan, String orderId) {
        try {
            return exchangeGateway.fetchOrderStatus(plan.symbol(), plan.marketType(), orderId);
        } catch (ExchangeException e) {
            log.warn("Entry status poll for {} failed: {}", orderId, e.getMessage());
            return null;
        }
    }

    private ExchangeOrder cancelEntry(TradeExecution execution, RejectionReason reason, String detail) {
        OrderPlan plan = execution.getPlan();
        cancelQuietly(plan, execution.getEntryOrderId());
        ExchangeOrder last = pollEntry(plan, execution.getEntryOrderId());
        if (last != null && last.status() == ExchangeOrderStatus.FILLED) {
            return last;
        }
        return finishUnfilled(execution, last, reason, detail);
    }

    private ExchangeOrder finishUnfilled(TradeExecution execution, ExchangeOrder last, RejectionReason reason,
                                         String detail) {
        if (last != null && MoneyUtils.isPositive(last.filledQuantity())) {
            log.warn("Entry {} ended {} with partial fill {}", execution.getEntryOrderId(), last.status(),
                    last.filledQuantity());
            return last;
        }
        abort(execution, reason, detail);
        return null;
    }

    private void abort(TradeExecution execution, RejectionReason reason, String detail) {
        execution.abort(Rejection.of(reason, detail));
        tradeNotifier.signalRejected(execution.getTradeId(), execution.getPlan().symbol(), execution.getRejection());
        metricsService.recordReject(reason);
    }

    private void cancelQuietly(OrderPlan plan, String orderId) {
        try {
            exchangeGateway.cancelOrder(plan.symbol(), plan.marketType(), orderId);
        } catch (ExchangeException e) {
            log.warn("Cancel of entry {} failed: {}", orderId, e.getMessage());
        }
    }

    private void protect(TradeExecution execution) {
        OrderPlan plan = execution.getPlan();
        PositionKey key = execution.getPositionKey();
        String stopOrderId = null;
        List<String> takeProfitIds = new ArrayList<>();
        try {
            stopOrderId = placeProtective(() -> exchangeGateway.placeStopOrder(new OrderRequest(plan.symbol(),
                    plan.marketType(), plan.exitSide(), plan.stopLoss().quantity(), plan.stopLoss().triggerPrice(),
                    plan.tradeId() + "-SL", true)));
            for (OrderPlan.TakeProfitOrderSpec tp : plan.takeProfits()) {
                takeProfitIds.add(placeProtective(() -> exchangeGateway.placeTakeProfitOrder(new OrderRequest(
                        plan.symbol(), plan.marketType(), plan.exitSide(), tp.quantity(), tp.triggerPrice(),
                        plan.tradeId() + "-TP" + tp.level(), true))));
            }
        } catch (RuntimeException e) {
            metricsService.recordProtectiveFailure();
            String placed = (stopOrderId == null ? "no stop-loss" : "stop-loss " + stopOrderId)
                    + ", " + takeProfitIds.size() + "/" + plan.takeProfits().size() + " take-profits";
            log.error("Protective order placement exhausted retries for {} ({}): {}", key, placed, e.getMessage());
            markUnprotected(key, execution, stopOrderId, takeProfitIds,
                    "Protective orders failed after retries (" + placed + "): " + e.getMessage());
            return;
        }

        String slId = stopOrderId;
        execution.transitionTo(TradeState.PROTECTED);
        positionTracker.update(key, position -> {
            position.setStopOrderId(slId);
            position.setTakeProfitOrderIds(new ArrayList<>(takeProfitIds));
            position.setState(TradeState.PROTECTED);
        });
        tradeNotifier.positionProtected(plan.tradeId(), plan.symbol(), takeProfitIds.size());
    }

    private String placeProtective(Supplier<ExchangeOrder> placement) {
        ExchangeOrder order = Retry.decorateSupplier(protectiveOrderRetry, placement).get();
        metricsService.incrementOrdersPlaced();
        return order.orderId();
    }

    private void markUnprotected(PositionKey key, TradeExecution execution, String stopOrderId,
                                 List<String> takeProfitIds, String detail) {
        execution.transitionTo(TradeState.UNPROTECTED);
        positionTracker.update(key, position -> {
            position.setStopOrderId(stopOrderId);
            position.setTakeProfitOrderIds(new ArrayList<>(takeProfitIds));
            position.setState(TradeState.UNPROTECTED);
        });
        tradeNotifier.unprotectedPosition(execution.getTradeId(), execution.getPlan().symbol(), detail);
    }

    /**
     * Escalates a filled position that has no protective orders and no execution working on it, e.g. after a
     * restart between fill and protection.
     */
    public void escalateUnprotected(PositionKey key, String detail) {
        TrackedPosition position = positionTracker.get(key);
        if (position == null || position.getState() != TradeState.ENTRY_FILLED || isExecuting(position.getTradeId())) {
            return;
        }
        positionTracker.update(key, p -> p.setState(TradeState.UNPROTECTED));
        log.error("Position {} has no protective orders: {}", key, detail);
        tradeNotifier.unprotectedPosition(position.getTradeId(), position.getSymbol(), detail);
    }

    /**
     * Books an incremental stop-loss, take-profit or operator close fill. Closes the position and cancels the
     * remaining orders once its quantity reaches zero.
     */
    public void onProtectiveFill(PositionKey key, FillEvent fill) {
        synchronized (closeLock) {
            TrackedPosition before = positionTracker.get(key);
            if (before == null) {
                log.warn("Fill {} for unknown position {}, ignored", fill.orderId(), key);
                return;
            }
            TrackedPosition after = positionTracker.mutate(key, fill);
            if (after.getQuantity().signum() == 0) {
                cancelSiblings(after, fill.orderId());
                closeAndBook(key, after, closeReason(fill.orderType()));
                return;
            }
            if (after.getState() == TradeState.PROTECTED || after.getState() == TradeState.PARTIALLY_CLOSED) {
                requireTransition(after, TradeState.PARTIALLY_CLOSED);
                positionTracker.update(key, p -> p.setState(TradeState.PARTIALLY_CLOSED));
            }
        }
    }

    /**
     * Operator close: rests a reduce-only limit for the open quantity at {@code exitPrice}. The position stays
     * tracked as CLOSING with its protective orders live; the exit is booked from the close order's fills.
     *
     * @return the position in CLOSING state
     */
    public TrackedPosition closeManually(PositionKey key, BigDecimal exitPrice) {
        synchronized (closeLock) {
            TrackedPosition position = positionTracker.get(key);
            if (position == null) {
                throw new NotFoundException("No open position for " + key);
            }
            if (isExecuting(position.getTradeId())) {
                throw new InvariantViolationException("Trade " + position.getTradeId() + " is still being executed");
            }
            if (position.getState() == TradeState.CLOSING) {
                throw new InvariantViolationException("Close order " + position.getCloseOrderId()
                        + " already pending for trade " + position.getTradeId());
            }
            requireTransition(position, TradeState.CLOSING);
            ExchangeOrder closeOrder;
            try {
                closeOrder = exchangeGateway.placeLimitOrder(new OrderRequest(position.getSymbol(),
                        position.getMarketType(), position.getDirection().exitSide(), position.getQuantity(),
                        exitPrice, position.getTradeId() + "-MC" + Instant.now(clock).toEpochMilli(), true));
            } catch (ExchangeException e) {
                log.warn("Close order for {} refused, protection left in place: {} {}", key, e.getErrorType(),
                        e.getMessage());
                throw e;
            }
            metricsService.incrementOrdersPlaced();
            log.info("Close order {} resting for {} qty={} @ {}", closeOrder.orderId(), key, position.getQuantity(),
                    exitPrice);
            return positionTracker.update(key, p -> {
                p.setCloseOrderId(closeOrder.orderId());
                p.setState(TradeState.CLOSING);
            });
        }
    }

    /**
     * The operator close order ended without flattening the position. The position returns to the state its
     * protective orders support.
     */
    public void onCloseOrderEnded(PositionKey key, String closeOrderId, ExchangeOrderStatus status) {
        synchronized (closeLock) {
            TrackedPosition position = positionTracker.get(key);
            if (position == null || !closeOrderId.equals(position.getCloseOrderId())) {
                return;
            }
            TradeState restored = position.getStopOrderId() == null
                    ? TradeState.UNPROTECTED
                    : position.getQuantity().compareTo(position.getInitialQuantity()) < 0
                            ? TradeState.PARTIALLY_CLOSED
                            : TradeState.PROTECTED;
            requireTransition(position, restored);
            positionTracker.update(key, p -> {
                p.setCloseOrderId(null);
                p.setState(restored);
            });
            log.warn("Close order {} of {} ended {} with {} still open, back to {}", closeOrderId,
                    position.getTradeId(), status, position.getQuantity(), restored);
            if (restored == TradeState.UNPROTECTED) {
                tradeNotifier.unprotectedPosition(position.getTradeId(), position.getSymbol(),
                        "Close order " + closeOrderId + " ended " + status + " and the position has no stop-loss");
            }
        }
    }

    /**
     * Reconciliation path: the position disappeared from the exchange. PnL of the remaining quantity is
     * inferred from the last known price.
     */
    public TrackedPosition closeExternally(PositionKey key) {
        synchronized (closeLock) {
            TrackedPosition position = positionTracker.get(key);
            if (position == null) {
                return null;
            }
            BigDecimal exitPrice = position.getLastMarkPrice() != null ? position.getLastMarkPrice() : position.getEntryPrice();
            TrackedPosition booked = bookExit(key, exitPrice);
            return closeAndBook(key, booked, CloseReason.EXTERNAL);
        }
    }

    private TrackedPosition bookExit(PositionKey key, BigDecimal exitPrice) {
        return positionTracker.update(key, p -> {
            BigDecimal pnl = MoneyUtils.multiply(p.getDirection().favourableMove(p.getEntryPrice(), exitPrice), p.getQuantity());
            p.setRealizedPnl(MoneyUtils.add(p.getRealizedPnl(), pnl));
            p.setQuantity(MoneyUtils.ZERO);
            p.setLastMarkPrice(exitPrice);
        });
    }

    private TrackedPosition closeAndBook(PositionKey key, TrackedPosition position, CloseReason reason) {
        requireTransition(position, TradeState.CLOSED);
        TrackedPosition closed = positionTracker.close(key, reason);
        metricsService.recordPositionClosed();
        riskStateService.recordRealizedPnl(closed.getRealizedPnl());
        tradeNotifier.positionClosed(closed.getTradeId(), closed.getSymbol(), closed.getRealizedPnl(), reason.name());
        return closed;
    }

    private void cancelSiblings(TrackedPosition position, String filledOrderId) {
        List<String> ids = new ArrayList<>(position.getTakeProfitOrderIds());
        if (position.getStopOrderId() != null) {
            ids.add(position.getStopOrderId());
        }
        if (position.getCloseOrderId() != null) {
            ids.add(position.getCloseOrderId());
        }
        for (String orderId : ids) {
            if (orderId.equals(filledOrderId)) {
                continue;
            }
            try {
                ExchangeOrder order = exchangeGateway.fetchOrderStatus(position.getSymbol(), position.getMarketType(), orderId);
                if (!order.status().isTerminal()) {
                    exchangeGateway.cancelOrder(position.getSymbol(), position.getMarketType(), orderId);
                    log.info("Cancelled sibling protective order {} of {}", orderId, position.getTradeId());
                }
            } catch (ExchangeException e) {
                log.warn("Could not cancel sibling order {} of {}: {}", orderId, position.getTradeId(), e.getMessage());
            }
        }
    }

    private void requireTransition(TrackedPosition position, TradeState target) {
        if (!position.getState().canTransitionTo(target)) {
            log.error("INVARIANT VIOLATION: position {} cannot move {} -> {}", position.getTradeId(),
                    position.getState(), target);
            throw new InvariantViolationException("Illegal transition " + position.getState() + " -> " + target);
        }
    }

    private CloseReason closeReason(FillEvent.ProtectiveOrderType orderType) {
        return switch (orderType) {
            case STOP_LOSS -> CloseReason.STOP_LOSS;
            case TAKE_PROFIT -> CloseReason.TAKE_PROFIT;
            case MANUAL_CLOSE -> CloseReason.MANUAL;
        };
    }

    private RejectionReason rejectionFor(ExchangeException e) {
        if (e instanceof TransientTransportException) {
            return RejectionReason.TRANSPORT_FAILURE;
        }
        if (e instanceof ExchangeRejectionException) {
            return RejectionReason.EXCHANGE_REJECTED;
        }
        return e.isTransient() ? RejectionReason.TRANSPORT_FAILURE : RejectionReason.EXCHANGE_REJECTED;
    }
}
