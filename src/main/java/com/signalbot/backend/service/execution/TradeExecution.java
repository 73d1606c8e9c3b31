package com.signalbot.backend.service.execution;

import com.signalbot.backend.exception.InvariantViolationException;
import com.signalbot.backend.model.OrderPlan;
import com.signalbot.backend.model.PositionKey;
import com.signalbot.backend.model.Rejection;
import com.signalbot.backend.model.TradeState;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Execution state of one trade. Transitions are applied by the single thread running the trade; the
 * cancel flag is the only field written from outside.
 */
@Slf4j
@Getter
public class TradeExecution {

    private final String tradeId;
    private final PositionKey positionKey;
    private final Instant createdAt;
    private OrderPlan plan;
    private volatile TradeState state = TradeState.PLANNED;
    private volatile boolean cancelRequested;
    private String entryOrderId;
    private BigDecimal filledQuantity = BigDecimal.ZERO;
    private BigDecimal averageFillPrice;
    private Rejection rejection;

    public TradeExecution(String tradeId, PositionKey positionKey, OrderPlan plan, Instant createdAt) {
        this.tradeId = tradeId;
        this.positionKey = positionKey;
        this.plan = plan;
        this.createdAt = createdAt;
    }

    public synchronized void transitionTo(TradeState target) {
        if (!state.canTransitionTo(target)) {
            throw new InvariantViolationException("Illegal transition " + state + " -> " + target + " for " + tradeId);
        }
        log.info("Trade {} {} -> {}", tradeId, state, target);
        state = target;
    }

    public synchronized void abort(Rejection reason) {
        this.rejection = reason;
        transitionTo(TradeState.ABORTED);
    }

    /**
     * @return false once the entry has filled; cancelling then means closing the position
     */
    public synchronized boolean requestCancel() {
        if (!state.isCancellable()) {
            return false;
        }
        cancelRequested = true;
        return true;
    }

    void entrySubmitted(String orderId) {
        this.entryOrderId = orderId;
        transitionTo(TradeState.ENTRY_SUBMITTED);
    }

    void entryFilled(BigDecimal quantity, BigDecimal averagePrice) {
        this.filledQuantity = quantity;
        this.averageFillPrice = averagePrice;
        transitionTo(TradeState.ENTRY_FILLED);
    }

    void replacePlan(OrderPlan rescaled) {
        this.plan = rescaled;
    }

    public ExecutionResult toResult() {
        return new ExecutionResult(tradeId, state, filledQuantity, averageFillPrice, rejection);
    }
}
