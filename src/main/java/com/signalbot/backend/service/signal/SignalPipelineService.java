package com.signalbot.backend.service.signal;

import com.signalbot.backend.config.TradingConfigHolder;
import com.signalbot.backend.config.TradingConfigSnapshot;
import com.signalbot.backend.exception.OrderPlanningException;
import com.signalbot.backend.model.CandidateSignal;
import com.signalbot.backend.model.MarketType;
import com.signalbot.backend.model.OrderPlan;
import com.signalbot.backend.model.PositionKey;
import com.signalbot.backend.model.Rejection;
import com.signalbot.backend.model.RejectionReason;
import com.signalbot.backend.model.SignalValidationResult;
import com.signalbot.backend.model.ValidatedTrade;
import com.signalbot.backend.service.MetricsService;
import com.signalbot.backend.service.execution.ExecutionEngine;
import com.signalbot.backend.service.execution.ExecutionResult;
import com.signalbot.backend.service.notification.TradeNotifier;
import com.signalbot.backend.service.planner.OrderPlanner;
import com.signalbot.backend.service.position.PositionTracker;
import com.signalbot.backend.service.risk.RiskStateService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Validate, plan and reserve under one decision lock, then hand the trade to the bounded trading executor.
 * The lock makes the duplicate checks and the fingerprint insert a single critical section, so two
 * interleaved copies of a signal can never both pass.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SignalPipelineService {

    private final TradingConfigHolder configHolder;
    private final RiskStateService riskStateService;
    private final PositionTracker positionTracker;
    private final SignalValidator signalValidator;
    private final OrderPlanner orderPlanner;
    private final ExecutionEngine executionEngine;
    private final TradeNotifier tradeNotifier;
    private final MetricsService metricsService;
    @Qualifier("tradingExecutor")
    private final TaskExecutor tradingExecutor;

    private final ReentrantLock decisionLock = new ReentrantLock();

    public PipelineResult submit(CandidateSignal candidate) {
        String signalId = candidate.sourceMessageId() != null ? candidate.sourceMessageId() : "sig-" + UUID.randomUUID();
        MDC.put("signalId", signalId);
        MDC.put("correlationId", UUID.randomUUID().toString());
        try {
            Decision decision = decide(candidate, signalId);
            if (decision.rejection() != null) {
                return reject(signalId, candidate.symbol(), decision.rejection());
            }
            ValidatedTrade trade = decision.trade();
            try {
                tradingExecutor.execute(() -> runExecution(trade, decision.plan(), decision.key()));
            } catch (TaskRejectedException e) {
                positionTracker.release(decision.key(), trade.tradeId());
                log.warn("Trading queue full, trade {} for {} not started", trade.tradeId(), candidate.symbol());
                return reject(signalId, candidate.symbol(),
                        Rejection.of(RejectionReason.QUEUE_FULL, "Trading executor queue is full"));
            }
            metricsService.recordAccepted();
            return PipelineResult.accepted(signalId, trade.tradeId());
        } finally {
            MDC.remove("signalId");
            MDC.remove("correlationId");
        }
    }

    private Decision decide(CandidateSignal candidate, String signalId) {
        decisionLock.lock();
        try {
            TradingConfigSnapshot config = configHolder.current();
            RiskSnapshot risk = riskSnapshot();
            SignalValidationResult result = signalValidator.validate(candidate, config, risk);
            if (!result.isAccepted()) {
                return Decision.rejected(result.rejection());
            }
            ValidatedTrade trade = result.trade();
            OrderPlan plan;
            try {
                plan = orderPlanner.plan(trade);
            } catch (OrderPlanningException e) {
                return Decision.rejected(Rejection.of(e.getReason(), e.getMessage()));
            }
            PositionKey key = trade.positionKey(config.allowHedging());
            if (!positionTracker.reserve(key, trade.tradeId())) {
                log.error("INVARIANT VIOLATION: slot {} taken after validation of signal {}", key, signalId);
                return Decision.rejected(Rejection.of(RejectionReason.DUPLICATE_POSITION, "Slot taken for " + key));
            }
            return new Decision(trade, plan, key, null);
        } finally {
            decisionLock.unlock();
        }
    }

    private RiskSnapshot riskSnapshot() {
        Map<MarketType, Integer> counts = new EnumMap<>(MarketType.class);
        for (MarketType marketType : MarketType.values()) {
            counts.put(marketType, positionTracker.activeCount(marketType));
        }
        return new RiskSnapshot(riskStateService.isTradingEnabled(), counts, positionTracker.occupiedKeys());
    }

    private void runExecution(ValidatedTrade trade, OrderPlan plan, PositionKey key) {
        try {
            ExecutionResult result = executionEngine.execute(trade, plan, key);
            log.info("Trade {} finished execution in state {}", trade.tradeId(), result.state());
        } catch (Exception e) {
            log.error("Trade {} execution failed", trade.tradeId(), e);
        }
    }

    private PipelineResult reject(String signalId, String symbol, Rejection rejection) {
        log.warn("Signal {} for {} rejected: {} {}", signalId, symbol, rejection.reason(),
                rejection.detail() == null ? "" : rejection.detail());
        metricsService.recordReject(rejection.reason());
        tradeNotifier.signalRejected(signalId, symbol, rejection);
        return PipelineResult.rejected(signalId, rejection);
    }

    private record Decision(ValidatedTrade trade, OrderPlan plan, PositionKey key, Rejection rejection) {
        static Decision rejected(Rejection rejection) {
            return new Decision(null, null, null, rejection);
        }
    }
}
