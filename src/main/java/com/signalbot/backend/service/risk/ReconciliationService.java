package com.signalbot.backend.service.risk;

import com.signalbot.backend.config.TradingConfigHolder;
import com.signalbot.backend.entity.TrackedPosition;
import com.signalbot.backend.exception.ExchangeException;
import com.signalbot.backend.exchange.ExchangeGateway;
import com.signalbot.backend.exchange.ExchangeGateway.ExchangePosition;
import com.signalbot.backend.model.PositionKey;
import com.signalbot.backend.model.TradeState;
import com.signalbot.backend.service.execution.ExecutionEngine;
import com.signalbot.backend.service.execution.ProtectiveOrderMonitor;
import com.signalbot.backend.service.notification.TradeNotifier;
import com.signalbot.backend.service.position.PositionTracker;
import com.signalbot.backend.util.MoneyUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Compares the exchange's open positions with the tracked map and corrects bookkeeping. Never places
 * entry orders. Each discrepancy is reported once; a second run without exchange changes is a no-op.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ReconciliationService {

    private final ExchangeGateway exchangeGateway;
    private final PositionTracker positionTracker;
    private final ExecutionEngine executionEngine;
    private final ProtectiveOrderMonitor protectiveOrderMonitor;
    private final TradingConfigHolder configHolder;
    private final TradeNotifier tradeNotifier;
    private final Clock clock;

    private final Set<String> warnedUntracked = new HashSet<>();
    private final Set<String> warnedMismatch = new HashSet<>();
    private volatile ReconcileReport lastReport;

    @Value("${reconcile.enabled:true}")
    private boolean enabled;

    // relative quantity difference above which a correction is also surfaced as a discrepancy
    @Value("${reconcile.qty-tolerance-pct:0.01}")
    private BigDecimal qtyTolerancePct;

    @Value("${reconcile.adopt-untracked:false}")
    private boolean adoptUntracked;

    // positions younger than this are skipped while the exchange view catches up
    @Value("${reconcile.grace-seconds:30}")
    private long graceSeconds;

    @EventListener(ApplicationReadyEvent.class)
    public void onStartup() {
        log.info("Startup reconciliation against exchange");
        runScheduled();
    }

    @Scheduled(fixedDelayString = "${reconcile.interval-ms:60000}", initialDelayString = "${reconcile.interval-ms:60000}")
    public void runScheduled() {
        try {
            reconcile();
        } catch (Exception e) {
            log.error("Reconciliation task failed", e);
        }
    }

    public synchronized ReconcileReport reconcile() {
        if (!enabled) {
            return ReconcileReport.disabled();
        }
        // book protective fills first so they are not mistaken for quantity drift
        protectiveOrderMonitor.poll();
        List<ExchangePosition> exchangePositions;
        try {
            exchangePositions = exchangeGateway.fetchOpenPositions();
        } catch (ExchangeException e) {
            log.warn("Reconciliation skipped, exchange positions unavailable: {}", e.getMessage());
            return ReconcileReport.failed(e.getMessage());
        }

        boolean hedging = configHolder.current().allowHedging();
        Map<PositionKey, ExchangePosition> exchangeByKey = new LinkedHashMap<>();
        for (ExchangePosition position : exchangePositions) {
            if (position.quantity() != null && position.quantity().signum() > 0) {
                exchangeByKey.put(PositionKey.of(position.symbol(), position.marketType(), position.direction(), hedging),
                        position);
            }
        }

        List<String> closedExternally = new ArrayList<>();
        List<String> corrections = new ArrayList<>();
        List<String> untracked = new ArrayList<>();
        List<String> adopted = new ArrayList<>();
        Map<PositionKey, TrackedPosition> tracked = positionTracker.snapshotByKey();
        Instant graceCutoff = Instant.now(clock).minusSeconds(graceSeconds);

        for (Map.Entry<PositionKey, TrackedPosition> entry : tracked.entrySet()) {
            PositionKey key = entry.getKey();
            TrackedPosition position = entry.getValue();
            if (executionEngine.isExecuting(position.getTradeId())
                    || (position.getOpenedAt() != null && position.getOpenedAt().isAfter(graceCutoff))) {
                continue;
            }
            ExchangePosition onExchange = exchangeByKey.get(key);
            if (onExchange == null) {
                TrackedPosition closed = executionEngine.closeExternally(key);
                if (closed != null) {
                    String message = "Tracked position " + key + " (trade " + closed.getTradeId()
                            + ") absent on exchange, closed externally with inferred PnL " + closed.getRealizedPnl();
                    log.warn(message);
                    closedExternally.add(message);
                    tradeNotifier.reconciliationDiscrepancy(key.symbol(), message);
                }
                continue;
            }
            correctQuantity(key, position, onExchange, corrections);
        }

        for (Map.Entry<PositionKey, ExchangePosition> entry : exchangeByKey.entrySet()) {
            if (tracked.containsKey(entry.getKey())) {
                continue;
            }
            ExchangePosition position = entry.getValue();
            if (adoptUntracked) {
                adopt(entry.getKey(), position);
                adopted.add(entry.getKey().toString());
            } else if (warnedUntracked.add(position.positionId())) {
                String message = "Untracked position on exchange: " + position.symbol() + " " + position.marketType()
                        + " " + position.direction() + " qty=" + position.quantity() + " id=" + position.positionId();
                log.warn(message);
                untracked.add(message);
                tradeNotifier.reconciliationDiscrepancy(position.symbol(), message);
            }
        }
        Set<String> liveIds = new HashSet<>();
        exchangeByKey.values().forEach(position -> liveIds.add(position.positionId()));
        warnedUntracked.retainAll(liveIds);
        Set<String> trackedTradeIds = new HashSet<>();
        positionTracker.snapshot().forEach(position -> trackedTradeIds.add(position.getTradeId()));
        warnedMismatch.removeIf(warned -> !trackedTradeIds.contains(warned.substring(0, warned.lastIndexOf('|'))));

        ReconcileReport report = new ReconcileReport(true, null, closedExternally, corrections, untracked, adopted);
        lastReport = report;
        if (report.hasChanges()) {
            log.info("Reconciliation: {} closed externally, {} corrected, {} untracked, {} adopted",
                    closedExternally.size(), corrections.size(), untracked.size(), adopted.size());
        } else {
            log.debug("Reconciliation: tracked state matches exchange ({} positions)", tracked.size());
        }
        return report;
    }

    public ReconcileReport getLastReport() {
        return lastReport;
    }

    private void correctQuantity(PositionKey key, TrackedPosition position, ExchangePosition onExchange,
                                 List<String> corrections) {
        BigDecimal trackedQty = position.getQuantity();
        BigDecimal exchangeQty = onExchange.quantity();
        if (trackedQty.compareTo(exchangeQty) == 0) {
            if (onExchange.markPrice() != null && !onExchange.markPrice().equals(position.getLastMarkPrice())) {
                positionTracker.update(key, p -> p.setLastMarkPrice(onExchange.markPrice()));
            }
            return;
        }
        positionTracker.update(key, p -> {
            p.setQuantity(MoneyUtils.scale(exchangeQty));
            if (onExchange.markPrice() != null) {
                p.setLastMarkPrice(onExchange.markPrice());
            }
        });
        String message = "Quantity of " + key + " corrected " + trackedQty + " -> " + exchangeQty;
        corrections.add(message);
        BigDecimal relative = trackedQty.signum() == 0
                ? BigDecimal.ONE
                : trackedQty.subtract(exchangeQty).abs().divide(trackedQty, 8, RoundingMode.HALF_UP);
        if (relative.compareTo(qtyTolerancePct) > 0 && warnedMismatch.add(position.getTradeId() + "|" + exchangeQty)) {
            log.warn(message);
            tradeNotifier.reconciliationDiscrepancy(key.symbol(), message);
        } else {
            log.info(message);
        }
    }

    private void adopt(PositionKey key, ExchangePosition position) {
        String tradeId = "ADOPTED-" + position.positionId();
        positionTracker.open(key, TrackedPosition.builder()
                .tradeId(tradeId)
                .symbol(position.symbol())
                .marketType(position.marketType())
                .direction(position.direction())
                .entryPrice(position.entryPrice())
                .quantity(MoneyUtils.scale(position.quantity()))
                .initialQuantity(MoneyUtils.scale(position.quantity()))
                .leverage(1)
                .state(TradeState.UNPROTECTED)
                .lastMarkPrice(position.markPrice())
                .build());
        String message = "Adopted untracked exchange position " + key + " as " + tradeId + " without protective orders";
        log.warn(message);
        tradeNotifier.unprotectedPosition(tradeId, position.symbol(), message);
    }

    public record ReconcileReport(boolean enabled, String error, List<String> closedExternally,
                                  List<String> quantityCorrections, List<String> untrackedNotices,
                                  List<String> adopted) {

        static ReconcileReport disabled() {
            return new ReconcileReport(false, null, List.of(), List.of(), List.of(), List.of());
        }

        static ReconcileReport failed(String error) {
            return new ReconcileReport(true, error, List.of(), List.of(), List.of(), List.of());
        }

        public boolean hasChanges() {
            return !(closedExternally.isEmpty() && quantityCorrections.isEmpty()
                    && untrackedNotices.isEmpty() && adopted.isEmpty());
        }
    }
}
