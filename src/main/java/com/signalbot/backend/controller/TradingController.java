package com.signalbot.backend.controller;

import com.signalbot.backend.config.TradingConfigSnapshot;
import com.signalbot.backend.config.TradingConfigHolder;
import com.signalbot.backend.dto.PositionResponse;
import com.signalbot.backend.dto.StatusResponse;
import com.signalbot.backend.entity.TrackedPosition;
import com.signalbot.backend.exception.NotFoundException;
import com.signalbot.backend.model.MarketType;
import com.signalbot.backend.model.PositionKey;
import com.signalbot.backend.service.AlertService;
import com.signalbot.backend.service.TradeStatisticsService;
import com.signalbot.backend.service.execution.ExecutionEngine;
import com.signalbot.backend.service.position.PositionTracker;
import com.signalbot.backend.service.risk.ReconciliationService;
import com.signalbot.backend.service.risk.RiskStateService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class TradingController {

    private final PositionTracker positionTracker;
    private final RiskStateService riskStateService;
    private final ReconciliationService reconciliationService;
    private final ExecutionEngine executionEngine;
    private final TradeStatisticsService tradeStatisticsService;
    private final TradingConfigHolder configHolder;
    private final AlertService alertService;

    @Value("${control.admin-token:}")
    private String adminToken;

    @GetMapping("/positions")
    public List<PositionResponse> positions() {
        return positionTracker.snapshot().stream().map(PositionResponse::from).toList();
    }

    @GetMapping("/status")
    public StatusResponse status() {
        TradingConfigSnapshot config = configHolder.current();
        Map<String, Integer> open = new LinkedHashMap<>();
        for (MarketType marketType : MarketType.values()) {
            open.put(marketType.name(), positionTracker.activeCount(marketType));
        }
        return StatusResponse.builder()
                .mode(config.mode().name())
                .configVersion(config.version())
                .tradingEnabled(riskStateService.isTradingEnabled() && config.tradingEnabled())
                .haltReason(riskStateService.haltReason())
                .dailyRealizedPnl(riskStateService.dailyRealizedPnl())
                .maxDailyLoss(config.maxDailyLoss())
                .openPositions(open)
                .activeExecutions(executionEngine.activeExecutions())
                .statistics(tradeStatisticsService.statistics())
                .criticalAlerts(alertService.criticalAlerts())
                .build();
    }

    @PostMapping("/risk/enable")
    public ResponseEntity<?> enableTrading(@RequestHeader(value = "X-Admin-Token", required = false) String token) {
        if (!authorized(token)) {
            return forbidden();
        }
        riskStateService.enableTrading();
        alertService.acknowledgeCritical();
        return ResponseEntity.ok(Map.of("tradingEnabled", riskStateService.isTradingEnabled()));
    }

    @PostMapping("/risk/disable")
    public ResponseEntity<?> disableTrading(@RequestHeader(value = "X-Admin-Token", required = false) String token,
                                            @RequestParam(value = "reason", required = false) String reason) {
        if (!authorized(token)) {
            return forbidden();
        }
        riskStateService.disableTrading(reason);
        return ResponseEntity.ok(Map.of("tradingEnabled", false, "reason", String.valueOf(riskStateService.haltReason())));
    }

    @PostMapping("/reconcile")
    public ResponseEntity<?> reconcile(@RequestHeader(value = "X-Admin-Token", required = false) String token) {
        if (!authorized(token)) {
            return forbidden();
        }
        return ResponseEntity.ok(reconciliationService.reconcile());
    }

    @GetMapping("/reconcile/last-report")
    public ResponseEntity<ReconciliationService.ReconcileReport> lastReport() {
        ReconciliationService.ReconcileReport report = reconciliationService.getLastReport();
        return report == null ? ResponseEntity.noContent().build() : ResponseEntity.ok(report);
    }

    @DeleteMapping("/trades/{tradeId}")
    public ResponseEntity<?> cancelTrade(@RequestHeader(value = "X-Admin-Token", required = false) String token,
                                         @PathVariable String tradeId) {
        if (!authorized(token)) {
            return forbidden();
        }
        boolean cancelled = executionEngine.cancel(tradeId);
        if (!cancelled) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of(
                    "tradeId", tradeId,
                    "cancelled", false,
                    "message", "Entry already filled, close the position instead"));
        }
        return ResponseEntity.accepted().body(Map.of("tradeId", tradeId, "cancelled", true));
    }

    @PostMapping("/positions/{tradeId}/close")
    public ResponseEntity<?> closePosition(@RequestHeader(value = "X-Admin-Token", required = false) String token,
                                           @PathVariable String tradeId,
                                           @RequestParam("exitPrice") BigDecimal exitPrice) {
        if (!authorized(token)) {
            return forbidden();
        }
        PositionKey key = positionTracker.findKeyByTradeId(tradeId);
        if (key == null) {
            throw new NotFoundException("No open position for trade " + tradeId);
        }
        TrackedPosition closing = executionEngine.closeManually(key, exitPrice);
        return ResponseEntity.accepted().body(PositionResponse.from(closing));
    }

    private boolean authorized(String token) {
        return adminToken == null || adminToken.isBlank() || adminToken.equals(token);
    }

    private ResponseEntity<?> forbidden() {
        return ResponseEntity.status(HttpStatus.FORBIDDEN).body(Map.of("error", "Not authorized"));
    }
}
