package com.signalbot.backend.service.notification;

import com.signalbot.backend.model.Rejection;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * Fire-and-forget lifecycle notifications for the control surface. A failing listener is logged and
 * never propagates into the trading path.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TradeNotifier {

    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    public void signalRejected(String signalId, String symbol, Rejection rejection) {
        publish(TradeEventType.SIGNAL_REJECTED, signalId, symbol,
                "Signal rejected: " + rejection.reason() + (rejection.detail() == null ? "" : " (" + rejection.detail() + ")"),
                Map.of("reason", rejection.reason().name()));
    }

    public void tradeEntered(String tradeId, String symbol, BigDecimal quantity, BigDecimal price) {
        publish(TradeEventType.TRADE_ENTERED, tradeId, symbol,
                "Entry filled " + quantity + " @ " + price,
                Map.of("quantity", quantity, "price", price));
    }

    public void positionProtected(String tradeId, String symbol, int takeProfitCount) {
        publish(TradeEventType.POSITION_PROTECTED, tradeId, symbol,
                "Stop-loss and " + takeProfitCount + " take-profit orders placed",
                Map.of("takeProfits", takeProfitCount));
    }

    public void positionClosed(String tradeId, String symbol, BigDecimal realizedPnl, String closeReason) {
        publish(TradeEventType.POSITION_CLOSED, tradeId, symbol,
                "Position closed (" + closeReason + "), realized PnL " + realizedPnl,
                Map.of("realizedPnl", realizedPnl, "closeReason", closeReason));
    }

    public void reconciliationDiscrepancy(String symbol, String message) {
        publish(TradeEventType.RECONCILIATION_DISCREPANCY, null, symbol, message, Map.of());
    }

    public void dailyLossHalt(BigDecimal dailyPnl, BigDecimal maxDailyLoss) {
        publish(TradeEventType.DAILY_LOSS_HALT, null, null,
                "Daily loss limit hit: " + dailyPnl + " <= -" + maxDailyLoss + ", trading disabled",
                Map.of("dailyPnl", dailyPnl, "maxDailyLoss", maxDailyLoss));
    }

    public void unprotectedPosition(String tradeId, String symbol, String detail) {
        Map<String, Object> details = new HashMap<>();
        details.put("detail", detail);
        publish(TradeEventType.UNPROTECTED_POSITION, tradeId, symbol,
                "UNPROTECTED POSITION, manual intervention required: " + detail, details);
    }

    private void publish(TradeEventType type, String tradeId, String symbol, String message, Map<String, Object> details) {
        try {
            eventPublisher.publishEvent(new TradeLifecycleEvent(type, tradeId, symbol, message, details,
                    Instant.now(clock)));
        } catch (Exception e) {
            log.warn("Notification {} for {} not delivered: {}", type, tradeId != null ? tradeId : symbol, e.getMessage());
        }
    }
}
