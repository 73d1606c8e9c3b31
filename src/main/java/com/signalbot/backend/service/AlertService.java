package com.signalbot.backend.service;

import com.signalbot.backend.service.notification.TradeLifecycleEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentLinkedDeque;

/**
 * Keeps the most recent alerts for the status endpoint. Critical alerts are logged at ERROR and
 * stay visible until acknowledged.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AlertService {

    private static final int MAX_RECENT = 100;

    private final Clock clock;
    private final Deque<Map<String, Object>> recent = new ConcurrentLinkedDeque<>();
    private final Deque<Map<String, Object>> unacknowledgedCritical = new ConcurrentLinkedDeque<>();

    public void critical(String type, String tradeId, String message) {
        log.error("CRITICAL ALERT [{}] trade={} {}", type, tradeId, message);
        Map<String, Object> alert = alert(type, tradeId, message);
        unacknowledgedCritical.add(alert);
        push(alert);
    }

    public void record(TradeLifecycleEvent event) {
        push(alert(event.type().name(), event.tradeId(), event.message()));
    }

    public List<Map<String, Object>> recentAlerts() {
        return new ArrayList<>(recent);
    }

    public List<Map<String, Object>> criticalAlerts() {
        return new ArrayList<>(unacknowledgedCritical);
    }

    public void acknowledgeCritical() {
        unacknowledgedCritical.clear();
    }

    private Map<String, Object> alert(String type, String tradeId, String message) {
        return Map.of(
                "alertType", type,
                "tradeId", tradeId == null ? "" : tradeId,
                "message", message,
                "timestamp", Instant.now(clock)
        );
    }

    private void push(Map<String, Object> alert) {
        recent.addFirst(alert);
        while (recent.size() > MAX_RECENT) {
            recent.pollLast();
        }
    }
}
