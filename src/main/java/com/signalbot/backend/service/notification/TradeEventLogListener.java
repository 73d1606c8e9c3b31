package com.signalbot.backend.service.notification;

import com.signalbot.backend.service.AlertService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

@Component
@Slf4j
@RequiredArgsConstructor
public class TradeEventLogListener {

    private final AlertService alertService;

    @EventListener(TradeLifecycleEvent.class)
    public void onEvent(TradeLifecycleEvent event) {
        if (event.isCritical()) {
            alertService.critical(event.type().name(), event.tradeId(), event.message());
            return;
        }
        switch (event.type()) {
            case SIGNAL_REJECTED, RECONCILIATION_DISCREPANCY ->
                    log.warn("[{}] {} {}", event.type(), event.symbol(), event.message());
            default -> log.info("[{}] trade={} {} {}", event.type(), event.tradeId(), event.symbol(), event.message());
        }
        alertService.record(event);
    }
}
