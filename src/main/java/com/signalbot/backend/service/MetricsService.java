package com.signalbot.backend.service;

import com.signalbot.backend.model.RejectionReason;
import jakarta.annotation.PostConstruct;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.concurrent.atomic.AtomicReference;

@Service
@RequiredArgsConstructor
public class MetricsService {

    private final MeterRegistry meterRegistry;

    private final AtomicReference<Double> pnlDaily = new AtomicReference<>(0.0);

    private Counter signalsAcceptedCounter;
    private Counter ordersPlacedCounter;
    private Counter protectiveFailuresCounter;
    private Counter positionsClosedCounter;

    @PostConstruct
    void init() {
        signalsAcceptedCounter = Counter.builder("signals_accepted_total").register(meterRegistry);
        ordersPlacedCounter = Counter.builder("orders_placed_total").register(meterRegistry);
        protectiveFailuresCounter = Counter.builder("protective_order_failures_total").register(meterRegistry);
        positionsClosedCounter = Counter.builder("positions_closed_total").register(meterRegistry);
        Gauge.builder("pnl_daily", pnlDaily, value -> value.get()).register(meterRegistry);
    }

    public void recordAccepted() {
        if (signalsAcceptedCounter != null) {
            signalsAcceptedCounter.increment();
        }
    }

    public void recordReject(RejectionReason reason) {
        Counter.builder("signals_rejected_total")
                .tag("reason", reason == null ? "unknown" : reason.name())
                .register(meterRegistry)
                .increment();
    }

    public void incrementOrdersPlaced() {
        if (ordersPlacedCounter != null) {
            ordersPlacedCounter.increment();
        }
    }

    public void recordProtectiveFailure() {
        if (protectiveFailuresCounter != null) {
            protectiveFailuresCounter.increment();
        }
    }

    public void recordPositionClosed() {
        if (positionsClosedCounter != null) {
            positionsClosedCounter.increment();
        }
    }

    public void updateDailyPnl(BigDecimal pnl) {
        pnlDaily.set(pnl == null ? 0.0 : pnl.doubleValue());
    }
}
