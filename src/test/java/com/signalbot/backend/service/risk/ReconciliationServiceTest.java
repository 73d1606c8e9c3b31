package com.signalbot.backend.service.risk;

import com.signalbot.backend.config.TradingConfigHolder;
import com.signalbot.backend.entity.TrackedPosition;
import com.signalbot.backend.exception.TransientTransportException;
import com.signalbot.backend.exchange.ExchangeGateway;
import com.signalbot.backend.exchange.ExchangeGateway.ExchangePosition;
import com.signalbot.backend.model.CloseReason;
import com.signalbot.backend.model.Direction;
import com.signalbot.backend.model.MarketType;
import com.signalbot.backend.model.PositionKey;
import com.signalbot.backend.model.TradeState;
import com.signalbot.backend.repository.TrackedPositionRepository;
import com.signalbot.backend.service.AsyncDelayService;
import com.signalbot.backend.service.MetricsService;
import com.signalbot.backend.service.execution.ExecutionEngine;
import com.signalbot.backend.service.execution.ProtectiveOrderMonitor;
import com.signalbot.backend.service.notification.TradeNotifier;
import com.signalbot.backend.service.planner.OrderPlanner;
import com.signalbot.backend.service.position.PositionTracker;
import com.signalbot.backend.util.MutableClock;
import io.github.resilience4j.retry.Retry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;
import java.util.Set;

import static com.signalbot.backend.util.TestSignalFactory.NOW;
import static com.signalbot.backend.util.TestSignalFactory.config;
import static com.signalbot.backend.util.TestSignalFactory.executionProperties;
import static com.signalbot.backend.util.TestSignalFactory.inMemoryPositionRepo;
import static com.signalbot.backend.util.TestSignalFactory.openPosition;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ReconciliationServiceTest {

    private static final PositionKey BTC = PositionKey.of("BTCUSDT", MarketType.FUTURES);

    private ExchangeGateway exchange;
    private TrackedPositionRepository repository;
    private PositionTracker tracker;
    private RiskStateService riskStateService;
    private TradeNotifier notifier;
    private MutableClock clock;
    private ReconciliationService service;

    @BeforeEach
    void setUp() {
        exchange = mock(ExchangeGateway.class);
        repository = inMemoryPositionRepo();
        TradingConfigHolder configHolder = mock(TradingConfigHolder.class);
        when(configHolder.current()).thenReturn(config());
        clock = new MutableClock(NOW);
        tracker = new PositionTracker(repository, configHolder, clock);
        riskStateService = mock(RiskStateService.class);
        notifier = mock(TradeNotifier.class);
        ExecutionEngine engine = new ExecutionEngine(exchange, new OrderPlanner(executionProperties()), tracker,
                riskStateService, notifier, mock(MetricsService.class), mock(AsyncDelayService.class),
                executionProperties(), Retry.ofDefaults("reconcile-test"), clock);
        service = new ReconciliationService(exchange, tracker, engine, mock(ProtectiveOrderMonitor.class),
                configHolder, notifier, clock);
        setField(service, "enabled", true);
        setField(service, "qtyTolerancePct", new BigDecimal("0.01"));
        setField(service, "adoptUntracked", false);
        setField(service, "graceSeconds", 30L);
    }

    @Test
    void matchingStateReportsNoChanges() {
        openTracked("T-1", "0.003");
        when(exchange.fetchOpenPositions()).thenReturn(List.of(exchangePosition("P-1", "0.003", "50100")));

        ReconciliationService.ReconcileReport report = service.reconcile();

        assertThat(report.hasChanges()).isFalse();
        assertThat(tracker.get(BTC).getLastMarkPrice()).isEqualByComparingTo("50100");
        verify(notifier, never()).reconciliationDiscrepancy(anyString(), anyString());
    }

    @Test
    void positionGoneFromExchangeIsClosedExternally() {
        openTracked("T-1", "0.003");
        tracker.update(BTC, p -> p.setLastMarkPrice(new BigDecimal("49500")));
        when(exchange.fetchOpenPositions()).thenReturn(List.of());

        ReconciliationService.ReconcileReport report = service.reconcile();

        assertThat(report.closedExternally()).hasSize(1);
        assertThat(tracker.get(BTC)).isNull();
        TrackedPosition closed = repository.findByTradeId("T-1").orElseThrow();
        assertThat(closed.getCloseReason()).isEqualTo(CloseReason.EXTERNAL);
        assertThat(closed.getRealizedPnl()).isEqualByComparingTo("-1.5");
        verify(riskStateService).recordRealizedPnl(argThat(pnl -> pnl.compareTo(new BigDecimal("-1.5")) == 0));
        verify(notifier).reconciliationDiscrepancy(eq("BTCUSDT"), anyString());
    }

    @Test
    void quantityDriftIsCorrectedAndReportedOnce() {
        openTracked("T-1", "0.003");
        when(exchange.fetchOpenPositions()).thenReturn(List.of(exchangePosition("P-1", "0.002", "50000")));

        ReconciliationService.ReconcileReport first = service.reconcile();
        ReconciliationService.ReconcileReport second = service.reconcile();

        assertThat(first.quantityCorrections()).hasSize(1);
        assertThat(tracker.get(BTC).getQuantity()).isEqualByComparingTo("0.002");
        assertThat(second.hasChanges()).isFalse();
        verify(notifier, times(1)).reconciliationDiscrepancy(eq("BTCUSDT"), anyString());
    }

    @Test
    void driftWarningsAreForgottenOnceThePositionCloses() {
        openTracked("T-1", "0.003");
        when(exchange.fetchOpenPositions()).thenReturn(List.of(exchangePosition("P-1", "0.002", "50000")));
        service.reconcile();
        assertThat(warnedMismatch()).containsExactly("T-1|0.002");

        when(exchange.fetchOpenPositions()).thenReturn(List.of());
        ReconciliationService.ReconcileReport report = service.reconcile();

        assertThat(report.closedExternally()).hasSize(1);
        assertThat(warnedMismatch()).isEmpty();
    }

    @Test
    void untrackedExchangePositionIsReportedOnceAndNotAdopted() {
        when(exchange.fetchOpenPositions()).thenReturn(List.of(exchangePosition("P-9", "0.01", "50000")));

        ReconciliationService.ReconcileReport first = service.reconcile();
        ReconciliationService.ReconcileReport second = service.reconcile();

        assertThat(first.untrackedNotices()).hasSize(1);
        assertThat(second.untrackedNotices()).isEmpty();
        assertThat(tracker.snapshot()).isEmpty();
        verify(notifier, times(1)).reconciliationDiscrepancy(eq("BTCUSDT"), anyString());
    }

    @Test
    void adoptsUntrackedPositionAsUnprotectedWhenEnabled() {
        setField(service, "adoptUntracked", true);
        when(exchange.fetchOpenPositions()).thenReturn(List.of(exchangePosition("P-9", "0.01", "50000")));

        ReconciliationService.ReconcileReport report = service.reconcile();

        assertThat(report.adopted()).containsExactly(BTC.toString());
        TrackedPosition adopted = tracker.get(BTC);
        assertThat(adopted.getTradeId()).isEqualTo("ADOPTED-P-9");
        assertThat(adopted.getState()).isEqualTo(TradeState.UNPROTECTED);
        verify(notifier).unprotectedPosition(eq("ADOPTED-P-9"), eq("BTCUSDT"), anyString());
    }

    @Test
    void freshPositionsAreLeftAloneDuringGracePeriod() {
        tracker.open(BTC, openPosition("T-new", "BTCUSDT", Direction.LONG, "50000", "0.003").toBuilder()
                .openedAt(NOW.minusSeconds(5))
                .build());
        when(exchange.fetchOpenPositions()).thenReturn(List.of());

        ReconciliationService.ReconcileReport report = service.reconcile();

        assertThat(report.hasChanges()).isFalse();
        assertThat(tracker.get(BTC)).isNotNull();
    }

    @Test
    void exchangeOutageLeavesTrackedStateUntouched() {
        openTracked("T-1", "0.003");
        when(exchange.fetchOpenPositions()).thenThrow(TransientTransportException.network("timeout", null));

        ReconciliationService.ReconcileReport report = service.reconcile();

        assertThat(report.error()).isEqualTo("timeout");
        assertThat(tracker.get(BTC)).isNotNull();
    }

    @Test
    void disabledReconciliationDoesNothing() {
        setField(service, "enabled", false);

        ReconciliationService.ReconcileReport report = service.reconcile();

        assertThat(report.enabled()).isFalse();
        verify(exchange, never()).fetchOpenPositions();
    }

    private void openTracked(String tradeId, String quantity) {
        tracker.open(BTC, openPosition(tradeId, "BTCUSDT", Direction.LONG, "50000", quantity).toBuilder()
                .openedAt(NOW.minusSeconds(600))
                .build());
    }

    private ExchangePosition exchangePosition(String id, String quantity, String mark) {
        return new ExchangePosition(id, "BTCUSDT", MarketType.FUTURES, Direction.LONG,
                new BigDecimal(quantity), new BigDecimal("50000"), new BigDecimal(mark));
    }

    @SuppressWarnings("unchecked")
    private Set<String> warnedMismatch() {
        try {
            var field = ReconciliationService.class.getDeclaredField("warnedMismatch");
            field.setAccessible(true);
            return (Set<String>) field.get(service);
        } catch (Exception e) {
            throw new IllegalStateException(e);
        }
    }

    private void setField(Object target, String fieldName, Object value) {
        try {
            var field = target.getClass().getDeclaredField(fieldName);
            field.setAccessible(true);
            field.set(target, value);
        } catch (Exception e) {
            throw new IllegalStateException(e);
        }
    }
}
