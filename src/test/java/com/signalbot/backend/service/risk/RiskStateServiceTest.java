package com.signalbot.backend.service.risk;

import com.signalbot.backend.config.TradingConfigHolder;
import com.signalbot.backend.entity.RiskLedger;
import com.signalbot.backend.repository.RiskLedgerRepository;
import com.signalbot.backend.service.MetricsService;
import com.signalbot.backend.service.notification.TradeNotifier;
import com.signalbot.backend.util.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

import static com.signalbot.backend.util.TestSignalFactory.NOW;
import static com.signalbot.backend.util.TestSignalFactory.config;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class RiskStateServiceTest {

    private RiskLedgerRepository repo;
    private TradingConfigHolder configHolder;
    private TradeNotifier notifier;
    private MutableClock clock;
    private RiskStateService service;

    @BeforeEach
    void setUp() {
        repo = inMemoryRepo();
        configHolder = mock(TradingConfigHolder.class);
        when(configHolder.current()).thenReturn(config());
        notifier = mock(TradeNotifier.class);
        clock = new MutableClock(NOW);
        service = newService();
    }

    @Test
    void haltsWhenDailyLossReachesLimit() {
        assertThat(service.recordRealizedPnl(new BigDecimal("-200"))).isFalse();
        assertThat(service.isTradingEnabled()).isTrue();

        assertThat(service.recordRealizedPnl(new BigDecimal("-100"))).isTrue();

        assertThat(service.isTradingEnabled()).isFalse();
        assertThat(service.haltReason()).isEqualTo(RiskStateService.HALT_DAILY_LOSS);
        assertThat(service.dailyRealizedPnl()).isEqualByComparingTo("-300");
        verify(notifier).dailyLossHalt(any(), any());
    }

    @Test
    void profitAfterHaltDoesNotResumeTrading() {
        service.recordRealizedPnl(new BigDecimal("-350"));

        assertThat(service.recordRealizedPnl(new BigDecimal("500"))).isFalse();

        assertThat(service.dailyRealizedPnl()).isEqualByComparingTo("150");
        assertThat(service.isTradingEnabled()).isFalse();
        verify(notifier, times(1)).dailyLossHalt(any(), any());
    }

    @Test
    void newTradingDayClearsLossHaltAndAccumulator() {
        service.recordRealizedPnl(new BigDecimal("-400"));

        clock.advance(Duration.ofDays(1));

        assertThat(service.isTradingEnabled()).isTrue();
        assertThat(service.haltReason()).isNull();
        assertThat(service.dailyRealizedPnl()).isEqualByComparingTo("0");
    }

    @Test
    void manualDisableSurvivesDayRollover() {
        service.disableTrading("maintenance");

        clock.advance(Duration.ofDays(1));

        assertThat(service.isTradingEnabled()).isFalse();
        assertThat(service.haltReason()).isEqualTo("maintenance");

        service.enableTrading();
        assertThat(service.isTradingEnabled()).isTrue();
    }

    @Test
    void haltIsRestoredFromLedgerAfterRestart() {
        service.recordRealizedPnl(new BigDecimal("-300"));

        RiskStateService restarted = newService();

        assertThat(restarted.isTradingEnabled()).isFalse();
        assertThat(restarted.dailyRealizedPnl()).isEqualByComparingTo("-300");
    }

    @Test
    void manualEnableClearsLossHaltWithinSameDay() {
        service.recordRealizedPnl(new BigDecimal("-300"));

        service.enableTrading();

        assertThat(service.isTradingEnabled()).isTrue();
        assertThat(service.recordRealizedPnl(new BigDecimal("-10"))).isTrue();
        verify(notifier, times(2)).dailyLossHalt(any(), any());
    }

    @Test
    void loweredLossLimitHaltsWithoutFurtherFills() {
        service.recordRealizedPnl(new BigDecimal("-200"));
        assertThat(service.isTradingEnabled()).isTrue();

        when(configHolder.current()).thenReturn(config().toBuilder().maxDailyLoss(new BigDecimal("150")).build());

        assertThat(service.isTradingEnabled()).isFalse();
        assertThat(service.haltReason()).isEqualTo(RiskStateService.HALT_DAILY_LOSS);
        verify(notifier, times(1)).dailyLossHalt(any(), any());
    }

    @Test
    void blankDisableReasonFallsBackToManual() {
        service.disableTrading(" ");

        assertThat(service.haltReason()).isEqualTo(RiskStateService.HALT_MANUAL);
        verify(notifier, never()).dailyLossHalt(any(), any());
    }

    private RiskStateService newService() {
        return new RiskStateService(repo, configHolder, notifier, mock(MetricsService.class), clock);
    }

    private RiskLedgerRepository inMemoryRepo() {
        RiskLedgerRepository repo = mock(RiskLedgerRepository.class);
        AtomicReference<RiskLedger> stateRef = new AtomicReference<>();
        when(repo.findById(RiskLedger.SINGLETON_ID)).thenAnswer(invocation -> Optional.ofNullable(stateRef.get()));
        when(repo.save(any())).thenAnswer(invocation -> {
            RiskLedger state = invocation.getArgument(0);
            stateRef.set(state);
            return state;
        });
        return repo;
    }
}
