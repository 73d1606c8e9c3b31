package com.signalbot.backend.service.risk;

import com.signalbot.backend.config.TradingConfigHolder;
import com.signalbot.backend.entity.RiskLedger;
import com.signalbot.backend.repository.RiskLedgerRepository;
import com.signalbot.backend.service.MetricsService;
import com.signalbot.backend.service.notification.TradeNotifier;
import com.signalbot.backend.util.MoneyUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;

/**
 * Daily realized PnL accumulator and the trading-enabled flag. The loss limit is checked against the
 * current config on every read, so lowering it takes effect without a new fill. Once it trips, trading
 * stays disabled until the trading day rolls over or an operator re-enables it. A manual disable is
 * only cleared by a manual enable.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RiskStateService {

    public static final String HALT_DAILY_LOSS = "DAILY_LOSS_LIMIT";
    public static final String HALT_MANUAL = "MANUAL";

    private final RiskLedgerRepository riskLedgerRepository;
    private final TradingConfigHolder configHolder;
    private final TradeNotifier tradeNotifier;
    private final MetricsService metricsService;
    private final Clock clock;

    private RiskLedger ledger;

    public synchronized boolean isTradingEnabled() {
        return current().isTradingEnabled();
    }

    public synchronized BigDecimal dailyRealizedPnl() {
        return current().getDailyRealizedPnl();
    }

    public synchronized String haltReason() {
        return current().getHaltReason();
    }

    /**
     * Adds a closed trade's PnL to today's accumulator and trips the halt when the loss limit is reached.
     *
     * @return true when this call disabled trading
     */
    public synchronized boolean recordRealizedPnl(BigDecimal pnl) {
        RiskLedger state = current();
        state.setDailyRealizedPnl(MoneyUtils.add(state.getDailyRealizedPnl(), pnl));
        metricsService.updateDailyPnl(state.getDailyRealizedPnl());
        boolean tripped = enforceLossLimit(state);
        if (!tripped) {
            save(state);
            log.info("Realized PnL {} recorded, daily total {}", pnl, state.getDailyRealizedPnl());
        }
        return tripped;
    }

    /**
     * Re-enables trading. The day's loss so far is acknowledged, so the limit only trips again on further losses.
     */
    public synchronized void enableTrading() {
        RiskLedger state = current();
        state.setTradingEnabled(true);
        state.setHaltReason(null);
        state.setHaltedAt(null);
        state.setAcknowledgedPnl(state.getDailyRealizedPnl());
        save(state);
        log.warn("Trading manually re-enabled (daily pnl {})", state.getDailyRealizedPnl());
    }

    public synchronized void disableTrading(String reason) {
        RiskLedger state = current();
        state.setTradingEnabled(false);
        state.setHaltReason(reason == null || reason.isBlank() ? HALT_MANUAL : reason);
        state.setHaltedAt(Instant.now(clock));
        save(state);
        log.warn("Trading disabled: {}", state.getHaltReason());
    }

    private RiskLedger current() {
        if (ledger == null) {
            ledger = riskLedgerRepository.findById(RiskLedger.SINGLETON_ID).orElseGet(this::freshLedger);
        }
        LocalDate today = LocalDate.now(clock.withZone(configHolder.current().dayZone()));
        if (!today.equals(ledger.getTradingDay())) {
            rollOver(today);
        }
        // the limit is hot-reloadable, so it is checked on every read
        enforceLossLimit(ledger);
        return ledger;
    }

    /**
     * @return true when the daily loss limit disabled trading on this call
     */
    private boolean enforceLossLimit(RiskLedger state) {
        BigDecimal maxDailyLoss = configHolder.current().maxDailyLoss();
        BigDecimal pnl = state.getDailyRealizedPnl();
        if (!state.isTradingEnabled() || pnl.compareTo(maxDailyLoss.negate()) > 0) {
            return false;
        }
        if (state.getAcknowledgedPnl() != null && pnl.compareTo(state.getAcknowledgedPnl()) >= 0) {
            return false;
        }
        state.setTradingEnabled(false);
        state.setHaltReason(HALT_DAILY_LOSS);
        state.setHaltedAt(Instant.now(clock));
        save(state);
        log.error("Daily loss limit reached: pnl={} limit={}, trading disabled", pnl, maxDailyLoss.negate());
        tradeNotifier.dailyLossHalt(pnl, maxDailyLoss);
        return true;
    }

    private void rollOver(LocalDate today) {
        log.info("Trading day rollover {} -> {}, closing daily pnl {}",
                ledger.getTradingDay(), today, ledger.getDailyRealizedPnl());
        ledger.setTradingDay(today);
        ledger.setDailyRealizedPnl(MoneyUtils.ZERO);
        ledger.setAcknowledgedPnl(null);
        if (!ledger.isTradingEnabled() && HALT_DAILY_LOSS.equals(ledger.getHaltReason())) {
            ledger.setTradingEnabled(true);
            ledger.setHaltReason(null);
            ledger.setHaltedAt(null);
            log.info("Daily loss halt cleared by new trading day");
        }
        metricsService.updateDailyPnl(ledger.getDailyRealizedPnl());
        save(ledger);
    }

    private RiskLedger freshLedger() {
        return RiskLedger.builder()
                .id(RiskLedger.SINGLETON_ID)
                .tradingDay(null)
                .dailyRealizedPnl(MoneyUtils.ZERO)
                .tradingEnabled(true)
                .build();
    }

    private void save(RiskLedger state) {
        state.setUpdatedAt(Instant.now(clock));
        ledger = riskLedgerRepository.save(state);
    }
}
