package com.signalbot.backend.service.position;

import com.signalbot.backend.config.TradingConfigHolder;
import com.signalbot.backend.entity.TrackedPosition;
import com.signalbot.backend.exception.InvariantViolationException;
import com.signalbot.backend.exception.NotFoundException;
import com.signalbot.backend.model.CloseReason;
import com.signalbot.backend.model.Direction;
import com.signalbot.backend.model.FillEvent;
import com.signalbot.backend.model.MarketType;
import com.signalbot.backend.model.PositionKey;
import com.signalbot.backend.model.TradeState;
import com.signalbot.backend.repository.TrackedPositionRepository;
import com.signalbot.backend.util.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static com.signalbot.backend.util.TestSignalFactory.NOW;
import static com.signalbot.backend.util.TestSignalFactory.config;
import static com.signalbot.backend.util.TestSignalFactory.inMemoryPositionRepo;
import static com.signalbot.backend.util.TestSignalFactory.openPosition;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class PositionTrackerTest {

    private static final PositionKey BTC = PositionKey.of("BTCUSDT", MarketType.FUTURES);

    private TrackedPositionRepository repository;
    private TradingConfigHolder configHolder;
    private PositionTracker tracker;

    @BeforeEach
    void setUp() {
        repository = inMemoryPositionRepo();
        configHolder = mock(TradingConfigHolder.class);
        when(configHolder.current()).thenReturn(config());
        tracker = new PositionTracker(repository, configHolder, new MutableClock(NOW));
    }

    @Test
    void refusesSecondPositionOnSameKey() {
        tracker.open(BTC, openPosition("T-1", "BTCUSDT", Direction.LONG, "50000", "0.003"));

        assertThatThrownBy(() -> tracker.open(BTC, openPosition("T-2", "BTCUSDT", Direction.SHORT, "50000", "0.003")))
                .isInstanceOf(InvariantViolationException.class);
        assertThat(tracker.get(BTC).getTradeId()).isEqualTo("T-1");
    }

    @Test
    void reservationHoldsSlotUntilOpenedByOwner() {
        assertThat(tracker.reserve(BTC, "T-1")).isTrue();
        assertThat(tracker.reserve(BTC, "T-2")).isFalse();
        assertThat(tracker.activeCount(MarketType.FUTURES)).isEqualTo(1);
        assertThat(tracker.occupiedKeys()).containsExactly(BTC);

        assertThatThrownBy(() -> tracker.open(BTC, openPosition("T-2", "BTCUSDT", Direction.LONG, "50000", "0.003")))
                .isInstanceOf(InvariantViolationException.class);

        tracker.open(BTC, openPosition("T-1", "BTCUSDT", Direction.LONG, "50000", "0.003"));
        assertThat(tracker.activeCount(MarketType.FUTURES)).isEqualTo(1);
        assertThat(tracker.reserve(BTC, "T-3")).isFalse();
    }

    @Test
    void releaseOnlyFreesOwnReservation() {
        tracker.reserve(BTC, "T-1");

        tracker.release(BTC, "T-2");
        assertThat(tracker.occupiedKeys()).contains(BTC);

        tracker.release(BTC, "T-1");
        assertThat(tracker.occupiedKeys()).isEmpty();
        assertThat(tracker.activeCount(MarketType.FUTURES)).isZero();
    }

    @Test
    void hedgingKeepsLongAndShortApart() {
        PositionKey longKey = PositionKey.of("BTCUSDT", MarketType.FUTURES, Direction.LONG, true);
        PositionKey shortKey = PositionKey.of("BTCUSDT", MarketType.FUTURES, Direction.SHORT, true);

        tracker.open(longKey, openPosition("T-1", "BTCUSDT", Direction.LONG, "50000", "0.003"));
        tracker.open(shortKey, openPosition("T-2", "BTCUSDT", Direction.SHORT, "50000", "0.003"));

        assertThat(tracker.activeCount(MarketType.FUTURES)).isEqualTo(2);
    }

    @Test
    void mutateBooksPnlAndClampsOverfill() {
        tracker.open(BTC, openPosition("T-1", "BTCUSDT", Direction.LONG, "50000", "0.003"));

        TrackedPosition afterTp = tracker.mutate(BTC, new FillEvent("TP1", FillEvent.ProtectiveOrderType.TAKE_PROFIT,
                new BigDecimal("0.001"), new BigDecimal("51000"), NOW));
        assertThat(afterTp.getQuantity()).isEqualByComparingTo("0.002");
        assertThat(afterTp.getRealizedPnl()).isEqualByComparingTo("1");
        assertThat(afterTp.appliedQuantity("TP1")).isEqualByComparingTo("0.001");

        TrackedPosition afterStop = tracker.mutate(BTC, new FillEvent("SL", FillEvent.ProtectiveOrderType.STOP_LOSS,
                new BigDecimal("0.003"), new BigDecimal("49000"), NOW));
        assertThat(afterStop.getQuantity()).isEqualByComparingTo("0");
        assertThat(afterStop.getRealizedPnl()).isEqualByComparingTo("-1");
    }

    @Test
    void closeRemovesPositionAndPersistsOutcome() {
        tracker.open(BTC, openPosition("T-1", "BTCUSDT", Direction.LONG, "50000", "0.003"));

        TrackedPosition closed = tracker.close(BTC, CloseReason.MANUAL);

        assertThat(closed.getState()).isEqualTo(TradeState.CLOSED);
        assertThat(closed.getClosedAt()).isEqualTo(NOW);
        assertThat(tracker.get(BTC)).isNull();
        assertThat(tracker.closedPositions()).extracting(TrackedPosition::getTradeId).containsExactly("T-1");
    }

    @Test
    void reloadRestoresOpenPositionsAfterRestart() {
        tracker.open(BTC, openPosition("T-1", "BTCUSDT", Direction.LONG, "50000", "0.003"));
        PositionKey eth = PositionKey.of("ETHUSDT", MarketType.FUTURES);
        tracker.open(eth, openPosition("T-2", "ETHUSDT", Direction.SHORT, "3000", "0.05"));
        tracker.close(eth, CloseReason.TAKE_PROFIT);

        PositionTracker restarted = new PositionTracker(repository, configHolder, new MutableClock(NOW));
        restarted.reload();

        assertThat(restarted.snapshotByKey()).containsOnlyKeys(BTC);
        assertThat(restarted.findKeyByTradeId("T-1")).isEqualTo(BTC);
    }

    @Test
    void returnsDetachedCopies() {
        tracker.open(BTC, openPosition("T-1", "BTCUSDT", Direction.LONG, "50000", "0.003"));

        tracker.get(BTC).setQuantity(BigDecimal.TEN);
        tracker.snapshot().get(0).getTakeProfitOrderIds().add("rogue");

        assertThat(tracker.get(BTC).getQuantity()).isEqualByComparingTo("0.003");
        assertThat(tracker.get(BTC).getTakeProfitOrderIds()).isEmpty();
    }

    @Test
    void updatingUnknownPositionFails() {
        assertThatThrownBy(() -> tracker.update(BTC, p -> p.setState(TradeState.CLOSED)))
                .isInstanceOf(NotFoundException.class);
    }
}
