package com.signalbot.backend.repository;

import com.signalbot.backend.entity.TrackedPosition;
import com.signalbot.backend.model.Direction;
import com.signalbot.backend.model.MarketType;
import com.signalbot.backend.model.TradeState;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest
class TrackedPositionRepositoryTest {

    @Autowired
    private TestEntityManager entityManager;

    @Autowired
    private TrackedPositionRepository repository;

    @Test
    void openPositionsExcludeTerminalStates() {
        entityManager.persist(position("T-1", "BTCUSDT", TradeState.PROTECTED));
        entityManager.persist(position("T-2", "ETHUSDT", TradeState.CLOSED));
        entityManager.persist(position("T-3", "BTCUSDT", TradeState.UNPROTECTED));
        entityManager.flush();

        List<TrackedPosition> open = repository.findByStateNotIn(EnumSet.of(TradeState.CLOSED, TradeState.ABORTED));

        assertThat(open).extracting(TrackedPosition::getTradeId).containsExactlyInAnyOrder("T-1", "T-3");
        assertThat(repository.findBySymbolAndMarketTypeAndStateNotIn("BTCUSDT", MarketType.FUTURES,
                EnumSet.of(TradeState.CLOSED, TradeState.ABORTED))).hasSize(2);
        assertThat(repository.findByState(TradeState.UNPROTECTED))
                .extracting(TrackedPosition::getTradeId).containsExactly("T-3");
    }

    @Test
    void protectiveOrderIdsAndFillsSurviveReload() {
        TrackedPosition position = position("T-1", "BTCUSDT", TradeState.PARTIALLY_CLOSED);
        position.setTakeProfitOrderIds(List.of("TP-1", "TP-2", "TP-3"));
        position.recordApplied("TP-1", new BigDecimal("0.001"));
        entityManager.persist(position);
        entityManager.flush();
        entityManager.clear();

        TrackedPosition reloaded = repository.findByTradeId("T-1").orElseThrow();

        assertThat(reloaded.getTakeProfitOrderIds()).containsExactly("TP-1", "TP-2", "TP-3");
        assertThat(reloaded.appliedQuantity("TP-1")).isEqualByComparingTo("0.001");
        assertThat(reloaded.appliedQuantity("TP-2")).isEqualByComparingTo("0");
        assertThat(repository.findByTradeId("T-9")).isEmpty();
    }

    private TrackedPosition position(String tradeId, String symbol, TradeState state) {
        return TrackedPosition.builder()
                .tradeId(tradeId)
                .symbol(symbol)
                .marketType(MarketType.FUTURES)
                .direction(Direction.LONG)
                .entryPrice(new BigDecimal("50000"))
                .quantity(new BigDecimal("0.003"))
                .initialQuantity(new BigDecimal("0.003"))
                .leverage(10)
                .stopOrderId("SL-" + tradeId)
                .openedAt(Instant.parse("2026-03-02T10:00:00Z"))
                .state(state)
                .realizedPnl(BigDecimal.ZERO)
                .build();
    }
}
