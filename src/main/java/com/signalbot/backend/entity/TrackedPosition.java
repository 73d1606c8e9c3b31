package com.signalbot.backend.entity;

import com.signalbot.backend.model.CloseReason;
import com.signalbot.backend.model.Direction;
import com.signalbot.backend.model.MarketType;
import com.signalbot.backend.model.PositionKey;
import com.signalbot.backend.model.TradeState;
import jakarta.persistence.CollectionTable;
import jakarta.persistence.Column;
import jakarta.persistence.ElementCollection;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.OrderColumn;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Entity
@Table(name = "tracked_position", indexes = {
        @Index(name = "idx_tracked_position_symbol", columnList = "symbol,marketType"),
        @Index(name = "idx_tracked_position_trade", columnList = "tradeId", unique = true)
})
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class TrackedPosition {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 40)
    private String tradeId;

    @Column(nullable = false, length = 40)
    private String symbol;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 10)
    private MarketType marketType;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 10)
    private Direction direction;

    @Column(nullable = false, precision = 30, scale = 12)
    private BigDecimal entryPrice;

    @Column(nullable = false, precision = 30, scale = 12)
    private BigDecimal quantity;

    @Column(nullable = false, precision = 30, scale = 12)
    private BigDecimal initialQuantity;

    private int leverage;

    private String stopOrderId;

    // resting operator close order, set while the position is CLOSING
    private String closeOrderId;

    @Builder.Default
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "tracked_position_tp", joinColumns = @JoinColumn(name = "position_id"))
    @OrderColumn(name = "level_index")
    @Column(name = "order_id")
    private List<String> takeProfitOrderIds = new ArrayList<>();

    // cumulative quantities already applied from each protective order, keyed by order id
    @Builder.Default
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "tracked_position_fill", joinColumns = @JoinColumn(name = "position_id"))
    private List<ProtectiveFill> appliedFills = new ArrayList<>();

    @Column(nullable = false)
    private Instant openedAt;

    private String sourceSignalId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private TradeState state;

    @Column(precision = 30, scale = 12)
    private BigDecimal realizedPnl;

    @Column(precision = 30, scale = 12)
    private BigDecimal lastMarkPrice;

    @Enumerated(EnumType.STRING)
    @Column(length = 20)
    private CloseReason closeReason;

    private Instant closedAt;

    public PositionKey positionKey(boolean hedging) {
        return PositionKey.of(symbol, marketType, direction, hedging);
    }

    public boolean isOpen() {
        return state != null && !state.isTerminal();
    }

    public BigDecimal appliedQuantity(String orderId) {
        return appliedFills.stream()
                .filter(fill -> fill.getOrderId().equals(orderId))
                .map(ProtectiveFill::getQuantity)
                .findFirst()
                .orElse(BigDecimal.ZERO);
    }

    public void recordApplied(String orderId, BigDecimal cumulative) {
        appliedFills.removeIf(fill -> fill.getOrderId().equals(orderId));
        appliedFills.add(new ProtectiveFill(orderId, cumulative));
    }
}
