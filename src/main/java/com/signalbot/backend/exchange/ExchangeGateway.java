package com.signalbot.backend.exchange;

import com.signalbot.backend.model.Direction;
import com.signalbot.backend.model.MarketType;
import com.signalbot.backend.model.OrderSide;

import java.math.BigDecimal;
import java.util.List;

/**
 * Exchange capability consumed by the core. Implementations throw
 * {@link com.signalbot.backend.exception.TransientTransportException} for network/rate-limit failures and
 * {@link com.signalbot.backend.exception.ExchangeRejectionException} when the venue refuses an order.
 */
public interface ExchangeGateway {

    ExchangeOrder placeLimitOrder(OrderRequest request);

    /** Reduce-only stop-market order triggered at {@code request.price()}. */
    ExchangeOrder placeStopOrder(OrderRequest request);

    /** Reduce-only take-profit-market order triggered at {@code request.price()}. */
    ExchangeOrder placeTakeProfitOrder(OrderRequest request);

    void cancelOrder(String symbol, MarketType marketType, String orderId);

    void setLeverage(String symbol, int leverage);

    List<ExchangePosition> fetchOpenPositions();

    ExchangeOrder fetchOrderStatus(String symbol, MarketType marketType, String orderId);

    Balance fetchBalance();

    record OrderRequest(String symbol, MarketType marketType, OrderSide side, BigDecimal quantity,
                        BigDecimal price, String clientOrderId, boolean reduceOnly) {}

    record ExchangeOrder(String orderId, String symbol, ExchangeOrderStatus status, BigDecimal quantity,
                         BigDecimal filledQuantity, BigDecimal averagePrice) {

        public BigDecimal remainingQuantity() {
            return quantity.subtract(filledQuantity == null ? BigDecimal.ZERO : filledQuantity);
        }
    }

    record ExchangePosition(String positionId, String symbol, MarketType marketType, Direction direction,
                            BigDecimal quantity, BigDecimal entryPrice, BigDecimal markPrice) {}

    record Balance(String asset, BigDecimal free, BigDecimal total) {}
}
