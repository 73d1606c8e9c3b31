package com.signalbot.backend.exchange;

import com.signalbot.backend.exception.ExchangeRejectionException;
import com.signalbot.backend.model.Direction;
import com.signalbot.backend.model.MarketType;
import com.signalbot.backend.model.OrderSide;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory venue for DEMO mode. Limit orders rest until {@link #simulatePrice} crosses them;
 * stop and take-profit orders are reduce-only and trigger on the same price feed. A repeated client
 * order id returns the order it first created.
 */
@Slf4j
public class PaperExchangeGateway implements ExchangeGateway {

    private static final String QUOTE_ASSET = "USDT";

    private final AtomicLong orderSequence = new AtomicLong(1000);
    private final Map<String, PaperOrder> orders = new LinkedHashMap<>();
    // client order id -> venue order id
    private final Map<String, String> clientOrderIds = new HashMap<>();
    private final Map<String, PaperPosition> positions = new LinkedHashMap<>();
    private final Map<String, Integer> leverage = new HashMap<>();
    private final Set<String> suspendedSymbols = new HashSet<>();
    private BigDecimal balance;

    public PaperExchangeGateway(BigDecimal startingBalance) {
        this.balance = startingBalance;
    }

    @Override
    public synchronized ExchangeOrder placeLimitOrder(OrderRequest request) {
        return place(request, OrderKind.LIMIT);
    }

    @Override
    public synchronized ExchangeOrder placeStopOrder(OrderRequest request) {
        return place(request, OrderKind.STOP);
    }

    @Override
    public synchronized ExchangeOrder placeTakeProfitOrder(OrderRequest request) {
        return place(request, OrderKind.TAKE_PROFIT);
    }

    @Override
    public synchronized void cancelOrder(String symbol, MarketType marketType, String orderId) {
        PaperOrder order = orders.get(orderId);
        if (order == null) {
            throw ExchangeRejectionException.rejected("Unknown order " + orderId);
        }
        if (!order.status.isTerminal()) {
            order.status = ExchangeOrderStatus.CANCELED;
        }
    }

    @Override
    public synchronized void setLeverage(String symbol, int value) {
        leverage.put(symbol, value);
    }

    @Override
    public synchronized List<ExchangePosition> fetchOpenPositions() {
        List<ExchangePosition> result = new ArrayList<>();
        for (PaperPosition position : positions.values()) {
            if (position.quantity.signum() > 0) {
                result.add(new ExchangePosition(position.positionId, position.symbol, position.marketType,
                        position.direction, position.quantity, position.entryPrice, position.markPrice));
            }
        }
        return result;
    }

    @Override
    public synchronized ExchangeOrder fetchOrderStatus(String symbol, MarketType marketType, String orderId) {
        PaperOrder order = orders.get(orderId);
        if (order == null) {
            throw ExchangeRejectionException.rejected("Unknown order " + orderId);
        }
        return order.toExchangeOrder();
    }

    @Override
    public synchronized Balance fetchBalance() {
        return new Balance(QUOTE_ASSET, balance, balance);
    }

    public synchronized void suspend(String symbol) {
        suspendedSymbols.add(symbol);
    }

    public synchronized Integer leverageFor(String symbol) {
        return leverage.get(symbol);
    }

    /**
     * Moves the simulated market for one instrument, filling every order the new price crosses.
     */
    public synchronized void simulatePrice(String symbol, MarketType marketType, BigDecimal price) {
        PaperPosition position = positions.get(positionKey(symbol, marketType));
        if (position != null) {
            position.markPrice = price;
        }
        for (PaperOrder order : new ArrayList<>(orders.values())) {
            if (order.status.isTerminal() || !order.symbol.equals(symbol) || order.marketType != marketType) {
                continue;
            }
            if (crosses(order, price)) {
                BigDecimal fillPrice = order.kind == OrderKind.LIMIT ? order.price : price;
                fill(order, order.remaining(), fillPrice);
            }
        }
    }

    /**
     * Fills part or all of an order regardless of price, e.g. to simulate a partial entry fill.
     */
    public synchronized void fillOrder(String orderId, BigDecimal quantity, BigDecimal price) {
        PaperOrder order = orders.get(orderId);
        if (order == null || order.status.isTerminal()) {
            throw new IllegalStateException("Order not fillable: " + orderId);
        }
        fill(order, quantity.min(order.remaining()), price);
    }

    /**
     * Removes a position as if it was closed outside this process.
     */
    public synchronized void closePositionExternally(String symbol, MarketType marketType, BigDecimal exitPrice) {
        PaperPosition position = positions.remove(positionKey(symbol, marketType));
        if (position != null) {
            position.markPrice = exitPrice;
        }
    }

    private ExchangeOrder place(OrderRequest request, OrderKind kind) {
        if (request.clientOrderId() != null && clientOrderIds.containsKey(request.clientOrderId())) {
            PaperOrder existing = orders.get(clientOrderIds.get(request.clientOrderId()));
            log.debug("Duplicate client order id {}, returning {}", request.clientOrderId(), existing.orderId);
            return existing.toExchangeOrder();
        }
        if (suspendedSymbols.contains(request.symbol())) {
            throw ExchangeRejectionException.suspended("Symbol suspended: " + request.symbol());
        }
        if (request.quantity() == null || request.quantity().signum() <= 0) {
            throw ExchangeRejectionException.rejected("Quantity must be positive");
        }
        if (kind == OrderKind.LIMIT && !request.reduceOnly()) {
            int lev = request.marketType() == MarketType.FUTURES ? leverage.getOrDefault(request.symbol(), 1) : 1;
            BigDecimal margin = request.quantity().multiply(request.price())
                    .divide(BigDecimal.valueOf(lev), 8, RoundingMode.HALF_UP);
            if (margin.compareTo(balance) > 0) {
                throw ExchangeRejectionException.insufficientFunds("Margin " + margin + " exceeds balance " + balance);
            }
        }
        String orderId = "PAPER-" + orderSequence.incrementAndGet();
        PaperOrder order = new PaperOrder(orderId, request.symbol(), request.marketType(), request.side(), kind,
                request.quantity(), request.price(), request.reduceOnly());
        orders.put(orderId, order);
        if (request.clientOrderId() != null) {
            clientOrderIds.put(request.clientOrderId(), orderId);
        }
        log.debug("Paper {} order {} {} {} @ {}", kind, orderId, request.side(), request.quantity(), request.price());
        return order.toExchangeOrder();
    }

    private boolean crosses(PaperOrder order, BigDecimal price) {
        int cmp = price.compareTo(order.price);
        return switch (order.kind) {
            case LIMIT -> order.side == OrderSide.BUY ? cmp <= 0 : cmp >= 0;
            // stops protect against adverse moves; take-profits trigger on favourable ones
            case STOP -> order.side == OrderSide.SELL ? cmp <= 0 : cmp >= 0;
            case TAKE_PROFIT -> order.side == OrderSide.SELL ? cmp >= 0 : cmp <= 0;
        };
    }

    private void fill(PaperOrder order, BigDecimal quantity, BigDecimal price) {
        if (quantity.signum() <= 0) {
            return;
        }
        BigDecimal previousNotional = order.averagePrice.multiply(order.filled);
        order.filled = order.filled.add(quantity);
        order.averagePrice = previousNotional.add(price.multiply(quantity))
                .divide(order.filled, 8, RoundingMode.HALF_UP);
        order.status = order.remaining().signum() == 0 ? ExchangeOrderStatus.FILLED : ExchangeOrderStatus.PARTIALLY_FILLED;
        applyToPosition(order, quantity, price);
    }

    private void applyToPosition(PaperOrder order, BigDecimal quantity, BigDecimal price) {
        String key = positionKey(order.symbol, order.marketType);
        PaperPosition position = positions.get(key);
        Direction orderDirection = order.side == OrderSide.BUY ? Direction.LONG : Direction.SHORT;
        if (order.reduceOnly && (position == null || position.direction == orderDirection)) {
            return;
        }
        if (position == null || position.quantity.signum() == 0) {
            position = new PaperPosition("POS-" + orderSequence.incrementAndGet(), order.symbol, order.marketType,
                    orderDirection, BigDecimal.ZERO, price);
            positions.put(key, position);
        }
        if (position.direction == orderDirection) {
            BigDecimal notional = position.entryPrice.multiply(position.quantity).add(price.multiply(quantity));
            position.quantity = position.quantity.add(quantity);
            position.entryPrice = notional.divide(position.quantity, 8, RoundingMode.HALF_UP);
        } else {
            BigDecimal closed = quantity.min(position.quantity);
            balance = balance.add(position.direction.favourableMove(position.entryPrice, price).multiply(closed));
            position.quantity = position.quantity.subtract(closed);
            if (position.quantity.signum() == 0) {
                positions.remove(key);
            }
        }
        position.markPrice = price;
    }

    private String positionKey(String symbol, MarketType marketType) {
        return symbol + "|" + marketType;
    }

    private enum OrderKind {
        LIMIT,
        STOP,
        TAKE_PROFIT
    }

    private static final class PaperOrder {
        private final String orderId;
        private final String symbol;
        private final MarketType marketType;
        private final OrderSide side;
        private final OrderKind kind;
        private final BigDecimal quantity;
        private final BigDecimal price;
        private final boolean reduceOnly;
        private BigDecimal filled = BigDecimal.ZERO;
        private BigDecimal averagePrice = BigDecimal.ZERO;
        private ExchangeOrderStatus status = ExchangeOrderStatus.NEW;

        private PaperOrder(String orderId, String symbol, MarketType marketType, OrderSide side, OrderKind kind,
                           BigDecimal quantity, BigDecimal price, boolean reduceOnly) {
            this.orderId = orderId;
            this.symbol = symbol;
            this.marketType = marketType;
            this.side = side;
            this.kind = kind;
            this.quantity = quantity;
            this.price = price;
            this.reduceOnly = reduceOnly;
        }

        private BigDecimal remaining() {
            return quantity.subtract(filled);
        }

        private ExchangeOrder toExchangeOrder() {
            return new ExchangeOrder(orderId, symbol, status, quantity, filled,
                    filled.signum() == 0 ? null : averagePrice);
        }
    }

    private static final class PaperPosition {
        private final String positionId;
        private final String symbol;
        private final MarketType marketType;
        private final Direction direction;
        private BigDecimal quantity;
        private BigDecimal entryPrice;
        private BigDecimal markPrice;

        private PaperPosition(String positionId, String symbol, MarketType marketType, Direction direction,
                              BigDecimal quantity, BigDecimal entryPrice) {
            this.positionId = positionId;
            this.symbol = symbol;
            this.marketType = marketType;
            this.direction = direction;
            this.quantity = quantity;
            this.entryPrice = entryPrice;
            this.markPrice = entryPrice;
        }
    }
}
