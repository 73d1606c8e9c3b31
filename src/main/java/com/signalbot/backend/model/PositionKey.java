package com.signalbot.backend.model;

/**
 * Identity of a tracked position. {@code direction} is only set when hedging is enabled,
 * otherwise one key covers both sides of a (symbol, market type) pair.
 */
public record PositionKey(String symbol, MarketType marketType, Direction direction) {

    public static PositionKey of(String symbol, MarketType marketType) {
        return new PositionKey(symbol, marketType, null);
    }

    public static PositionKey of(String symbol, MarketType marketType, Direction direction, boolean hedging) {
        return new PositionKey(symbol, marketType, hedging ? direction : null);
    }

    @Override
    public String toString() {
        return direction == null
                ? symbol + "/" + marketType
                : symbol + "/" + marketType + "/" + direction;
    }
}
