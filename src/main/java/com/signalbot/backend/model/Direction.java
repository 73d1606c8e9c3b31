package com.signalbot.backend.model;

import java.math.BigDecimal;

public enum Direction {
    LONG,
    SHORT;

    public OrderSide entrySide() {
        return this == LONG ? OrderSide.BUY : OrderSide.SELL;
    }

    public OrderSide exitSide() {
        return this == LONG ? OrderSide.SELL : OrderSide.BUY;
    }

    /**
     * Signed price move in the trade's favour: positive when {@code to} is a profit relative to {@code from}.
     */
    public BigDecimal favourableMove(BigDecimal from, BigDecimal to) {
        BigDecimal move = to.subtract(from);
        return this == LONG ? move : move.negate();
    }

    public static Direction fromString(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Direction is required");
        }
        return switch (value.trim().toUpperCase()) {
            case "LONG", "BUY" -> LONG;
            case "SHORT", "SELL" -> SHORT;
            default -> throw new IllegalArgumentException("Unknown direction: " + value);
        };
    }
}
