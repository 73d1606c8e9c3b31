package com.signalbot.backend.model;

public enum MarketType {
    FUTURES,
    SPOT;

    public boolean supportsLeverage() {
        return this == FUTURES;
    }

    public static MarketType fromString(String value) {
        if (value == null || value.isBlank()) {
            return FUTURES;
        }
        return switch (value.trim().toUpperCase()) {
            case "SPOT" -> SPOT;
            case "FUTURE", "FUTURES", "PERP", "PERPETUAL" -> FUTURES;
            default -> throw new IllegalArgumentException("Unknown market type: " + value);
        };
    }
}
