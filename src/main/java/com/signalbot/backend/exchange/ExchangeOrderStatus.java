package com.signalbot.backend.exchange;

public enum ExchangeOrderStatus {
    NEW,
    PARTIALLY_FILLED,
    FILLED,
    CANCELED,
    EXPIRED,
    REJECTED,
    UNKNOWN;

    public boolean isTerminal() {
        return this == FILLED || this == CANCELED || this == EXPIRED || this == REJECTED;
    }

    public boolean isDeadUnfilled() {
        return this == CANCELED || this == EXPIRED || this == REJECTED;
    }

    public static ExchangeOrderStatus fromString(String status) {
        if (status == null || status.isBlank()) {
            return UNKNOWN;
        }
        try {
            return valueOf(status.toUpperCase());
        } catch (IllegalArgumentException e) {
            return switch (status.toUpperCase()) {
                case "OPEN", "PENDING", "ACCEPTED" -> NEW;
                case "PARTIAL", "PART_FILLED" -> PARTIALLY_FILLED;
                case "CLOSED", "COMPLETE" -> FILLED;
                case "CANCELLED" -> CANCELED;
                default -> UNKNOWN;
            };
        }
    }
}
