package com.signalbot.backend.model;

/**
 * Per-trade execution lifecycle.
 * PLANNED -> ENTRY_SUBMITTED -> ENTRY_FILLED -> PROTECTED -> (PARTIALLY_CLOSED)* -> CLOSED,
 * ABORTED from any pre-fill state, UNPROTECTED when protective orders could not be placed.
 * CLOSING while an operator close order rests; it falls back to the protected states if that order dies.
 */
public enum TradeState {
    PLANNED,
    ENTRY_SUBMITTED,
    ENTRY_FILLED,
    PROTECTED,
    PARTIALLY_CLOSED,
    UNPROTECTED,    // automation halted, waits for manual intervention
    CLOSING,
    CLOSED,
    ABORTED;

    public boolean isTerminal() {
        return this == CLOSED || this == ABORTED;
    }

    public boolean isCancellable() {
        return this == PLANNED || this == ENTRY_SUBMITTED;
    }

    public boolean isEntryFilled() {
        return this == ENTRY_FILLED || this == PROTECTED || this == PARTIALLY_CLOSED
                || this == UNPROTECTED || this == CLOSING || this == CLOSED;
    }

    public boolean canTransitionTo(TradeState target) {
        if (target == null) return false;
        if (this == target) return this == PARTIALLY_CLOSED;

        return switch (this) {
            case PLANNED -> target == ENTRY_SUBMITTED || target == ABORTED;
            case ENTRY_SUBMITTED -> target == ENTRY_FILLED || target == ABORTED;
            case ENTRY_FILLED -> target == PROTECTED || target == UNPROTECTED || target == CLOSING || target == CLOSED;
            case PROTECTED -> target == PARTIALLY_CLOSED || target == CLOSING || target == CLOSED;
            case PARTIALLY_CLOSED -> target == CLOSING || target == CLOSED;
            case UNPROTECTED -> target == PROTECTED || target == CLOSING || target == CLOSED;
            case CLOSING -> target == PROTECTED || target == PARTIALLY_CLOSED || target == UNPROTECTED
                    || target == CLOSED;
            default -> false;
        };
    }
}
