package com.signalbot.backend.model;

public record SignalValidationResult(ValidatedTrade trade, Rejection rejection) {

    public static SignalValidationResult accepted(ValidatedTrade trade) {
        return new SignalValidationResult(trade, null);
    }

    public static SignalValidationResult rejected(RejectionReason reason, String detail) {
        return new SignalValidationResult(null, Rejection.of(reason, detail));
    }

    public boolean isAccepted() {
        return trade != null;
    }
}
