package com.signalbot.backend.model;

public record Rejection(RejectionReason reason, String detail) {

    public static Rejection of(RejectionReason reason, String detail) {
        return new Rejection(reason, detail);
    }
}
