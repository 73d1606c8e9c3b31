package com.signalbot.backend.model;

public enum CloseReason {
    STOP_LOSS,
    TAKE_PROFIT,
    EXTERNAL,
    MANUAL
}
