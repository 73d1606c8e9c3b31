package com.signalbot.backend.model;

public enum OrderSide {
    BUY,
    SELL
}
