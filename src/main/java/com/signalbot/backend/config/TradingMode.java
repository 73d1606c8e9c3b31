package com.signalbot.backend.config;

public enum TradingMode {
    DEMO,
    LIVE
}
