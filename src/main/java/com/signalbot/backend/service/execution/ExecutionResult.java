package com.signalbot.backend.service.execution;

import com.signalbot.backend.model.Rejection;
import com.signalbot.backend.model.TradeState;

import java.math.BigDecimal;

public record ExecutionResult(String tradeId, TradeState state, BigDecimal filledQuantity,
                              BigDecimal averagePrice, Rejection rejection) {

    public boolean isAborted() {
        return state == TradeState.ABORTED;
    }
}
