package com.signalbot.backend.service.signal;

import com.signalbot.backend.model.Rejection;
import com.signalbot.backend.model.RejectionReason;

public record PipelineResult(String signalId, String tradeId, Rejection rejection) {

    public static PipelineResult accepted(String signalId, String tradeId) {
        return new PipelineResult(signalId, tradeId, null);
    }

    public static PipelineResult rejected(String signalId, Rejection rejection) {
        return new PipelineResult(signalId, null, rejection);
    }

    public static PipelineResult rejected(String signalId, RejectionReason reason, String detail) {
        return rejected(signalId, Rejection.of(reason, detail));
    }

    public boolean isAccepted() {
        return tradeId != null;
    }
}
