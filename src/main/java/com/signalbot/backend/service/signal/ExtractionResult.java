package com.signalbot.backend.service.signal;

import com.signalbot.backend.model.CandidateSignal;

public record ExtractionResult(Outcome outcome, CandidateSignal signal, String detail) {

    public enum Outcome {
        SIGNAL,
        NOT_A_SIGNAL,
        PARSE_FAILED
    }

    public static ExtractionResult signal(CandidateSignal signal) {
        return new ExtractionResult(Outcome.SIGNAL, signal, null);
    }

    public static ExtractionResult notASignal(String detail) {
        return new ExtractionResult(Outcome.NOT_A_SIGNAL, null, detail);
    }

    public static ExtractionResult parseFailed(String detail) {
        return new ExtractionResult(Outcome.PARSE_FAILED, null, detail);
    }

    public boolean isSignal() {
        return outcome == Outcome.SIGNAL;
    }
}
