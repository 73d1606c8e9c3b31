package com.signalbot.backend.model;

import java.math.BigDecimal;

/**
 * Candidate that passed every policy check, with the values resolved against the config snapshot
 * it was validated with. Consumed once by the planner.
 */
public record ValidatedTrade(
        String tradeId,
        CandidateSignal signal,
        String fingerprint,
        BigDecimal riskRewardRatio,
        int leverage,
        BigDecimal positionSize
) {
    public PositionKey positionKey(boolean hedging) {
        return PositionKey.of(signal.symbol(), signal.marketType(), signal.direction(), hedging);
    }
}
