package com.signalbot.backend.service.signal;

import com.signalbot.backend.config.TradingConfigSnapshot;
import com.signalbot.backend.model.CandidateSignal;
import com.signalbot.backend.model.Direction;
import com.signalbot.backend.model.MarketType;
import com.signalbot.backend.model.PositionKey;
import com.signalbot.backend.model.RejectionReason;
import com.signalbot.backend.model.SignalValidationResult;
import com.signalbot.backend.model.ValidatedTrade;
import com.signalbot.backend.util.MoneyUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Comparator;
import java.util.UUID;

/**
 * Turns a candidate into a {@link ValidatedTrade} or a rejection. Checks run in a fixed order and stop at
 * the first failure. The fingerprint is recorded on acceptance, so the caller must hold the decision lock
 * for the whole call.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SignalValidator {

    private final ProcessedSignalCache processedSignalCache;

    public SignalValidationResult validate(CandidateSignal candidate, TradingConfigSnapshot config, RiskSnapshot risk) {
        if (!risk.tradingEnabled() || !config.tradingEnabled()) {
            return SignalValidationResult.rejected(RejectionReason.TRADING_HALTED, "Trading is disabled");
        }
        if (config.isBlacklisted(candidate.symbol())) {
            return SignalValidationResult.rejected(RejectionReason.BLACKLISTED, candidate.symbol() + " is blacklisted");
        }
        if (candidate.confidence() < config.minConfidenceThreshold()) {
            return SignalValidationResult.rejected(RejectionReason.LOW_CONFIDENCE,
                    "Confidence " + candidate.confidence() + " < " + config.minConfidenceThreshold());
        }
        if (!candidate.hasExplicitEntry()) {
            return SignalValidationResult.rejected(RejectionReason.MARKET_ENTRY_REJECTED,
                    "Signal has no explicit entry price");
        }

        Direction direction = candidate.direction();
        BigDecimal entry = candidate.entryPrice();
        BigDecimal stop = candidate.stopLoss();
        if (!MoneyUtils.isPositive(stop)) {
            return SignalValidationResult.rejected(RejectionReason.INVALID_STOP_LOSS, "Stop-loss missing");
        }
        BigDecimal risk1R = direction.favourableMove(stop, entry);
        if (risk1R.signum() <= 0) {
            return SignalValidationResult.rejected(RejectionReason.INVALID_STOP_LOSS,
                    "Stop-loss " + stop + " on wrong side of entry " + entry + " for " + direction);
        }
        BigDecimal stopDistancePct = MoneyUtils.percentOf(risk1R, entry);
        if (stopDistancePct.compareTo(config.maxStopDistancePct()) > 0) {
            return SignalValidationResult.rejected(RejectionReason.STOP_TOO_FAR,
                    "Stop distance " + stopDistancePct.setScale(2, RoundingMode.HALF_UP) + "% > "
                            + config.maxStopDistancePct() + "%");
        }

        BigDecimal riskReward = riskReward(candidate, risk1R);
        if (riskReward.signum() <= 0 || riskReward.compareTo(config.maxRiskRewardRatio()) > 0) {
            return SignalValidationResult.rejected(RejectionReason.RISK_REWARD_EXCEEDED,
                    "Risk/reward " + riskReward.setScale(4, RoundingMode.HALF_UP) + " outside (0, "
                            + config.maxRiskRewardRatio() + "]");
        }
        if (candidate.leverage() != null && candidate.leverage() > config.maxLeverage()) {
            return SignalValidationResult.rejected(RejectionReason.EXCESSIVE_LEVERAGE,
                    "Leverage " + candidate.leverage() + "x > " + config.maxLeverage() + "x");
        }
        if (candidate.marketType() == MarketType.SPOT && !config.spotEnabled()) {
            return SignalValidationResult.rejected(RejectionReason.MARKET_TYPE_UNSUPPORTED, "Spot trading disabled");
        }
        for (BigDecimal tp : candidate.takeProfits()) {
            if (tp == null || direction.favourableMove(entry, tp).signum() <= 0) {
                return SignalValidationResult.rejected(RejectionReason.INVALID_TAKE_PROFIT,
                        "Take-profit " + tp + " on wrong side of entry " + entry + " for " + direction);
            }
        }

        PositionKey key = PositionKey.of(candidate.symbol(), candidate.marketType(), direction, config.allowHedging());
        if (risk.occupiedKeys().contains(key)) {
            return SignalValidationResult.rejected(RejectionReason.DUPLICATE_POSITION, "Position already open for " + key);
        }
        int maxPositions = config.maxPositions(candidate.marketType());
        if (risk.activeCount(candidate.marketType()) >= maxPositions) {
            return SignalValidationResult.rejected(RejectionReason.MAX_POSITIONS_REACHED,
                    candidate.marketType() + " positions " + risk.activeCount(candidate.marketType()) + "/" + maxPositions);
        }

        SignalFingerprint fingerprint = processedSignalCache.fingerprint(candidate);
        if (!processedSignalCache.tryRecord(fingerprint)) {
            return SignalValidationResult.rejected(RejectionReason.DUPLICATE_SIGNAL,
                    "Same signal already processed within TTL");
        }

        ValidatedTrade trade = new ValidatedTrade(
                newTradeId(),
                candidate,
                fingerprint.key(),
                riskReward,
                resolveLeverage(candidate, config),
                config.positionSize(candidate.marketType())
        );
        log.info("Signal accepted {} {} {} entry={} sl={} rr={} lev={}x size={} (config v{})",
                trade.tradeId(), candidate.symbol(), direction, entry, stop,
                riskReward.setScale(4, RoundingMode.HALF_UP), trade.leverage(), trade.positionSize(), config.version());
        return SignalValidationResult.accepted(trade);
    }

    /**
     * (nearest TP - entry) / (entry - stop), signed so that a take-profit on the losing side yields a
     * non-positive ratio.
     */
    BigDecimal riskReward(CandidateSignal candidate, BigDecimal risk1R) {
        BigDecimal entry = candidate.entryPrice();
        return candidate.takeProfits().stream()
                .filter(MoneyUtils::isPositive)
                .min(Comparator.comparing(tp -> tp.subtract(entry).abs()))
                .map(tp -> candidate.direction().favourableMove(entry, tp).divide(risk1R, 8, RoundingMode.HALF_UP))
                .orElse(BigDecimal.ZERO);
    }

    int resolveLeverage(CandidateSignal candidate, TradingConfigSnapshot config) {
        if (!candidate.marketType().supportsLeverage()) {
            return 1;
        }
        if (config.leverageOverride() > 0) {
            return config.leverageOverride();
        }
        if (candidate.leverage() != null && candidate.leverage() > 0) {
            return candidate.leverage();
        }
        return config.defaultLeverage();
    }

    private String newTradeId() {
        return "T-" + UUID.randomUUID().toString().replace("-", "").substring(0, 16);
    }
}
