package com.signalbot.backend.config;

import com.signalbot.backend.model.MarketType;
import lombok.Builder;

import java.math.BigDecimal;
import java.time.ZoneId;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Immutable view of the trading configuration. One snapshot is read per decision; a newer one only
 * affects decisions started after it was published.
 */
@Builder(toBuilder = true)
public record TradingConfigSnapshot(
        long version,
        TradingMode mode,
        int leverageOverride,
        BigDecimal futuresPositionSize,
        BigDecimal spotPositionSize,
        int maxFuturesPositions,
        int maxSpotPositions,
        BigDecimal maxDailyLoss,
        Set<String> blacklist,
        double minConfidenceThreshold,
        BigDecimal maxRiskRewardRatio,
        boolean tradingEnabled,
        boolean allowHedging,
        boolean spotEnabled,
        int maxLeverage,
        int defaultLeverage,
        BigDecimal maxStopDistancePct,
        ZoneId dayZone
) {
    public TradingConfigSnapshot {
        blacklist = blacklist == null ? Set.of() : Set.copyOf(blacklist);
    }

    public static TradingConfigSnapshot from(TradingProperties properties, long version) {
        return TradingConfigSnapshot.builder()
                .version(version)
                .mode(properties.getMode())
                .leverageOverride(properties.getLeverage())
                .futuresPositionSize(properties.getFuturesPositionSize())
                .spotPositionSize(properties.getSpotPositionSize())
                .maxFuturesPositions(properties.getMaxFuturesPositions())
                .maxSpotPositions(properties.getMaxSpotPositions())
                .maxDailyLoss(properties.getMaxDailyLoss())
                .blacklist(properties.getBlacklist().stream().map(s -> s.trim().toUpperCase()).collect(Collectors.toSet()))
                .minConfidenceThreshold(properties.getMinConfidenceThreshold())
                .maxRiskRewardRatio(properties.getMaxRiskRewardRatio())
                .tradingEnabled(properties.isTradingEnabled())
                .allowHedging(properties.isAllowHedging())
                .spotEnabled(properties.isSpotEnabled())
                .maxLeverage(properties.getMaxLeverage())
                .defaultLeverage(properties.getDefaultLeverage())
                .maxStopDistancePct(properties.getMaxStopDistancePct())
                .dayZone(ZoneId.of(properties.getDayZone()))
                .build();
    }

    public boolean isBlacklisted(String symbol) {
        return symbol != null && blacklist.contains(symbol.trim().toUpperCase());
    }

    public BigDecimal positionSize(MarketType marketType) {
        return marketType == MarketType.FUTURES ? futuresPositionSize : spotPositionSize;
    }

    public int maxPositions(MarketType marketType) {
        return marketType == MarketType.FUTURES ? maxFuturesPositions : maxSpotPositions;
    }

    public boolean isLive() {
        return mode == TradingMode.LIVE;
    }
}
