package com.signalbot.backend.service.signal;

import com.signalbot.backend.model.MarketType;
import com.signalbot.backend.model.PositionKey;

import java.util.Map;
import java.util.Set;

/**
 * Risk inputs for one validation, captured under the decision lock. Counts include reserved slots.
 */
public record RiskSnapshot(boolean tradingEnabled, Map<MarketType, Integer> activeCounts,
                           Set<PositionKey> occupiedKeys) {

    public RiskSnapshot {
        activeCounts = Map.copyOf(activeCounts);
        occupiedKeys = Set.copyOf(occupiedKeys);
    }

    public int activeCount(MarketType marketType) {
        return activeCounts.getOrDefault(marketType, 0);
    }
}
