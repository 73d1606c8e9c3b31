package com.signalbot.backend.service;

import com.signalbot.backend.entity.TrackedPosition;
import com.signalbot.backend.service.position.PositionTracker;
import com.signalbot.backend.util.MoneyUtils;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;

@Service
@RequiredArgsConstructor
public class TradeStatisticsService {

    private final PositionTracker positionTracker;

    public TradeStatistics statistics() {
        List<TrackedPosition> closed = positionTracker.closedPositions();
        int wins = 0;
        int losses = 0;
        BigDecimal total = MoneyUtils.ZERO;
        BigDecimal best = null;
        BigDecimal worst = null;
        for (TrackedPosition position : closed) {
            BigDecimal pnl = position.getRealizedPnl() == null ? BigDecimal.ZERO : position.getRealizedPnl();
            total = MoneyUtils.add(total, pnl);
            if (pnl.signum() > 0) {
                wins++;
            } else if (pnl.signum() < 0) {
                losses++;
            }
            best = best == null || pnl.compareTo(best) > 0 ? pnl : best;
            worst = worst == null || pnl.compareTo(worst) < 0 ? pnl : worst;
        }
        BigDecimal winRate = closed.isEmpty()
                ? BigDecimal.ZERO
                : BigDecimal.valueOf(wins * 100L).divide(BigDecimal.valueOf(closed.size()), 2, RoundingMode.HALF_UP);
        return new TradeStatistics(closed.size(), wins, losses, winRate, total, best, worst);
    }

    public record TradeStatistics(int totalTrades, int wins, int losses, BigDecimal winRatePct,
                                  BigDecimal totalPnl, BigDecimal bestTrade, BigDecimal worstTrade) {
    }
}
