package com.signalbot.backend.dto;

import com.signalbot.backend.service.TradeStatisticsService.TradeStatistics;
import com.signalbot.backend.service.execution.ExecutionResult;
import lombok.Builder;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

@Builder
public record StatusResponse(
        String mode,
        long configVersion,
        boolean tradingEnabled,
        String haltReason,
        BigDecimal dailyRealizedPnl,
        BigDecimal maxDailyLoss,
        Map<String, Integer> openPositions,
        List<ExecutionResult> activeExecutions,
        TradeStatistics statistics,
        List<Map<String, Object>> criticalAlerts
) {
}
