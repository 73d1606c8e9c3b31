package com.signalbot.backend.config;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;
import java.util.LinkedHashSet;
import java.util.Set;

@Configuration
@ConfigurationProperties(prefix = "trading")
@Data
@Validated
public class TradingProperties {

    @NotNull
    private TradingMode mode = TradingMode.DEMO;

    // 0 means "use the signal's leverage"
    @Min(0)
    private int leverage = 0;

    @Positive
    private BigDecimal futuresPositionSize = new BigDecimal("150");

    @Positive
    private BigDecimal spotPositionSize = new BigDecimal("100");

    @Min(0)
    private int maxFuturesPositions = 2;

    @Min(0)
    private int maxSpotPositions = 1;

    @Positive
    private BigDecimal maxDailyLoss = new BigDecimal("300");

    private Set<String> blacklist = new LinkedHashSet<>();

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double minConfidenceThreshold = 0.7;

    @Positive
    private BigDecimal maxRiskRewardRatio = new BigDecimal("3.0");

    private boolean tradingEnabled = true;

    private boolean allowHedging = false;

    private boolean spotEnabled = true;

    @Min(1)
    private int maxLeverage = 100;

    @Min(1)
    private int defaultLeverage = 1;

    @Positive
    private BigDecimal maxStopDistancePct = new BigDecimal("20");

    @NotNull
    private String dayZone = "UTC";
}
