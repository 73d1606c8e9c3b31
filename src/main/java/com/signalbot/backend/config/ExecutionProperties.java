package com.signalbot.backend.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;

@Configuration
@ConfigurationProperties(prefix = "execution")
@Data
@Validated
public class ExecutionProperties {

    @Min(1)
    private int entryTimeoutSeconds = 120;

    @PositiveOrZero
    private long pollDelayMs = 1000;

    // limit entry may be improved by up to this fraction of the signal price (0 = exact)
    @PositiveOrZero
    private BigDecimal entryPriceTolerancePct = BigDecimal.ZERO;

    // TP trigger is pulled toward entry by this fraction to favour fills
    @PositiveOrZero
    private BigDecimal takeProfitOffsetPct = new BigDecimal("0.001");

    private ProtectiveRetry protectiveRetry = new ProtectiveRetry();

    private Lot futures = new Lot(new BigDecimal("0.000001"));

    private Lot spot = new Lot(new BigDecimal("0.00000001"));

    @Data
    public static class ProtectiveRetry {
        @Min(1)
        private int maxAttempts = 3;

        @Min(0)
        private long initialBackoffMs = 500;

        private double multiplier = 2.0;
    }

    @Data
    public static class Lot {
        private BigDecimal quantityStep;
        private BigDecimal minQuantity = BigDecimal.ZERO;
        private BigDecimal minNotional = new BigDecimal("5");

        public Lot() {
        }

        public Lot(BigDecimal quantityStep) {
            this.quantityStep = quantityStep;
        }
    }
}
