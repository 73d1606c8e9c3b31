package com.signalbot.backend.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;

/**
 * Single-row daily risk accumulator.
 */
@Entity
@Table(name = "risk_ledger")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RiskLedger {

    public static final long SINGLETON_ID = 1L;

    @Id
    private Long id;

    private LocalDate tradingDay;

    @Column(precision = 30, scale = 12)
    private BigDecimal dailyRealizedPnl;

    // daily pnl at the last manual enable; the limit re-trips only below it
    @Column(precision = 30, scale = 12)
    private BigDecimal acknowledgedPnl;

    @Column(nullable = false)
    private boolean tradingEnabled;

    private String haltReason;

    private Instant haltedAt;

    private Instant updatedAt;
}
