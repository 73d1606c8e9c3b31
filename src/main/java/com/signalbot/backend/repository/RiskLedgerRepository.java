package com.signalbot.backend.repository;

import com.signalbot.backend.entity.RiskLedger;
import org.springframework.data.jpa.repository.JpaRepository;

public interface RiskLedgerRepository extends JpaRepository<RiskLedger, Long> {
}
