package com.signalbot.backend.config;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class TradingConfigHolderTest {

    @Test
    void snapshotNormalisesBlacklistFromProperties() {
        TradingProperties properties = new TradingProperties();
        properties.setBlacklist(Set.of(" dogeusdt ", "PEPEUSDT"));

        TradingConfigHolder holder = new TradingConfigHolder(properties);

        assertThat(holder.current().version()).isEqualTo(1);
        assertThat(holder.current().isBlacklisted("DOGEUSDT")).isTrue();
        assertThat(holder.current().isBlacklisted("BTCUSDT")).isFalse();
    }

    @Test
    void publishedSnapshotOnlyAffectsLaterReads() {
        TradingConfigHolder holder = new TradingConfigHolder(new TradingProperties());
        TradingConfigSnapshot inFlight = holder.current();

        TradingConfigSnapshot next = holder.update(config -> config.toBuilder()
                .maxDailyLoss(new BigDecimal("100"))
                .build());

        assertThat(next.version()).isEqualTo(2);
        assertThat(holder.current().maxDailyLoss()).isEqualByComparingTo("100");
        assertThat(inFlight.maxDailyLoss()).isEqualByComparingTo("300");
        assertThat(inFlight.version()).isEqualTo(1);
    }
}
