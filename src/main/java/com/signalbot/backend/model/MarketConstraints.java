package com.signalbot.backend.model;

import java.math.BigDecimal;

/**
 * Exchange lot rules for a symbol: quantities are multiples of {@code quantityStep},
 * at least {@code minQuantity}, and worth at least {@code minNotional} in quote currency.
 */
public record MarketConstraints(BigDecimal quantityStep, BigDecimal minQuantity, BigDecimal minNotional) {

    public static MarketConstraints unrestricted(BigDecimal quantityStep) {
        return new MarketConstraints(quantityStep, BigDecimal.ZERO, BigDecimal.ZERO);
    }
}
