package com.signalbot.backend.util;

import java.math.BigDecimal;
import java.math.RoundingMode;

public final class MoneyUtils {

    public static final int SCALE = 8;
    public static final BigDecimal ZERO = BigDecimal.ZERO.setScale(SCALE, RoundingMode.HALF_UP);
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private MoneyUtils() {
    }

    public static BigDecimal bd(String value) {
        if (value == null || value.isBlank()) {
            return ZERO;
        }
        return scale(new BigDecimal(value.trim()));
    }

    public static BigDecimal bd(double value) {
        return scale(BigDecimal.valueOf(value));
    }

    public static BigDecimal scale(BigDecimal value) {
        if (value == null) {
            return ZERO;
        }
        return value.setScale(SCALE, RoundingMode.HALF_UP);
    }

    public static BigDecimal add(BigDecimal left, BigDecimal right) {
        return scale(scale(left).add(scale(right)));
    }

    public static BigDecimal subtract(BigDecimal left, BigDecimal right) {
        return scale(scale(left).subtract(scale(right)));
    }

    public static BigDecimal multiply(BigDecimal left, BigDecimal right) {
        return scale(scale(left).multiply(scale(right)));
    }

    public static BigDecimal divide(BigDecimal left, BigDecimal right) {
        return scale(left).divide(scale(right), SCALE, RoundingMode.HALF_UP);
    }

    /**
     * Rounds {@code quantity} down to a whole multiple of {@code step}. Never rounds up, so the result is
     * always affordable with the notional it was derived from.
     */
    public static BigDecimal floorToStep(BigDecimal quantity, BigDecimal step) {
        if (step == null || step.signum() <= 0) {
            return scale(quantity);
        }
        BigDecimal steps = quantity.divide(step, 0, RoundingMode.DOWN);
        return scale(steps.multiply(step));
    }

    /** {@code value} as a percentage of {@code base}. */
    public static BigDecimal percentOf(BigDecimal value, BigDecimal base) {
        return value.multiply(HUNDRED).divide(base, SCALE, RoundingMode.HALF_UP);
    }

    public static boolean isPositive(BigDecimal value) {
        return value != null && value.signum() > 0;
    }
}
