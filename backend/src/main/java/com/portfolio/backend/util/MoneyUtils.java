package com.portfolio.backend.util;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;

public final class MoneyUtils {

    public static final int SCALE = 4;
    public static final int DISPLAY_SCALE = 2;
    public static final BigDecimal ZERO = BigDecimal.ZERO.setScale(SCALE, RoundingMode.HALF_UP);
    public static final BigDecimal DISPLAY_ZERO = BigDecimal.ZERO.setScale(DISPLAY_SCALE, RoundingMode.HALF_UP);

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private MoneyUtils() {
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

    public static BigDecimal round2(BigDecimal value) {
        if (value == null) {
            return DISPLAY_ZERO;
        }
        return value.setScale(DISPLAY_SCALE, RoundingMode.HALF_UP);
    }

    /**
     * Unrounded product; callers decide when to round.
     */
    public static BigDecimal multiply(BigDecimal price, int quantity) {
        return price.multiply(BigDecimal.valueOf(quantity));
    }

    /**
     * Day-over-day change in percent, rounded for display. Zero when there is no usable base.
     */
    public static BigDecimal percentChange(BigDecimal latest, BigDecimal previous) {
        if (latest == null || previous == null || previous.signum() == 0) {
            return DISPLAY_ZERO;
        }
        BigDecimal ratio = latest.subtract(previous).divide(previous, MathContext.DECIMAL64);
        return round2(ratio.multiply(HUNDRED));
    }
}
