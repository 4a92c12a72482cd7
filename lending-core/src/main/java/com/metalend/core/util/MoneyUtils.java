package com.metalend.core.util;

import java.math.BigDecimal;
import java.math.RoundingMode;

public final class MoneyUtils {

    public static final int SCALE = 6;
    public static final int RATIO_SCALE = 18;
    public static final BigDecimal ZERO = BigDecimal.ZERO.setScale(SCALE, RoundingMode.DOWN);

    private MoneyUtils() {
    }

    public static BigDecimal bd(String value) {
        if (value == null || value.isBlank()) {
            return ZERO;
        }
        return scale(new BigDecimal(value));
    }

    public static BigDecimal bd(long value) {
        return scale(BigDecimal.valueOf(value));
    }

    public static BigDecimal scale(BigDecimal value) {
        if (value == null) {
            return ZERO;
        }
        return value.setScale(SCALE, RoundingMode.DOWN);
    }

    public static BigDecimal add(BigDecimal left, BigDecimal right) {
        return scale(scale(left).add(scale(right)));
    }

    public static BigDecimal subtract(BigDecimal left, BigDecimal right) {
        return scale(scale(left).subtract(scale(right)));
    }

    /**
     * Multiplies an amount by a ratio (rate, bound, fraction) and truncates to money scale.
     */
    public static BigDecimal applyRatio(BigDecimal amount, BigDecimal ratio) {
        return scale(scale(amount).multiply(ratio));
    }

    /**
     * {@code value * numerator / denominator}, truncated to money scale.
     */
    public static BigDecimal mulDiv(BigDecimal value, BigDecimal numerator, BigDecimal denominator) {
        return scale(value).multiply(numerator).divide(denominator, SCALE, RoundingMode.DOWN);
    }

    public static BigDecimal ratio(BigDecimal numerator, BigDecimal denominator) {
        if (denominator == null || denominator.signum() == 0) {
            return BigDecimal.ZERO;
        }
        return numerator.divide(denominator, RATIO_SCALE, RoundingMode.DOWN);
    }

    public static BigDecimal min(BigDecimal left, BigDecimal right) {
        return left.compareTo(right) <= 0 ? left : right;
    }

    public static BigDecimal floorAtZero(BigDecimal value) {
        return value.signum() < 0 ? ZERO : value;
    }

    public static boolean isPositive(BigDecimal value) {
        return value != null && value.signum() > 0;
    }
}
