package com.tradecycle.backend.util;

import java.math.BigDecimal;
import java.math.RoundingMode;

public final class MoneyUtils {

    public static final int SCALE = 8;
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private MoneyUtils() {
    }

    public static BigDecimal decimal(String value) {
        if (value == null || value.isBlank()) {
            return BigDecimal.ZERO;
        }
        return new BigDecimal(value.trim());
    }

    public static BigDecimal optionalDecimal(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return new BigDecimal(value.trim());
    }

    public static BigDecimal orZero(BigDecimal value) {
        return value == null ? BigDecimal.ZERO : value;
    }

    public static BigDecimal roundDown(BigDecimal value, int scale) {
        return value.setScale(scale, RoundingMode.DOWN);
    }

    public static boolean isPositive(BigDecimal value) {
        return value != null && value.signum() > 0;
    }

    public static BigDecimal percentOf(BigDecimal value, BigDecimal pct) {
        return orZero(value).multiply(orZero(pct)).divide(HUNDRED, SCALE, RoundingMode.HALF_UP);
    }

    public static BigDecimal notional(BigDecimal quantity, BigDecimal price) {
        return orZero(quantity).multiply(orZero(price));
    }

    /** Plain string without exponent, as the venue expects. */
    public static String plain(BigDecimal value) {
        return value == null ? null : value.stripTrailingZeros().toPlainString();
    }
}
