package com.moneytrail.insights.model;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Collection;
import java.util.function.Function;

/**
 * Decimal helpers shared by every report. Ratios never fail: a zero denominator yields zero.
 */
public final class Amounts {

    /** Tolerance for "amounts are equal" checks such as split totals and budget remainders. */
    public static final BigDecimal AMOUNT_EPSILON = new BigDecimal("0.01");

    public static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    /** Scale of money averages. */
    public static final int MONEY_SCALE = 2;

    /** Scale of percentages; four places keep bucket shares summing to 100 within a cent. */
    public static final int PERCENT_SCALE = 4;

    private static final int WORKING_SCALE = 8;

    private Amounts() {
    }

    public static BigDecimal orZero(BigDecimal value) {
        return value == null ? BigDecimal.ZERO : value;
    }

    public static <T> BigDecimal sum(Collection<T> items, Function<T, BigDecimal> amount) {
        return items.stream()
                .map(amount)
                .map(Amounts::orZero)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    public static BigDecimal divideSafe(BigDecimal numerator, BigDecimal denominator) {
        return divideSafe(numerator, denominator, MONEY_SCALE);
    }

    public static BigDecimal divideSafe(BigDecimal numerator, long denominator) {
        return divideSafe(numerator, BigDecimal.valueOf(denominator), MONEY_SCALE);
    }

    public static BigDecimal divideSafe(BigDecimal numerator, BigDecimal denominator, int scale) {
        if (denominator == null || denominator.signum() == 0) {
            return BigDecimal.ZERO.setScale(scale, RoundingMode.HALF_UP);
        }
        return orZero(numerator).divide(denominator, scale, RoundingMode.HALF_UP);
    }

    /** Unrounded-enough quotient for intermediate values that are compared or multiplied again. */
    public static BigDecimal precise(BigDecimal numerator, BigDecimal denominator) {
        return divideSafe(numerator, denominator, WORKING_SCALE);
    }

    /**
     * {@code part / total * 100}, or zero when the total is not positive.
     */
    public static BigDecimal percentOf(BigDecimal part, BigDecimal total) {
        if (total == null || total.signum() <= 0) {
            return BigDecimal.ZERO.setScale(PERCENT_SCALE, RoundingMode.HALF_UP);
        }
        return orZero(part).multiply(HUNDRED).divide(total, PERCENT_SCALE, RoundingMode.HALF_UP);
    }

    /**
     * Relative change from {@code previous} to {@code current} in percent, zero when {@code previous} is not positive.
     */
    public static BigDecimal changePercent(BigDecimal previous, BigDecimal current) {
        if (previous == null || previous.signum() <= 0) {
            return BigDecimal.ZERO.setScale(PERCENT_SCALE, RoundingMode.HALF_UP);
        }
        return orZero(current).subtract(previous)
                .multiply(HUNDRED)
                .divide(previous, PERCENT_SCALE, RoundingMode.HALF_UP);
    }

    public static boolean approximatelyEqual(BigDecimal a, BigDecimal b) {
        return orZero(a).subtract(orZero(b)).abs().compareTo(AMOUNT_EPSILON) < 0;
    }

    public static BigDecimal money(BigDecimal value) {
        return orZero(value).setScale(MONEY_SCALE, RoundingMode.HALF_UP);
    }
}
