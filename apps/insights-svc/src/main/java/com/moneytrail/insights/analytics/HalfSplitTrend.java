package com.moneytrail.insights.analytics;

import com.moneytrail.insights.model.Amounts;
import com.moneytrail.insights.model.report.Trend;
import java.math.BigDecimal;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

/**
 * First-half versus second-half comparison used by every trend classification.
 */
final class HalfSplitTrend {

    static final BigDecimal TREND_THRESHOLD_PERCENT = BigDecimal.valueOf(5);

    private static final long SECONDS_PER_DAY = 86_400L;

    private HalfSplitTrend() {
    }

    record Result(BigDecimal changePercent, Trend trend) {

        static Result flat() {
            return new Result(Amounts.changePercent(BigDecimal.ZERO, BigDecimal.ZERO), Trend.STABLE);
        }
    }

    /**
     * Splits {@code [start, end]} at the midpoint instant between their starts of day and compares the daily rate of
     * each half.
     */
    static Result dailyRate(LocalDate start, LocalDate end, List<DatedAmount> points) {
        LocalDateTime from = start.atStartOfDay();
        LocalDateTime to = end.atStartOfDay();
        if (to.isBefore(from)) {
            return Result.flat();
        }
        LocalDateTime midpoint = from.plus(Duration.between(from, to).dividedBy(2));

        BigDecimal firstHalf = BigDecimal.ZERO;
        BigDecimal secondHalf = BigDecimal.ZERO;
        for (DatedAmount point : points) {
            LocalDateTime at = point.date().atStartOfDay();
            if (!at.isBefore(from) && at.isBefore(midpoint)) {
                firstHalf = firstHalf.add(point.amount());
            } else if (!at.isBefore(midpoint) && !at.isAfter(to)) {
                secondHalf = secondHalf.add(point.amount());
            }
        }

        BigDecimal firstDaily = Amounts.precise(firstHalf, BigDecimal.valueOf(ceilDays(Duration.between(from, midpoint))));
        BigDecimal secondDaily = Amounts.precise(secondHalf, BigDecimal.valueOf(ceilDays(Duration.between(midpoint, to))));
        BigDecimal changePercent = Amounts.changePercent(firstDaily, secondDaily);
        return new Result(changePercent, classify(changePercent));
    }

    /**
     * Compares the mean of the first {@code n / 2} amounts with the mean of the rest; only a series that is
     * positive on both sides gets a non-zero change.
     */
    static Result byPeriods(List<BigDecimal> amounts) {
        int midpoint = amounts.size() / 2;
        BigDecimal firstAverage = average(amounts.subList(0, midpoint));
        BigDecimal secondAverage = average(amounts.subList(midpoint, amounts.size()));
        if (firstAverage.signum() <= 0 || secondAverage.signum() <= 0) {
            return Result.flat();
        }
        BigDecimal changePercent = Amounts.changePercent(firstAverage, secondAverage);
        return new Result(changePercent, classify(changePercent));
    }

    static Trend classify(BigDecimal changePercent) {
        if (changePercent.compareTo(TREND_THRESHOLD_PERCENT) > 0) {
            return Trend.INCREASING;
        }
        if (changePercent.compareTo(TREND_THRESHOLD_PERCENT.negate()) < 0) {
            return Trend.DECREASING;
        }
        return Trend.STABLE;
    }

    private static BigDecimal average(List<BigDecimal> amounts) {
        if (amounts.isEmpty()) {
            return BigDecimal.ZERO;
        }
        BigDecimal total = amounts.stream().reduce(BigDecimal.ZERO, BigDecimal::add);
        return Amounts.precise(total, BigDecimal.valueOf(amounts.size()));
    }

    private static long ceilDays(Duration duration) {
        long seconds = duration.getSeconds();
        return (seconds + SECONDS_PER_DAY - 1) / SECONDS_PER_DAY;
    }
}
