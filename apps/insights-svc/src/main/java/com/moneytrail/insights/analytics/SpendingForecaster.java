package com.moneytrail.insights.analytics;

import com.moneytrail.insights.model.Amounts;
import com.moneytrail.insights.model.Granularity;
import com.moneytrail.insights.model.Transaction;
import com.moneytrail.insights.model.report.Confidence;
import com.moneytrail.insights.model.report.PeriodStat;
import com.moneytrail.insights.model.report.SpendingPrediction;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;
import org.springframework.stereotype.Component;

/**
 * Flat moving-average forecast over the most recent monthly buckets.
 */
@Component
public class SpendingForecaster {

    static final int LOOKBACK_MONTHS = 3;
    static final int MINIMUM_HISTORY = 2;
    static final double HIGH_CONFIDENCE_BELOW = 0.2;
    static final double LOW_CONFIDENCE_ABOVE = 0.5;

    private final PeriodStatisticsCalculator periodStatistics;

    public SpendingForecaster(PeriodStatisticsCalculator periodStatistics) {
        this.periodStatistics = periodStatistics;
    }

    public List<SpendingPrediction> predict(List<Transaction> transactions, LocalDate startDate, LocalDate endDate, int monthsAhead) {
        List<PeriodStat> history = periodStatistics.bucketize(transactions, startDate, endDate, Granularity.MONTHLY);
        if (history.size() < MINIMUM_HISTORY || monthsAhead <= 0) {
            return List.of();
        }
        List<PeriodStat> recent = history.subList(Math.max(0, history.size() - LOOKBACK_MONTHS), history.size());

        BigDecimal averageIncome = mean(recent, PeriodStat::income);
        BigDecimal averageExpense = mean(recent, PeriodStat::expense);
        double variation = (coefficientOfVariation(recent, PeriodStat::income, averageIncome)
                + coefficientOfVariation(recent, PeriodStat::expense, averageExpense)) / 2.0;
        Confidence confidence = classify(variation);

        BigDecimal income = Amounts.money(averageIncome);
        BigDecimal expense = Amounts.money(averageExpense);
        List<SpendingPrediction> predictions = new ArrayList<>(monthsAhead);
        for (YearMonth month : CalendarPeriods.months(YearMonth.from(endDate).plusMonths(1), monthsAhead)) {
            predictions.add(new SpendingPrediction(
                    CalendarPeriods.monthKey(month),
                    CalendarPeriods.monthLabel(month),
                    income,
                    expense,
                    income.subtract(expense),
                    confidence
            ));
        }
        return predictions;
    }

    static Confidence classify(double coefficientOfVariation) {
        if (coefficientOfVariation < HIGH_CONFIDENCE_BELOW) {
            return Confidence.HIGH;
        }
        if (coefficientOfVariation > LOW_CONFIDENCE_ABOVE) {
            return Confidence.LOW;
        }
        return Confidence.MEDIUM;
    }

    private static BigDecimal mean(List<PeriodStat> stats, Function<PeriodStat, BigDecimal> value) {
        return Amounts.precise(Amounts.sum(stats, value), BigDecimal.valueOf(stats.size()));
    }

    // population standard deviation over the mean; a series without a positive mean counts as fully volatile
    private static double coefficientOfVariation(List<PeriodStat> stats, Function<PeriodStat, BigDecimal> value, BigDecimal mean) {
        if (mean.signum() <= 0) {
            return 1.0;
        }
        double average = mean.doubleValue();
        double variance = stats.stream()
                .mapToDouble(stat -> value.apply(stat).doubleValue() - average)
                .map(delta -> delta * delta)
                .sum() / stats.size();
        return Math.sqrt(variance) / average;
    }
}
