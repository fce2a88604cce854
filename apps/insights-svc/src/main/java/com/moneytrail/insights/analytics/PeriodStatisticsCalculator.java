package com.moneytrail.insights.analytics;

import com.moneytrail.insights.model.Amounts;
import com.moneytrail.insights.model.Granularity;
import com.moneytrail.insights.model.Transaction;
import com.moneytrail.insights.model.TransactionType;
import com.moneytrail.insights.model.report.CashFlowPoint;
import com.moneytrail.insights.model.report.PeriodStat;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.springframework.stereotype.Component;

@Component
public class PeriodStatisticsCalculator {

    /**
     * Income, expense and activity per calendar bucket of {@code [startDate, endDate]}.
     */
    public List<PeriodStat> bucketize(List<Transaction> transactions, LocalDate startDate, LocalDate endDate, Granularity granularity) {
        List<CalendarPeriod> periods = CalendarPeriods.split(startDate, endDate, granularity);
        if (periods.isEmpty()) {
            return List.of();
        }
        List<Dated> dated = dated(transactions);
        List<PeriodStat> stats = new ArrayList<>(periods.size());
        for (CalendarPeriod period : periods) {
            List<Transaction> inPeriod = dated.stream()
                    .filter(entry -> period.contains(entry.date()))
                    .map(Dated::transaction)
                    .toList();
            BigDecimal income = SpendingAggregator.total(inPeriod, TransactionType.INCOME);
            BigDecimal expense = SpendingAggregator.total(inPeriod, TransactionType.EXPENSE);
            stats.add(new PeriodStat(
                    period.key(),
                    period.label(),
                    period.start(),
                    period.end(),
                    income,
                    expense,
                    income.subtract(expense),
                    inPeriod.size(),
                    Amounts.divideSafe(expense, Math.max(1L, CalendarPeriods.daySpan(period.start(), period.end())))
            ));
        }
        return stats;
    }

    /**
     * The last {@code months} calendar months up to and including the month of {@code today}.
     */
    public List<PeriodStat> monthlyTrends(List<Transaction> transactions, int months, LocalDate today) {
        if (months <= 0) {
            return List.of();
        }
        YearMonth current = YearMonth.from(today);
        YearMonth first = current.minusMonths(months - 1L);
        return bucketize(transactions, first.atDay(1), current.atEndOfMonth(), Granularity.MONTHLY);
    }

    /**
     * Daily income and expense for the {@code days} days ending with {@code today}.
     */
    public List<CashFlowPoint> cashFlow(List<Transaction> transactions, int days, LocalDate today) {
        if (days <= 0) {
            return List.of();
        }
        Map<LocalDate, List<Transaction>> byDay = groupByDay(transactions);
        return CalendarPeriods.trailingDays(today, days).stream()
                .map(day -> {
                    List<Transaction> dayTransactions = byDay.getOrDefault(day, List.of());
                    BigDecimal income = SpendingAggregator.total(dayTransactions, TransactionType.INCOME);
                    BigDecimal expense = SpendingAggregator.total(dayTransactions, TransactionType.EXPENSE);
                    return new CashFlowPoint(day, CalendarPeriods.dayLabel(day), income, expense, income.subtract(expense));
                })
                .toList();
    }

    static Map<LocalDate, List<Transaction>> groupByDay(List<Transaction> transactions) {
        Map<LocalDate, List<Transaction>> byDay = new LinkedHashMap<>();
        for (Transaction tx : transactions) {
            Optional<LocalDate> date = tx.localDate();
            date.ifPresent(day -> byDay.computeIfAbsent(day, key -> new ArrayList<>()).add(tx));
        }
        return byDay;
    }

    private static List<Dated> dated(List<Transaction> transactions) {
        List<Dated> result = new ArrayList<>(transactions.size());
        for (Transaction tx : transactions) {
            tx.localDate().ifPresent(date -> result.add(new Dated(tx, date)));
        }
        return result;
    }

    private record Dated(Transaction transaction, LocalDate date) {
    }
}
