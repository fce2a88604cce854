package com.moneytrail.insights.analytics;

import com.moneytrail.insights.model.Account;
import com.moneytrail.insights.model.Amounts;
import com.moneytrail.insights.model.Category;
import com.moneytrail.insights.model.CategoryAllocation;
import com.moneytrail.insights.model.Granularity;
import com.moneytrail.insights.model.LedgerDates;
import com.moneytrail.insights.model.Transaction;
import com.moneytrail.insights.model.TransactionType;
import com.moneytrail.insights.model.report.BalancePoint;
import com.moneytrail.insights.model.report.CategoryTrend;
import com.moneytrail.insights.model.report.YearOverYearComparison;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import org.springframework.stereotype.Component;

/**
 * Reports that compare the ledger against itself: over time, against last year, and per category across periods.
 */
@Component
public class ComparativeAnalyzer {

    /**
     * Reconstructs the total balance at the end of each of the last {@code days} days by walking back from the
     * current account balances. Transfers move money between accounts and leave the total unchanged.
     */
    public List<BalancePoint> balanceTrend(List<Transaction> transactions, List<Account> accounts, int days, LocalDate today) {
        if (days <= 0) {
            return List.of();
        }
        Map<LocalDate, List<Transaction>> byDay = PeriodStatisticsCalculator.groupByDay(transactions);
        BigDecimal running = Amounts.sum(accounts, Account::balance);

        List<BalancePoint> points = new ArrayList<>(days);
        List<LocalDate> window = CalendarPeriods.trailingDays(today, days);
        for (int i = window.size() - 1; i >= 0; i--) {
            LocalDate day = window.get(i);
            points.add(new BalancePoint(day, CalendarPeriods.dayLabel(day), running));
            for (Transaction tx : byDay.getOrDefault(day, List.of())) {
                if (tx.is(TransactionType.INCOME)) {
                    running = running.subtract(tx.amount());
                } else if (tx.is(TransactionType.EXPENSE)) {
                    running = running.add(tx.amount());
                }
            }
        }
        Collections.reverse(points);
        return points;
    }

    /**
     * Compares {@code [startDate, endDate]} with the equally long window ending one calendar year before {@code endDate}.
     */
    public YearOverYearComparison yearOverYear(List<Transaction> transactions, LocalDate startDate, LocalDate endDate) {
        long span = CalendarPeriods.daySpan(startDate, endDate);
        LocalDate previousEnd = endDate.minusYears(1);
        LocalDate previousStart = previousEnd.minusDays(span);

        YearOverYearComparison.PeriodTotals current = totals(transactions, startDate, endDate);
        YearOverYearComparison.PeriodTotals previous = totals(transactions, previousStart, previousEnd);

        BigDecimal netChangePercent = previous.net().signum() == 0
                ? BigDecimal.ZERO.setScale(Amounts.PERCENT_SCALE, RoundingMode.HALF_UP)
                : current.net().subtract(previous.net())
                        .multiply(Amounts.HUNDRED)
                        .divide(previous.net().abs(), Amounts.PERCENT_SCALE, RoundingMode.HALF_UP);

        YearOverYearComparison.Changes changes = new YearOverYearComparison.Changes(
                current.income().subtract(previous.income()),
                current.expense().subtract(previous.expense()),
                current.net().subtract(previous.net()),
                Amounts.changePercent(previous.income(), current.income()),
                Amounts.changePercent(previous.expense(), current.expense()),
                netChangePercent
        );
        return new YearOverYearComparison(
                new YearOverYearComparison.Window(startDate, endDate),
                new YearOverYearComparison.Window(previousStart, previousEnd),
                current,
                previous,
                changes
        );
    }

    /**
     * Per-period expense series for the {@code limit} categories with the highest spend in range.
     */
    public List<CategoryTrend> categoryTrends(
            List<Transaction> transactions,
            List<Category> categories,
            LocalDate startDate,
            LocalDate endDate,
            Granularity granularity,
            int limit
    ) {
        List<CalendarPeriod> periods = CalendarPeriods.split(startDate, endDate, granularity);
        if (periods.isEmpty() || limit <= 0) {
            return List.of();
        }

        Map<String, List<DatedAmount>> byCategory = new LinkedHashMap<>();
        for (Transaction tx : transactions) {
            if (!tx.is(TransactionType.EXPENSE)) {
                continue;
            }
            tx.localDate()
                    .filter(date -> LedgerDates.within(date, startDate, endDate))
                    .ifPresent(date -> {
                        for (CategoryAllocation.Share share : tx.allocation().shares()) {
                            byCategory.computeIfAbsent(share.categoryId(), key -> new ArrayList<>())
                                    .add(new DatedAmount(date, share.amount()));
                        }
                    });
        }

        Function<String, Category> resolve = SpendingAggregator.lookup(categories, Category::id, Category::placeholder);
        return byCategory.entrySet().stream()
                .sorted(Comparator.comparing(
                        (Map.Entry<String, List<DatedAmount>> entry) -> Amounts.sum(entry.getValue(), DatedAmount::amount))
                        .reversed())
                .limit(limit)
                .map(entry -> trendFor(resolve.apply(entry.getKey()), entry.getKey(), entry.getValue(), periods))
                .toList();
    }

    private static CategoryTrend trendFor(Category category, String categoryId, List<DatedAmount> points, List<CalendarPeriod> periods) {
        List<CategoryTrend.PeriodAmount> series = new ArrayList<>(periods.size());
        List<BigDecimal> amounts = new ArrayList<>(periods.size());
        for (CalendarPeriod period : periods) {
            BigDecimal amount = points.stream()
                    .filter(point -> period.contains(point.date()))
                    .map(DatedAmount::amount)
                    .reduce(BigDecimal.ZERO, BigDecimal::add);
            series.add(new CategoryTrend.PeriodAmount(period.key(), period.label(), amount));
            amounts.add(amount);
        }
        BigDecimal total = Amounts.sum(amounts, Function.identity());
        HalfSplitTrend.Result trend = HalfSplitTrend.byPeriods(amounts);
        return new CategoryTrend(
                categoryId,
                category.name(),
                category.icon(),
                category.color(),
                series,
                total,
                Amounts.divideSafe(total, periods.size()),
                trend.trend(),
                trend.changePercent()
        );
    }

    private static YearOverYearComparison.PeriodTotals totals(List<Transaction> transactions, LocalDate from, LocalDate to) {
        List<Transaction> inWindow = transactions.stream()
                .filter(tx -> tx.localDate().map(date -> LedgerDates.within(date, from, to)).orElse(false))
                .toList();
        BigDecimal income = SpendingAggregator.total(inWindow, TransactionType.INCOME);
        BigDecimal expense = SpendingAggregator.total(inWindow, TransactionType.EXPENSE);
        return new YearOverYearComparison.PeriodTotals(income, expense, income.subtract(expense), inWindow.size());
    }
}
