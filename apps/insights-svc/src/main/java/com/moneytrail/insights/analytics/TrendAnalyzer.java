package com.moneytrail.insights.analytics;

import com.moneytrail.insights.model.Account;
import com.moneytrail.insights.model.Amounts;
import com.moneytrail.insights.model.Category;
import com.moneytrail.insights.model.CategoryAllocation;
import com.moneytrail.insights.model.LedgerDates;
import com.moneytrail.insights.model.Transaction;
import com.moneytrail.insights.model.TransactionType;
import com.moneytrail.insights.model.report.AccountStatistics;
import com.moneytrail.insights.model.report.CategoryPerformance;
import com.moneytrail.insights.model.report.SpendingVelocity;
import com.moneytrail.insights.model.report.TransactionFrequency;
import java.math.BigDecimal;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.format.TextStyle;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import org.springframework.stereotype.Component;

@Component
public class TrendAnalyzer {

    private static final BigDecimal DAYS_PER_WEEK = BigDecimal.valueOf(7);
    private static final BigDecimal DAYS_PER_MONTH = BigDecimal.valueOf(30);
    private static final List<DayOfWeek> SUNDAY_FIRST = List.of(
            DayOfWeek.SUNDAY,
            DayOfWeek.MONDAY,
            DayOfWeek.TUESDAY,
            DayOfWeek.WEDNESDAY,
            DayOfWeek.THURSDAY,
            DayOfWeek.FRIDAY,
            DayOfWeek.SATURDAY
    );

    public SpendingVelocity spendingVelocity(List<Transaction> transactions, LocalDate startDate, LocalDate endDate) {
        List<DatedAmount> expenses = new ArrayList<>();
        for (Transaction tx : transactions) {
            if (!tx.is(TransactionType.EXPENSE)) {
                continue;
            }
            tx.localDate()
                    .filter(date -> LedgerDates.within(date, startDate, endDate))
                    .ifPresent(date -> expenses.add(new DatedAmount(date, tx.amount())));
        }
        BigDecimal total = Amounts.sum(expenses, DatedAmount::amount);
        long span = CalendarPeriods.daySpan(startDate, endDate);
        BigDecimal daily = span > 0 ? Amounts.precise(total, BigDecimal.valueOf(span)) : BigDecimal.ZERO;

        HalfSplitTrend.Result trend = HalfSplitTrend.dailyRate(startDate, endDate, expenses);
        return new SpendingVelocity(
                Amounts.money(daily),
                Amounts.money(daily.multiply(DAYS_PER_WEEK)),
                Amounts.money(daily.multiply(DAYS_PER_MONTH)),
                trend.trend(),
                trend.changePercent()
        );
    }

    /**
     * Activity per weekday over every transaction given; the date range only sets the averaging span.
     */
    public TransactionFrequency transactionFrequency(List<Transaction> transactions, LocalDate startDate, LocalDate endDate) {
        Map<DayOfWeek, Integer> counts = new LinkedHashMap<>();
        SUNDAY_FIRST.forEach(day -> counts.put(day, 0));
        for (Transaction tx : transactions) {
            tx.localDate().ifPresent(date -> counts.merge(date.getDayOfWeek(), 1, Integer::sum));
        }

        DayOfWeek mostActive = SUNDAY_FIRST.get(0);
        for (DayOfWeek day : SUNDAY_FIRST) {
            if (counts.get(day) > counts.get(mostActive)) {
                mostActive = day;
            }
        }

        int total = transactions.size();
        long span = CalendarPeriods.daySpan(startDate, endDate);
        BigDecimal count = BigDecimal.valueOf(total);
        BigDecimal days = BigDecimal.valueOf(Math.max(span, 0));
        return new TransactionFrequency(
                total,
                Amounts.divideSafe(count, days),
                Amounts.divideSafe(count.multiply(DAYS_PER_WEEK), days),
                Amounts.divideSafe(count.multiply(DAYS_PER_MONTH), days),
                mostActive.getDisplayName(TextStyle.FULL, Locale.ENGLISH),
                counts.get(mostActive)
        );
    }

    /**
     * Per-category expense statistics within the range, attributing split parts to their own categories.
     */
    public List<CategoryPerformance> categoryPerformance(
            List<Transaction> transactions,
            List<Category> categories,
            LocalDate startDate,
            LocalDate endDate
    ) {
        Map<String, List<DatedAmount>> byCategory = new LinkedHashMap<>();
        for (Transaction tx : transactions) {
            if (!tx.is(TransactionType.EXPENSE)) {
                continue;
            }
            Optional<LocalDate> date = tx.localDate().filter(day -> LedgerDates.within(day, startDate, endDate));
            if (date.isEmpty()) {
                continue;
            }
            for (CategoryAllocation.Share share : tx.allocation().shares()) {
                byCategory.computeIfAbsent(share.categoryId(), key -> new ArrayList<>())
                        .add(new DatedAmount(date.get(), share.amount()));
            }
        }

        Function<String, Category> resolve = SpendingAggregator.lookup(categories, Category::id, Category::placeholder);
        return byCategory.entrySet().stream()
                .map(entry -> {
                    Category category = resolve.apply(entry.getKey());
                    List<DatedAmount> points = entry.getValue();
                    BigDecimal total = Amounts.sum(points, DatedAmount::amount);
                    HalfSplitTrend.Result trend = HalfSplitTrend.dailyRate(startDate, endDate, points);
                    return new CategoryPerformance(
                            entry.getKey(),
                            category.name(),
                            category.icon(),
                            category.color(),
                            total,
                            points.size(),
                            Amounts.divideSafe(total, points.size()),
                            points.stream().map(DatedAmount::amount).max(Comparator.naturalOrder()).orElse(BigDecimal.ZERO),
                            points.stream().map(DatedAmount::amount).min(Comparator.naturalOrder()).orElse(BigDecimal.ZERO),
                            points.stream().map(DatedAmount::date).max(Comparator.naturalOrder()).orElse(null),
                            trend.trend()
                    );
                })
                .sorted(Comparator.comparing(CategoryPerformance::totalSpent).reversed())
                .toList();
    }

    public List<AccountStatistics> accountStatistics(List<Transaction> transactions, List<Account> accounts) {
        Map<String, AccountTally> tallies = new LinkedHashMap<>();
        for (Transaction tx : transactions) {
            tallies.merge(tx.accountId(), AccountTally.of(tx), AccountTally::plus);
        }
        Function<String, Account> resolve = SpendingAggregator.lookup(accounts, Account::id, Account::placeholder);
        return tallies.entrySet().stream()
                .map(entry -> {
                    AccountTally tally = entry.getValue();
                    return new AccountStatistics(
                            entry.getKey(),
                            resolve.apply(entry.getKey()).name(),
                            tally.income(),
                            tally.expense(),
                            tally.income().subtract(tally.expense()),
                            tally.count(),
                            Amounts.divideSafe(tally.income().add(tally.expense()), tally.count()),
                            tally.largest(),
                            tally.lastDate()
                    );
                })
                .sorted(Comparator.comparingInt(AccountStatistics::transactionCount).reversed())
                .toList();
    }

    private record AccountTally(BigDecimal income, BigDecimal expense, int count, BigDecimal largest, LocalDate lastDate) {

        static AccountTally of(Transaction tx) {
            return new AccountTally(
                    tx.is(TransactionType.INCOME) ? tx.amount() : BigDecimal.ZERO,
                    tx.is(TransactionType.EXPENSE) ? tx.amount() : BigDecimal.ZERO,
                    1,
                    tx.amount().abs(),
                    tx.localDate().orElse(null)
            );
        }

        AccountTally plus(AccountTally other) {
            LocalDate latest = lastDate;
            if (latest == null || (other.lastDate != null && other.lastDate.isAfter(latest))) {
                latest = other.lastDate;
            }
            return new AccountTally(
                    income.add(other.income),
                    expense.add(other.expense),
                    count + other.count,
                    largest.max(other.largest),
                    latest
            );
        }
    }
}
