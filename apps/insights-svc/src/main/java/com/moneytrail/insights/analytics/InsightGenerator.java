package com.moneytrail.insights.analytics;

import com.moneytrail.insights.model.Amounts;
import com.moneytrail.insights.model.Transaction;
import com.moneytrail.insights.model.TransactionType;
import com.moneytrail.insights.model.report.AccountStatistics;
import com.moneytrail.insights.model.report.CategoryPerformance;
import com.moneytrail.insights.model.report.SpendingVelocity;
import com.moneytrail.insights.model.report.Trend;
import java.math.BigDecimal;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Stream;
import org.springframework.stereotype.Component;

/**
 * Turns computed statistics into short sentences. Rules are evaluated in a fixed order and the result is cut at
 * {@link #MAX_INSIGHTS}.
 */
@Component
public class InsightGenerator {

    public static final int MAX_INSIGHTS = 5;

    static final BigDecimal VELOCITY_CHANGE_PERCENT = BigDecimal.TEN;
    static final BigDecimal TOP_CATEGORY_SHARE_PERCENT = BigDecimal.valueOf(40);
    static final BigDecimal LARGE_EXPENSE_FACTOR = BigDecimal.valueOf(2);
    static final BigDecimal HEALTHY_SAVINGS_PERCENT = BigDecimal.valueOf(20);

    public List<String> generate(
            List<Transaction> transactions,
            SpendingVelocity velocity,
            List<CategoryPerformance> categoryPerformance,
            List<AccountStatistics> accountStatistics
    ) {
        return Stream.of(
                        velocityInsight(velocity),
                        topCategoryInsight(categoryPerformance),
                        busiestAccountInsight(accountStatistics),
                        largeExpenseInsight(transactions),
                        savingsInsight(transactions)
                )
                .flatMap(Optional::stream)
                .limit(MAX_INSIGHTS)
                .toList();
    }

    Optional<String> velocityInsight(SpendingVelocity velocity) {
        if (velocity == null) {
            return Optional.empty();
        }
        BigDecimal change = velocity.changePercent();
        if (velocity.trend() == Trend.INCREASING && change.compareTo(VELOCITY_CHANGE_PERCENT) > 0) {
            return Optional.of("Your spending has increased by " + oneDecimal(change) + "% - consider reviewing your expenses");
        }
        if (velocity.trend() == Trend.DECREASING && change.compareTo(VELOCITY_CHANGE_PERCENT.negate()) < 0) {
            return Optional.of("Great! Your spending has decreased by " + oneDecimal(change.abs()) + "%");
        }
        return Optional.empty();
    }

    Optional<String> topCategoryInsight(List<CategoryPerformance> categoryPerformance) {
        if (categoryPerformance.isEmpty()) {
            return Optional.empty();
        }
        CategoryPerformance top = categoryPerformance.get(0);
        BigDecimal share = Amounts.percentOf(top.totalSpent(), Amounts.sum(categoryPerformance, CategoryPerformance::totalSpent));
        if (top.totalSpent().signum() <= 0 || share.compareTo(TOP_CATEGORY_SHARE_PERCENT) <= 0) {
            return Optional.empty();
        }
        return Optional.of(top.categoryName() + " accounts for " + oneDecimal(share) + "% of your spending");
    }

    Optional<String> busiestAccountInsight(List<AccountStatistics> accountStatistics) {
        if (accountStatistics.size() <= 1) {
            return Optional.empty();
        }
        AccountStatistics busiest = accountStatistics.get(0);
        return Optional.of("Most transactions (" + busiest.transactionCount() + ") are from " + busiest.accountName());
    }

    Optional<String> largeExpenseInsight(List<Transaction> transactions) {
        List<Transaction> expenses = transactions.stream().filter(tx -> tx.is(TransactionType.EXPENSE)).toList();
        if (expenses.isEmpty()) {
            return Optional.empty();
        }
        BigDecimal threshold = Amounts.precise(Amounts.sum(expenses, Transaction::amount), BigDecimal.valueOf(expenses.size()))
                .multiply(LARGE_EXPENSE_FACTOR);
        long large = expenses.stream().filter(tx -> tx.amount().compareTo(threshold) > 0).count();
        if (large == 0) {
            return Optional.empty();
        }
        return Optional.of("You have " + large + " large transaction" + (large == 1 ? "" : "s") + " above average");
    }

    Optional<String> savingsInsight(List<Transaction> transactions) {
        BigDecimal income = SpendingAggregator.total(transactions, TransactionType.INCOME);
        if (income.signum() <= 0) {
            return Optional.empty();
        }
        BigDecimal expense = SpendingAggregator.total(transactions, TransactionType.EXPENSE);
        BigDecimal savingsRate = Amounts.percentOf(income.subtract(expense), income);
        if (savingsRate.compareTo(HEALTHY_SAVINGS_PERCENT) > 0) {
            return Optional.of("Excellent! You're saving " + oneDecimal(savingsRate) + "% of your income");
        }
        if (savingsRate.signum() < 0) {
            return Optional.of("You're spending more than you earn - consider reviewing your budget");
        }
        return Optional.empty();
    }

    private static String oneDecimal(BigDecimal value) {
        return String.format(Locale.ENGLISH, "%.1f", value);
    }
}
