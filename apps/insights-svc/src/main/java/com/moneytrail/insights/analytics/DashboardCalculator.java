package com.moneytrail.insights.analytics;

import com.moneytrail.insights.config.MoneytrailProperties;
import com.moneytrail.insights.model.Account;
import com.moneytrail.insights.model.Category;
import com.moneytrail.insights.model.Granularity;
import com.moneytrail.insights.model.Transaction;
import com.moneytrail.insights.model.report.AccountStatistics;
import com.moneytrail.insights.model.report.CategoryPerformance;
import com.moneytrail.insights.model.report.DashboardStatistics;
import com.moneytrail.insights.model.report.PeriodStat;
import com.moneytrail.insights.model.report.SpendingVelocity;
import com.moneytrail.insights.model.report.TransactionFrequency;
import java.time.LocalDate;
import java.util.List;
import org.springframework.stereotype.Component;

@Component
public class DashboardCalculator {

    private final TrendAnalyzer trendAnalyzer;
    private final PeriodStatisticsCalculator periodStatistics;
    private final InsightGenerator insightGenerator;
    private final MoneytrailProperties.Dashboard limits;

    public DashboardCalculator(
            TrendAnalyzer trendAnalyzer,
            PeriodStatisticsCalculator periodStatistics,
            InsightGenerator insightGenerator,
            MoneytrailProperties properties
    ) {
        this.trendAnalyzer = trendAnalyzer;
        this.periodStatistics = periodStatistics;
        this.insightGenerator = insightGenerator;
        this.limits = properties.dashboard();
    }

    public DashboardStatistics compose(
            List<Transaction> transactions,
            List<Account> accounts,
            List<Category> categories,
            LocalDate startDate,
            LocalDate endDate
    ) {
        SpendingVelocity velocity = trendAnalyzer.spendingVelocity(transactions, startDate, endDate);
        TransactionFrequency frequency = trendAnalyzer.transactionFrequency(transactions, startDate, endDate);
        List<CategoryPerformance> categoryPerformance = trendAnalyzer.categoryPerformance(transactions, categories, startDate, endDate);
        List<AccountStatistics> accountStatistics = trendAnalyzer.accountStatistics(transactions, accounts);

        // insights look at the full ranking, the response only carries the head of it
        List<String> insights = insightGenerator.generate(transactions, velocity, categoryPerformance, accountStatistics);
        return new DashboardStatistics(
                velocity,
                frequency,
                head(categoryPerformance, limits.topCategories()),
                head(accountStatistics, limits.topAccounts()),
                tail(periodStatistics.bucketize(transactions, startDate, endDate, Granularity.DAILY), limits.dailyBuckets()),
                tail(periodStatistics.bucketize(transactions, startDate, endDate, Granularity.WEEKLY), limits.weeklyBuckets()),
                tail(periodStatistics.bucketize(transactions, startDate, endDate, Granularity.MONTHLY), limits.monthlyBuckets()),
                insights
        );
    }

    private static <T> List<T> head(List<T> items, int limit) {
        return items.size() <= limit ? items : List.copyOf(items.subList(0, limit));
    }

    private static List<PeriodStat> tail(List<PeriodStat> items, int limit) {
        return items.size() <= limit ? items : List.copyOf(items.subList(items.size() - limit, items.size()));
    }
}
