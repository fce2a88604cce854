package com.moneytrail.insights.model.report;

import java.util.List;

public record DashboardStatistics(
        SpendingVelocity spendingVelocity,
        TransactionFrequency transactionFrequency,
        List<CategoryPerformance> topCategories,
        List<AccountStatistics> accountStats,
        List<PeriodStat> dailyStats,
        List<PeriodStat> weeklyStats,
        List<PeriodStat> monthlyStats,
        List<String> insights
) {
}
