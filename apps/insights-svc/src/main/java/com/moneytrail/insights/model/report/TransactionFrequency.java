package com.moneytrail.insights.model.report;

import java.math.BigDecimal;

public record TransactionFrequency(
        int totalTransactions,
        BigDecimal averagePerDay,
        BigDecimal averagePerWeek,
        BigDecimal averagePerMonth,
        String mostActiveDay,
        int mostActiveDayCount
) {
}
