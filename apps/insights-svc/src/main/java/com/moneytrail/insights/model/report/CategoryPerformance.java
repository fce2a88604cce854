package com.moneytrail.insights.model.report;

import java.math.BigDecimal;
import java.time.LocalDate;

public record CategoryPerformance(
        String categoryId,
        String categoryName,
        String categoryIcon,
        String categoryColor,
        BigDecimal totalSpent,
        int transactionCount,
        BigDecimal averageAmount,
        BigDecimal largestTransaction,
        BigDecimal smallestTransaction,
        LocalDate lastTransactionDate,
        Trend trend
) {
}
