package com.moneytrail.insights.model.report;

import java.math.BigDecimal;
import java.util.List;

public record CategoryTrend(
        String categoryId,
        String categoryName,
        String categoryIcon,
        String categoryColor,
        List<PeriodAmount> periods,
        BigDecimal totalAmount,
        BigDecimal averageAmount,
        Trend trend,
        BigDecimal changePercent
) {
    public record PeriodAmount(String period, String periodLabel, BigDecimal amount) {
    }
}
