package com.moneytrail.insights.model.report;

import java.math.BigDecimal;
import java.time.LocalDate;

public record BudgetProgress(
        String budgetId,
        String budgetName,
        String categoryId,
        BigDecimal budgetAmount,
        BigDecimal spent,
        BigDecimal remaining,
        BigDecimal percentage,
        boolean exceeded,
        String color,
        LocalDate periodStart,
        LocalDate periodEnd
) {
}
