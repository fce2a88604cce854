package com.moneytrail.insights.model.report;

import java.math.BigDecimal;
import java.time.LocalDate;

public record YearOverYearComparison(
        Window currentWindow,
        Window previousWindow,
        PeriodTotals currentPeriod,
        PeriodTotals previousPeriod,
        Changes changes
) {
    public record Window(LocalDate startDate, LocalDate endDate) {
    }

    public record PeriodTotals(BigDecimal income, BigDecimal expense, BigDecimal net, int transactionCount) {
    }

    public record Changes(
            BigDecimal incomeChange,
            BigDecimal expenseChange,
            BigDecimal netChange,
            BigDecimal incomeChangePercent,
            BigDecimal expenseChangePercent,
            BigDecimal netChangePercent
    ) {
    }
}
