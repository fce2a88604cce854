package com.moneytrail.insights.model.report;

import java.math.BigDecimal;
import java.time.LocalDate;

public record PeriodStat(
        String period,
        String periodLabel,
        LocalDate startDate,
        LocalDate endDate,
        BigDecimal income,
        BigDecimal expense,
        BigDecimal net,
        int transactionCount,
        BigDecimal averagePerDay
) {
}
