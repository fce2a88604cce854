package com.moneytrail.insights.model.report;

import java.math.BigDecimal;

public record PlannedPaymentMonth(
        String month,
        String monthLabel,
        BigDecimal totalAmount,
        int pendingCount,
        int completedCount
) {
}
