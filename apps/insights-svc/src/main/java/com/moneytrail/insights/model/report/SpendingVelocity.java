package com.moneytrail.insights.model.report;

import java.math.BigDecimal;

public record SpendingVelocity(
        BigDecimal dailyAverage,
        BigDecimal weeklyAverage,
        BigDecimal monthlyAverage,
        Trend trend,
        BigDecimal changePercent
) {
}
