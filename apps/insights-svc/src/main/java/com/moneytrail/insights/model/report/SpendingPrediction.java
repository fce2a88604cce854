package com.moneytrail.insights.model.report;

import java.math.BigDecimal;

public record SpendingPrediction(
        String period,
        String periodLabel,
        BigDecimal predictedIncome,
        BigDecimal predictedExpense,
        BigDecimal predictedNet,
        Confidence confidence
) {
}
