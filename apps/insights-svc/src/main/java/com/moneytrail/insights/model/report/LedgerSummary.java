package com.moneytrail.insights.model.report;

import java.math.BigDecimal;

public record LedgerSummary(
        BigDecimal totalIncome,
        BigDecimal totalExpense,
        BigDecimal totalTransfer,
        BigDecimal net,
        BigDecimal savingsRate,
        int transactionCount,
        BigDecimal averageTransaction
) {
}
