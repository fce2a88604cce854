package com.moneytrail.insights.model.report;

import java.math.BigDecimal;
import java.time.LocalDate;

public record AccountStatistics(
        String accountId,
        String accountName,
        BigDecimal totalIncome,
        BigDecimal totalExpense,
        BigDecimal netFlow,
        int transactionCount,
        BigDecimal averageTransaction,
        BigDecimal largestTransaction,
        LocalDate lastTransactionDate
) {
}
