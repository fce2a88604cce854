package com.moneytrail.insights.model.report;

import com.moneytrail.insights.model.TransactionType;
import java.math.BigDecimal;
import java.time.LocalDate;

public record DuePlannedTransaction(
        String plannedTransactionId,
        String description,
        TransactionType type,
        BigDecimal amount,
        LocalDate dueDate,
        LocalDate followingOccurrence
) {
}
