package com.moneytrail.insights.model;

import java.math.BigDecimal;

public record PlannedTransaction(
        String id,
        String accountId,
        String categoryId,
        TransactionType type,
        BigDecimal amount,
        String description,
        String scheduledDate,
        String nextOccurrenceDate,
        String lastCreatedDate,
        Recurrence recurrence,
        String endDate,
        PlannedStatus status
) {
    public PlannedTransaction {
        amount = Amounts.orZero(amount);
        recurrence = recurrence == null ? Recurrence.NONE : recurrence;
    }
}
