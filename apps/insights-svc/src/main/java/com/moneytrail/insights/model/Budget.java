package com.moneytrail.insights.model;

import java.math.BigDecimal;

/**
 * A spending limit. A null {@code categoryId} makes it an overall budget; a null {@code endDate} means one
 * {@code period} after {@code startDate}.
 */
public record Budget(
        String id,
        String name,
        String categoryId,
        BigDecimal amount,
        BudgetPeriod period,
        String startDate,
        String endDate,
        String color
) {
    public Budget {
        amount = Amounts.orZero(amount);
        period = period == null ? BudgetPeriod.MONTHLY : period;
    }

    public boolean overall() {
        return categoryId == null || categoryId.isBlank();
    }
}
