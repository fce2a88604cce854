package com.moneytrail.insights.model.report;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.math.BigDecimal;

/**
 * Share of income or expense attributed to one category, account or label. {@code icon} is only set for categories.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DimensionSpending(
        String id,
        String name,
        String icon,
        String color,
        BigDecimal amount,
        BigDecimal percentage,
        int transactionCount
) {
}
