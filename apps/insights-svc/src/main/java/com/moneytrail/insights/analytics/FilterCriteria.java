package com.moneytrail.insights.analytics;

import com.moneytrail.insights.model.TransactionType;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Set;

/**
 * Optional constraints on a ledger; a null field does not constrain. A null {@code type} means every type.
 */
public record FilterCriteria(
        TransactionType type,
        Set<String> accountIds,
        Set<String> categoryIds,
        LocalDate startDate,
        LocalDate endDate,
        BigDecimal minAmount,
        BigDecimal maxAmount,
        String searchQuery
) {
    public FilterCriteria {
        accountIds = accountIds == null ? Set.of() : Set.copyOf(accountIds);
        categoryIds = categoryIds == null ? Set.of() : Set.copyOf(categoryIds);
    }

    public static FilterCriteria none() {
        return new FilterCriteria(null, null, null, null, null, null, null, null);
    }

    public static FilterCriteria ofType(TransactionType type) {
        return new FilterCriteria(type, null, null, null, null, null, null, null);
    }
}
