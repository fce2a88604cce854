package com.moneytrail.insights.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * A ledger entry. {@code date} is kept as the ISO string it arrived with; see {@link #localDate()}.
 * {@code toAccountId}, {@code time}, {@code itemName} and {@code status} may be null.
 */
public record Transaction(
        String id,
        String accountId,
        String toAccountId,
        String categoryId,
        TransactionType type,
        BigDecimal amount,
        String date,
        String time,
        String description,
        String itemName,
        List<TransactionSplit> splits,
        List<String> labels,
        TransactionStatus status
) {
    public Transaction {
        amount = Amounts.orZero(amount);
        splits = splits == null ? List.of() : List.copyOf(splits);
        labels = labels == null ? List.of() : List.copyOf(labels);
    }

    public Optional<LocalDate> localDate() {
        return LedgerDates.parse(date);
    }

    public boolean is(TransactionType expected) {
        return type == expected;
    }

    public CategoryAllocation allocation() {
        return CategoryAllocation.of(this);
    }

    @JsonIgnore
    public boolean isSplit() {
        return !splits.isEmpty();
    }

    /**
     * True for atomic transactions, and for split ones whose parts add up to the amount within {@link Amounts#AMOUNT_EPSILON}.
     */
    @JsonIgnore
    public boolean hasBalancedSplits() {
        if (allocation() instanceof CategoryAllocation.Split split) {
            return Amounts.approximatelyEqual(split.total(), amount);
        }
        return true;
    }
}
