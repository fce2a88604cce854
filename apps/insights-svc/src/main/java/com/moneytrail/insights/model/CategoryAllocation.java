package com.moneytrail.insights.model;

import java.math.BigDecimal;
import java.util.List;

/**
 * How a transaction's amount is attributed to categories: wholly to its own category, or across its splits.
 * Only category attribution is affected; accounts and labels always see the transaction amount.
 */
public sealed interface CategoryAllocation permits CategoryAllocation.Atomic, CategoryAllocation.Split {

    static CategoryAllocation of(Transaction transaction) {
        if (!transaction.isSplit()) {
            return new Atomic(transaction.categoryId(), transaction.amount());
        }
        return new Split(transaction.splits().stream()
                .map(split -> new Share(split.categoryId(), split.amount()))
                .toList());
    }

    default List<Share> shares() {
        if (this instanceof Atomic atomic) {
            return List.of(new Share(atomic.categoryId(), atomic.amount()));
        }
        if (this instanceof Split split) {
            return split.parts();
        }
        throw new IllegalStateException("Unsupported allocation " + this);
    }

    default BigDecimal amountFor(String categoryId) {
        return shares().stream()
                .filter(share -> share.categoryId() != null && share.categoryId().equals(categoryId))
                .map(Share::amount)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    record Atomic(String categoryId, BigDecimal amount) implements CategoryAllocation {
    }

    record Split(List<Share> parts) implements CategoryAllocation {
        public Split {
            parts = List.copyOf(parts);
        }

        public BigDecimal total() {
            return parts.stream().map(Share::amount).reduce(BigDecimal.ZERO, BigDecimal::add);
        }
    }

    record Share(String categoryId, BigDecimal amount) {
        public Share {
            amount = Amounts.orZero(amount);
        }
    }
}
