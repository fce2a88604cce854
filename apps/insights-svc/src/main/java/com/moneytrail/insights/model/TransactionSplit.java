package com.moneytrail.insights.model;

import java.math.BigDecimal;

public record TransactionSplit(String id, String categoryId, BigDecimal amount, String description) {

    public TransactionSplit {
        amount = Amounts.orZero(amount);
    }
}
