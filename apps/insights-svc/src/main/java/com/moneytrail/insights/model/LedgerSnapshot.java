package com.moneytrail.insights.model;

import java.math.BigDecimal;
import java.util.List;

/**
 * Everything one report computation reads. Lists are never null.
 */
public record LedgerSnapshot(
        List<Transaction> transactions,
        List<Account> accounts,
        List<Category> categories,
        List<Label> labels,
        List<Budget> budgets,
        List<PlannedTransaction> plannedTransactions
) {
    public LedgerSnapshot {
        transactions = transactions == null ? List.of() : List.copyOf(transactions);
        accounts = accounts == null ? List.of() : List.copyOf(accounts);
        categories = categories == null ? List.of() : List.copyOf(categories);
        labels = labels == null ? List.of() : List.copyOf(labels);
        budgets = budgets == null ? List.of() : List.copyOf(budgets);
        plannedTransactions = plannedTransactions == null ? List.of() : List.copyOf(plannedTransactions);
    }

    public BigDecimal totalBalance() {
        return Amounts.sum(accounts, Account::balance);
    }
}
