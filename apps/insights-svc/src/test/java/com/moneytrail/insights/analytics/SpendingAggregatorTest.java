package com.moneytrail.insights.analytics;

import static com.moneytrail.insights.support.LedgerFixtures.account;
import static com.moneytrail.insights.support.LedgerFixtures.category;
import static com.moneytrail.insights.support.LedgerFixtures.expense;
import static com.moneytrail.insights.support.LedgerFixtures.income;
import static com.moneytrail.insights.support.LedgerFixtures.labelled;
import static com.moneytrail.insights.support.LedgerFixtures.part;
import static com.moneytrail.insights.support.LedgerFixtures.split;
import static com.moneytrail.insights.support.LedgerFixtures.transaction;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import com.moneytrail.insights.model.Account;
import com.moneytrail.insights.model.AccountType;
import com.moneytrail.insights.model.Budget;
import com.moneytrail.insights.model.BudgetPeriod;
import com.moneytrail.insights.model.Category;
import com.moneytrail.insights.model.Label;
import com.moneytrail.insights.model.Transaction;
import com.moneytrail.insights.model.TransactionType;
import com.moneytrail.insights.model.report.BudgetProgress;
import com.moneytrail.insights.model.report.DimensionSpending;
import com.moneytrail.insights.model.report.InvestmentHolding;
import com.moneytrail.insights.model.report.LedgerSummary;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import org.junit.jupiter.api.Test;

class SpendingAggregatorTest {

    private final SpendingAggregator aggregator = new SpendingAggregator();

    private final List<Transaction> januaryLedger = List.of(
            expense("100", "2024-01-01", "A"),
            expense("50", "2024-01-02", "A"),
            income("200", "2024-01-01"));

    @Test
    void categorySpendingGroupsExpensesOfOneCategory() {
        List<DimensionSpending> spending = aggregator.categorySpending(
                januaryLedger, List.of(category("A", "Groceries")), TransactionType.EXPENSE);

        assertThat(spending).singleElement().satisfies(entry -> {
            assertThat(entry.id()).isEqualTo("A");
            assertThat(entry.name()).isEqualTo("Groceries");
            assertThat(entry.amount()).isEqualByComparingTo("150");
            assertThat(entry.percentage()).isEqualByComparingTo("100");
            assertThat(entry.transactionCount()).isEqualTo(2);
        });
    }

    @Test
    void summaryReportsNetAndSavingsRate() {
        LedgerSummary summary = aggregator.summary(januaryLedger);

        assertThat(summary.totalIncome()).isEqualByComparingTo("200");
        assertThat(summary.totalExpense()).isEqualByComparingTo("150");
        assertThat(summary.net()).isEqualByComparingTo("50");
        assertThat(summary.savingsRate()).isEqualByComparingTo("25");
        assertThat(summary.transactionCount()).isEqualTo(3);
        assertThat(summary.averageTransaction()).isEqualByComparingTo("116.67");
    }

    @Test
    void summaryOfEmptyLedgerIsAllZero() {
        LedgerSummary summary = aggregator.summary(List.of());

        assertThat(summary.savingsRate()).isEqualByComparingTo("0");
        assertThat(summary.averageTransaction()).isEqualByComparingTo("0");
    }

    @Test
    void splitsAreAttributedToPartsWithoutDoubleCounting() {
        List<Transaction> ledger = List.of(
                split("90", "2024-01-03", part("A", "30"), part("B", "60")),
                expense("10", "2024-01-04", "A"));

        List<DimensionSpending> spending = aggregator.categorySpending(ledger, List.of(), TransactionType.EXPENSE);

        assertThat(spending).extracting(DimensionSpending::id).containsExactly("B", "A");
        assertThat(spending.get(0).amount()).isEqualByComparingTo("60");
        assertThat(spending.get(1).amount()).isEqualByComparingTo("40");
        assertThat(spending.get(1).transactionCount()).isEqualTo(2);
        assertThat(spending).extracting(DimensionSpending::id).doesNotContain("parent-category");
        BigDecimal total = spending.stream().map(DimensionSpending::amount).reduce(BigDecimal.ZERO, BigDecimal::add);
        assertThat(total).isEqualByComparingTo("100");
    }

    @Test
    void percentagesSumToOneHundredWithinACent() {
        List<Transaction> ledger = List.of(
                expense("10", "2024-01-01", "A"),
                expense("10", "2024-01-01", "B"),
                expense("10", "2024-01-01", "C"));

        List<DimensionSpending> spending = aggregator.categorySpending(ledger, List.of(), TransactionType.EXPENSE);

        double sum = spending.stream().mapToDouble(entry -> entry.percentage().doubleValue()).sum();
        assertThat(sum).isCloseTo(100.0, within(0.01));
    }

    @Test
    void zeroTotalsGiveZeroPercentages() {
        List<DimensionSpending> spending = aggregator.categorySpending(
                List.of(expense("0", "2024-01-01", "A")), List.of(), TransactionType.EXPENSE);

        assertThat(spending).singleElement()
                .satisfies(entry -> assertThat(entry.percentage()).isEqualByComparingTo("0"));
    }

    @Test
    void danglingReferencesResolveToPlaceholders() {
        Transaction tx = labelled(expense("20", "2024-01-01", "ghost"), "lost-label");

        assertThat(aggregator.categorySpending(List.of(tx), List.of(), TransactionType.EXPENSE))
                .singleElement()
                .satisfies(entry -> {
                    assertThat(entry.name()).isEqualTo(Category.UNCATEGORIZED_NAME);
                    assertThat(entry.icon()).isEqualTo(Category.PLACEHOLDER_ICON);
                    assertThat(entry.color()).isEqualTo(Category.PLACEHOLDER_COLOR);
                });
        assertThat(aggregator.accountSpending(List.of(tx), List.of(), TransactionType.EXPENSE))
                .singleElement()
                .satisfies(entry -> assertThat(entry.name()).isEqualTo(Account.UNKNOWN_NAME));
        assertThat(aggregator.labelSpending(List.of(tx), List.of(), TransactionType.EXPENSE))
                .singleElement()
                .satisfies(entry -> assertThat(entry.name()).isEqualTo(Label.UNKNOWN_NAME));
    }

    @Test
    void accountAndLabelSpendingUseWholeAmounts() {
        Transaction splitTx = labelled(split("90", "2024-01-03", part("A", "30"), part("B", "60")), "trip", "family");
        Transaction other = transaction(TransactionType.EXPENSE, "10", "2024-01-03", "A", "acc-card");
        List<Account> accounts = List.of(account("acc-main", "Main", "0"), account("acc-card", "Card", "0"));

        List<DimensionSpending> byAccount = aggregator.accountSpending(List.of(splitTx, other), accounts, TransactionType.EXPENSE);
        List<DimensionSpending> byLabel = aggregator.labelSpending(List.of(splitTx, other), List.of(), TransactionType.EXPENSE);

        assertThat(byAccount).extracting(DimensionSpending::name).containsExactly("Main", "Card");
        assertThat(byAccount.get(0).amount()).isEqualByComparingTo("90");
        assertThat(byAccount.get(0).icon()).isNull();
        assertThat(byLabel).extracting(DimensionSpending::id).containsExactly("trip", "family");
        assertThat(byLabel).allSatisfy(entry -> assertThat(entry.amount()).isEqualByComparingTo("90"));
    }

    @Test
    void budgetProgressReportsSpentRemainingAndPercentage() {
        Budget budget = new Budget("b1", "Food", "A", new BigDecimal("100"), BudgetPeriod.MONTHLY, "2024-01-01", null, "#00ff00");
        List<Transaction> ledger = List.of(
                expense("60", "2024-01-10", "A"),
                split("50", "2024-01-20", part("A", "30"), part("B", "20")),
                expense("500", "2024-02-02", "A"),
                expense("40", "2024-01-11", "B"));

        BudgetProgress progress = aggregator.budgetProgress(List.of(budget), ledger).get(0);

        assertThat(progress.spent()).isEqualByComparingTo("90");
        assertThat(progress.percentage()).isEqualByComparingTo("90");
        assertThat(progress.remaining()).isEqualByComparingTo("10");
        assertThat(progress.exceeded()).isFalse();
        assertThat(progress.periodEnd()).isEqualTo(LocalDate.of(2024, 1, 31));
    }

    @Test
    void overallBudgetCountsFullAmountsAndFlagsOverspend() {
        Budget budget = new Budget("b2", "Everything", null, new BigDecimal("100"), BudgetPeriod.WEEKLY, "2024-01-01", null, null);
        List<Transaction> ledger = List.of(
                split("80", "2024-01-02", part("A", "30"), part("B", "50")),
                expense("20.02", "2024-01-07", "C"));

        BudgetProgress progress = aggregator.budgetProgress(List.of(budget), ledger).get(0);

        assertThat(progress.spent()).isEqualByComparingTo("100.02");
        assertThat(progress.exceeded()).isTrue();
    }

    @Test
    void openEndedBudgetStopsBeforeTheNextPeriodStarts() {
        Budget weekly = new Budget("w", "Weekly", null, new BigDecimal("100"), BudgetPeriod.WEEKLY, "2024-01-01", null, null);
        Budget monthly = new Budget("m", "Monthly", null, new BigDecimal("100"), BudgetPeriod.MONTHLY, "2024-01-01", null, null);
        List<Transaction> ledger = List.of(
                expense("40", "2024-01-08", "A"),
                expense("15", "2024-02-01", "A"));

        List<BudgetProgress> progress = aggregator.budgetProgress(List.of(weekly, monthly), ledger);

        assertThat(progress.get(0).periodEnd()).isEqualTo(LocalDate.of(2024, 1, 7));
        assertThat(progress.get(0).spent()).isEqualByComparingTo("0");
        assertThat(progress.get(1).periodEnd()).isEqualTo(LocalDate.of(2024, 1, 31));
        assertThat(progress.get(1).spent()).isEqualByComparingTo("40");
    }

    @Test
    void budgetOverByLessThanACentIsNotExceeded() {
        Budget budget = new Budget("b3", "Food", "A", new BigDecimal("100"), BudgetPeriod.MONTHLY, "2024-01-01", "2024-01-31", null);

        BudgetProgress progress = aggregator.budgetProgress(List.of(budget), List.of(expense("100.005", "2024-01-05", "A"))).get(0);

        assertThat(progress.exceeded()).isFalse();
    }

    @Test
    void investmentPortfolioOnlyListsInvestmentAccounts() {
        List<Account> accounts = List.of(
                new Account("fd", "Bank FD", AccountType.FIXED_DEPOSIT, new BigDecimal("3000"), null),
                new Account("wallet", "Wallet", AccountType.CASH, new BigDecimal("500"), null),
                new Account("mf", "Index Fund", AccountType.MUTUAL_FUND, new BigDecimal("1000"), null));

        List<InvestmentHolding> holdings = aggregator.investmentPortfolio(accounts);

        assertThat(holdings).extracting(InvestmentHolding::accountId).containsExactly("fd", "mf");
        assertThat(holdings.get(0).percentage()).isEqualByComparingTo("75");
        assertThat(holdings.get(1).percentage()).isEqualByComparingTo("25");
    }
}
