package com.moneytrail.insights.analytics;

import com.moneytrail.insights.model.Account;
import com.moneytrail.insights.model.Amounts;
import com.moneytrail.insights.model.Budget;
import com.moneytrail.insights.model.Category;
import com.moneytrail.insights.model.CategoryAllocation;
import com.moneytrail.insights.model.Label;
import com.moneytrail.insights.model.LedgerDates;
import com.moneytrail.insights.model.Transaction;
import com.moneytrail.insights.model.TransactionType;
import com.moneytrail.insights.model.report.BudgetProgress;
import com.moneytrail.insights.model.report.DimensionSpending;
import com.moneytrail.insights.model.report.InvestmentHolding;
import com.moneytrail.insights.model.report.LedgerSummary;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Grouped totals over a ledger. Category totals follow each transaction's {@link CategoryAllocation}; account and
 * label totals always use the whole transaction amount.
 */
@Component
public class SpendingAggregator {

    private static final Logger log = LoggerFactory.getLogger(SpendingAggregator.class);

    public List<DimensionSpending> categorySpending(List<Transaction> transactions, List<Category> categories, TransactionType type) {
        Map<String, Tally> tallies = new LinkedHashMap<>();
        int unbalanced = 0;
        for (Transaction tx : transactions) {
            if (!tx.is(type)) {
                continue;
            }
            if (!tx.hasBalancedSplits()) {
                unbalanced++;
            }
            for (CategoryAllocation.Share share : tx.allocation().shares()) {
                tallies.merge(share.categoryId(), Tally.of(share.amount()), Tally::plus);
            }
        }
        if (unbalanced > 0) {
            log.debug("Category spending: {} split transaction(s) whose parts do not add up to the amount", unbalanced);
        }
        Function<String, Category> resolve = lookup(categories, Category::id, Category::placeholder);
        return toSpending(tallies, id -> {
            Category category = resolve.apply(id);
            return new Dimension(category.name(), category.icon(), category.color());
        });
    }

    public List<DimensionSpending> accountSpending(List<Transaction> transactions, List<Account> accounts, TransactionType type) {
        Map<String, Tally> tallies = new LinkedHashMap<>();
        for (Transaction tx : transactions) {
            if (tx.is(type)) {
                tallies.merge(tx.accountId(), Tally.of(tx.amount()), Tally::plus);
            }
        }
        Function<String, Account> resolve = lookup(accounts, Account::id, Account::placeholder);
        return toSpending(tallies, id -> {
            Account account = resolve.apply(id);
            return new Dimension(account.name(), null, account.color());
        });
    }

    public List<DimensionSpending> labelSpending(List<Transaction> transactions, List<Label> labels, TransactionType type) {
        Map<String, Tally> tallies = new LinkedHashMap<>();
        for (Transaction tx : transactions) {
            if (!tx.is(type)) {
                continue;
            }
            for (String labelId : tx.labels()) {
                tallies.merge(labelId, Tally.of(tx.amount()), Tally::plus);
            }
        }
        Function<String, Label> resolve = lookup(labels, Label::id, Label::placeholder);
        return toSpending(tallies, id -> {
            Label label = resolve.apply(id);
            return new Dimension(label.name(), null, label.color());
        });
    }

    public LedgerSummary summary(List<Transaction> transactions) {
        BigDecimal income = total(transactions, TransactionType.INCOME);
        BigDecimal expense = total(transactions, TransactionType.EXPENSE);
        BigDecimal transfer = total(transactions, TransactionType.TRANSFER);
        BigDecimal net = income.subtract(expense);
        BigDecimal savingsRate = Amounts.percentOf(net, income);
        return new LedgerSummary(
                income,
                expense,
                transfer,
                net,
                savingsRate,
                transactions.size(),
                Amounts.divideSafe(income.add(expense), transactions.size())
        );
    }

    /**
     * Expense against each budget's window. Category budgets count only the matching split parts; overall budgets
     * count whole amounts.
     */
    public List<BudgetProgress> budgetProgress(List<Budget> budgets, List<Transaction> transactions) {
        return budgets.stream()
                .map(budget -> budgetProgress(budget, transactions))
                .toList();
    }

    private BudgetProgress budgetProgress(Budget budget, List<Transaction> transactions) {
        Optional<LocalDate> start = LedgerDates.parse(budget.startDate());
        Optional<LocalDate> end = LedgerDates.parse(budget.endDate())
                .or(() -> start.map(date -> CalendarPeriods.budgetPeriodEnd(date, budget.period())));

        BigDecimal spent = BigDecimal.ZERO;
        if (start.isPresent() && end.isPresent()) {
            for (Transaction tx : transactions) {
                if (!tx.is(TransactionType.EXPENSE)) {
                    continue;
                }
                Optional<LocalDate> date = tx.localDate();
                if (date.isEmpty() || !LedgerDates.within(date.get(), start.get(), end.get())) {
                    continue;
                }
                spent = spent.add(budget.overall() ? tx.amount() : tx.allocation().amountFor(budget.categoryId()));
            }
        } else {
            log.debug("Budget {} has no usable start date '{}', reporting zero spend", budget.id(), budget.startDate());
        }

        BigDecimal remaining = budget.amount().subtract(spent);
        boolean exceeded = remaining.compareTo(Amounts.AMOUNT_EPSILON.negate()) < 0;
        return new BudgetProgress(
                budget.id(),
                budget.name(),
                budget.categoryId(),
                budget.amount(),
                spent,
                remaining,
                Amounts.percentOf(spent, budget.amount()),
                exceeded,
                budget.color(),
                start.orElse(null),
                end.orElse(null)
        );
    }

    public List<InvestmentHolding> investmentPortfolio(List<Account> accounts) {
        List<Account> investments = accounts.stream()
                .filter(account -> account.type().investment())
                .toList();
        BigDecimal total = Amounts.sum(investments, Account::balance);
        return investments.stream()
                .map(account -> new InvestmentHolding(
                        account.id(),
                        account.name(),
                        account.type(),
                        account.balance(),
                        Amounts.percentOf(account.balance(), total)))
                .sorted(Comparator.comparing(InvestmentHolding::balance).reversed())
                .toList();
    }

    static BigDecimal total(List<Transaction> transactions, TransactionType type) {
        return transactions.stream()
                .filter(tx -> tx.is(type))
                .map(Transaction::amount)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    static <T> Function<String, T> lookup(List<T> entities, Function<T, String> id, Function<String, T> placeholder) {
        Map<String, T> byId = entities.stream()
                .filter(entity -> id.apply(entity) != null)
                .collect(Collectors.toMap(id, Function.identity(), (first, duplicate) -> first));
        return key -> {
            T found = key == null ? null : byId.get(key);
            return found != null ? found : placeholder.apply(key);
        };
    }

    private static List<DimensionSpending> toSpending(Map<String, Tally> tallies, Function<String, Dimension> describe) {
        BigDecimal total = tallies.values().stream()
                .map(Tally::amount)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        return tallies.entrySet().stream()
                .map(entry -> {
                    Dimension dimension = describe.apply(entry.getKey());
                    Tally tally = entry.getValue();
                    return new DimensionSpending(
                            entry.getKey(),
                            dimension.name(),
                            dimension.icon(),
                            dimension.color(),
                            tally.amount(),
                            Amounts.percentOf(tally.amount(), total),
                            tally.count());
                })
                .sorted(Comparator.comparing(DimensionSpending::amount).reversed())
                .toList();
    }

    private record Tally(BigDecimal amount, int count) {

        static Tally of(BigDecimal amount) {
            return new Tally(amount, 1);
        }

        Tally plus(Tally other) {
            return new Tally(amount.add(other.amount), count + other.count);
        }
    }

    private record Dimension(String name, String icon, String color) {
    }
}
