package com.moneytrail.insights.analytics;

import com.moneytrail.insights.model.Transaction;
import com.moneytrail.insights.model.TransactionType;
import java.time.LocalDate;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Predicate;
import org.springframework.stereotype.Component;

@Component
public class TransactionFilter {

    private static final Comparator<Transaction> BY_DATE = Comparator.comparing(
            (Transaction tx) -> tx.localDate().orElse(LocalDate.MIN));

    public List<Transaction> filter(List<Transaction> transactions, FilterCriteria criteria) {
        if (transactions == null || transactions.isEmpty()) {
            return List.of();
        }
        if (criteria == null) {
            return List.copyOf(transactions);
        }
        Predicate<Transaction> predicate = typePredicate(criteria)
                .and(accountPredicate(criteria))
                .and(categoryPredicate(criteria))
                .and(datePredicate(criteria))
                .and(amountPredicate(criteria))
                .and(searchPredicate(criteria));
        return transactions.stream()
                .filter(predicate)
                .toList();
    }

    public List<Transaction> byType(List<Transaction> transactions, TransactionType type) {
        return filter(transactions, FilterCriteria.ofType(type));
    }

    /**
     * Stable sort on the calendar date; unparseable dates sort as the oldest.
     */
    public List<Transaction> sortByDate(List<Transaction> transactions, boolean newestFirst) {
        Comparator<Transaction> order = newestFirst ? BY_DATE.reversed() : BY_DATE;
        return transactions.stream()
                .sorted(order)
                .toList();
    }

    public List<Transaction> mostRecent(List<Transaction> transactions, int limit) {
        return sortByDate(transactions, true).stream()
                .limit(Math.max(limit, 0))
                .toList();
    }

    private Predicate<Transaction> typePredicate(FilterCriteria criteria) {
        if (criteria.type() == null) {
            return tx -> true;
        }
        return tx -> tx.is(criteria.type());
    }

    private Predicate<Transaction> accountPredicate(FilterCriteria criteria) {
        if (criteria.accountIds().isEmpty()) {
            return tx -> true;
        }
        return tx -> tx.accountId() != null && criteria.accountIds().contains(tx.accountId());
    }

    private Predicate<Transaction> categoryPredicate(FilterCriteria criteria) {
        if (criteria.categoryIds().isEmpty()) {
            return tx -> true;
        }
        // a split transaction matches through any of its parts, even when its own category does not
        return tx -> (tx.categoryId() != null && criteria.categoryIds().contains(tx.categoryId()))
                || tx.splits().stream()
                .anyMatch(split -> split.categoryId() != null && criteria.categoryIds().contains(split.categoryId()));
    }

    private Predicate<Transaction> datePredicate(FilterCriteria criteria) {
        LocalDate start = criteria.startDate();
        LocalDate end = criteria.endDate();
        if (start == null && end == null) {
            return tx -> true;
        }
        return tx -> {
            Optional<LocalDate> date = tx.localDate();
            if (date.isEmpty()) {
                return false;
            }
            return (start == null || !date.get().isBefore(start))
                    && (end == null || !date.get().isAfter(end));
        };
    }

    private Predicate<Transaction> amountPredicate(FilterCriteria criteria) {
        return tx -> (criteria.minAmount() == null || tx.amount().compareTo(criteria.minAmount()) >= 0)
                && (criteria.maxAmount() == null || tx.amount().compareTo(criteria.maxAmount()) <= 0);
    }

    private Predicate<Transaction> searchPredicate(FilterCriteria criteria) {
        String query = criteria.searchQuery();
        if (query == null || query.isBlank()) {
            return tx -> true;
        }
        String needle = query.toLowerCase(Locale.ROOT);
        return tx -> contains(tx.description(), needle) || contains(tx.itemName(), needle);
    }

    private static boolean contains(String haystack, String needle) {
        return haystack != null && haystack.toLowerCase(Locale.ROOT).contains(needle);
    }
}
