package com.moneytrail.insights.model;

import static com.moneytrail.insights.support.LedgerFixtures.expense;
import static com.moneytrail.insights.support.LedgerFixtures.part;
import static com.moneytrail.insights.support.LedgerFixtures.split;
import static org.assertj.core.api.Assertions.assertThat;

import java.math.BigDecimal;
import java.time.LocalDate;
import org.junit.jupiter.api.Test;

class TransactionTest {

    @Test
    void atomicTransactionAllocatesWholeAmountToItsCategory() {
        Transaction tx = expense("42.50", "2024-03-01", "food");

        assertThat(tx.allocation()).isInstanceOf(CategoryAllocation.Atomic.class);
        assertThat(tx.allocation().shares()).singleElement()
                .satisfies(share -> {
                    assertThat(share.categoryId()).isEqualTo("food");
                    assertThat(share.amount()).isEqualByComparingTo("42.50");
                });
        assertThat(tx.hasBalancedSplits()).isTrue();
    }

    @Test
    void splitTransactionAllocatesOnlyToItsParts() {
        Transaction tx = split("100", "2024-03-01", part("food", "60"), part("home", "40"));

        assertThat(tx.isSplit()).isTrue();
        assertThat(tx.allocation()).isInstanceOf(CategoryAllocation.Split.class);
        assertThat(tx.allocation().amountFor("food")).isEqualByComparingTo("60");
        assertThat(tx.allocation().amountFor("parent-category")).isEqualByComparingTo("0");
        assertThat(tx.hasBalancedSplits()).isTrue();
    }

    @Test
    void splitsOffByMoreThanACentAreUnbalanced() {
        Transaction withinTolerance = split("100", "2024-03-01", part("food", "60"), part("home", "39.995"));
        Transaction offByTwoCents = split("100", "2024-03-01", part("food", "60"), part("home", "39.98"));

        assertThat(withinTolerance.hasBalancedSplits()).isTrue();
        assertThat(offByTwoCents.hasBalancedSplits()).isFalse();
    }

    @Test
    void datesAreParsedFailSoft() {
        assertThat(expense("1", "2024-02-29", "food").localDate()).contains(LocalDate.of(2024, 2, 29));
        assertThat(expense("1", "2024-02-29T10:15:00Z", "food").localDate()).contains(LocalDate.of(2024, 2, 29));
        assertThat(expense("1", "2023-02-29", "food").localDate()).isEmpty();
        assertThat(expense("1", "not a date", "food").localDate()).isEmpty();
    }

    @Test
    void missingAmountAndListsDefaultToEmpty() {
        Transaction tx = new Transaction("t", "a", null, "c", TransactionType.EXPENSE, null, "2024-01-01",
                null, null, null, null, null, null);

        assertThat(tx.amount()).isEqualByComparingTo(BigDecimal.ZERO);
        assertThat(tx.splits()).isEmpty();
        assertThat(tx.labels()).isEmpty();
    }
}
