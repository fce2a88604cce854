package com.moneytrail.insights.analytics;

import static org.assertj.core.api.Assertions.assertThat;

import com.moneytrail.insights.model.BudgetPeriod;
import com.moneytrail.insights.model.Granularity;
import com.moneytrail.insights.model.Recurrence;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.temporal.ChronoUnit;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

class CalendarPeriodsTest {

    @ParameterizedTest
    @EnumSource(Granularity.class)
    void periodsCoverTheRangeWithoutGapsOrOverlap(Granularity granularity) {
        LocalDate start = LocalDate.of(2023, 12, 17);
        LocalDate end = LocalDate.of(2024, 3, 5);

        List<CalendarPeriod> periods = CalendarPeriods.split(start, end, granularity);

        assertThat(periods).isNotEmpty();
        assertThat(periods.get(0).start()).isEqualTo(start);
        assertThat(periods.get(periods.size() - 1).end()).isEqualTo(end);
        for (int i = 1; i < periods.size(); i++) {
            assertThat(periods.get(i).start()).isEqualTo(periods.get(i - 1).end().plusDays(1));
        }
        long covered = periods.stream()
                .mapToLong(period -> CalendarPeriods.daySpan(period.start(), period.end()) + 1)
                .sum();
        assertThat(covered).isEqualTo(ChronoUnit.DAYS.between(start, end) + 1);
    }

    @Test
    void monthlyPeriodsFollowMonthLengthsIncludingLeapFebruary() {
        List<CalendarPeriod> periods = CalendarPeriods.split(
                LocalDate.of(2024, 1, 15), LocalDate.of(2024, 3, 10), Granularity.MONTHLY);

        assertThat(periods).extracting(CalendarPeriod::end).containsExactly(
                LocalDate.of(2024, 1, 31), LocalDate.of(2024, 2, 29), LocalDate.of(2024, 3, 10));
        assertThat(periods).extracting(CalendarPeriod::key).containsExactly("2024-01", "2024-02", "2024-03");
        assertThat(periods.get(1).label()).isEqualTo("Feb 2024");
    }

    @Test
    void weeklyPeriodsAreSevenDaysClampedToTheEnd() {
        List<CalendarPeriod> periods = CalendarPeriods.split(
                LocalDate.of(2024, 1, 1), LocalDate.of(2024, 1, 10), Granularity.WEEKLY);

        assertThat(periods).hasSize(2);
        assertThat(periods.get(0).key()).isEqualTo("2024-01-01_2024-01-07");
        assertThat(periods.get(0).label()).isEqualTo("Jan 1 - Jan 7");
        assertThat(periods.get(1).end()).isEqualTo(LocalDate.of(2024, 1, 10));
    }

    @Test
    void invertedRangeHasNoPeriods() {
        assertThat(CalendarPeriods.split(LocalDate.of(2024, 2, 1), LocalDate.of(2024, 1, 1), Granularity.DAILY)).isEmpty();
    }

    @Test
    void trailingDaysEndWithToday() {
        assertThat(CalendarPeriods.trailingDays(LocalDate.of(2024, 3, 1), 3)).containsExactly(
                LocalDate.of(2024, 2, 28), LocalDate.of(2024, 2, 29), LocalDate.of(2024, 3, 1));
    }

    @Test
    void recurrenceAndBudgetArithmeticClampToMonthEnds() {
        assertThat(CalendarPeriods.advance(LocalDate.of(2024, 1, 31), Recurrence.MONTHLY)).isEqualTo(LocalDate.of(2024, 2, 29));
        assertThat(CalendarPeriods.advance(LocalDate.of(2024, 2, 29), Recurrence.YEARLY)).isEqualTo(LocalDate.of(2025, 2, 28));
        assertThat(CalendarPeriods.advance(LocalDate.of(2024, 5, 5), Recurrence.NONE)).isEqualTo(LocalDate.of(2024, 5, 5));
        assertThat(CalendarPeriods.budgetPeriodEnd(LocalDate.of(2024, 1, 1), BudgetPeriod.WEEKLY)).isEqualTo(LocalDate.of(2024, 1, 7));
        assertThat(CalendarPeriods.budgetPeriodEnd(LocalDate.of(2024, 1, 31), BudgetPeriod.MONTHLY)).isEqualTo(LocalDate.of(2024, 2, 28));
        assertThat(CalendarPeriods.budgetPeriodEnd(LocalDate.of(2024, 3, 1), BudgetPeriod.YEARLY)).isEqualTo(LocalDate.of(2025, 2, 28));
        assertThat(CalendarPeriods.months(YearMonth.of(2024, 11), 3))
                .containsExactly(YearMonth.of(2024, 11), YearMonth.of(2024, 12), YearMonth.of(2025, 1));
    }
}
