package com.moneytrail.insights.analytics;

import com.moneytrail.insights.model.LedgerDates;
import com.moneytrail.insights.model.PlannedTransaction;
import com.moneytrail.insights.model.Recurrence;
import java.time.LocalDate;
import java.util.Optional;

/**
 * Date rules for planned transactions. A planned entry's pending date is its next occurrence, or its scheduled
 * date before the first occurrence was created.
 */
public final class PlannedTransactionSchedule {

    private PlannedTransactionSchedule() {
    }

    public static Optional<LocalDate> pendingDate(PlannedTransaction planned) {
        Optional<LocalDate> next = LedgerDates.parse(planned.nextOccurrenceDate());
        return next.isPresent() ? next : LedgerDates.parse(planned.scheduledDate());
    }

    /**
     * The occurrence that follows one created on {@code createdOn}. One-time entries have none, and neither does a
     * recurrence whose next date would fall after its end date.
     */
    public static Optional<LocalDate> nextOccurrence(PlannedTransaction planned, LocalDate createdOn) {
        if (planned.recurrence() == Recurrence.NONE) {
            return Optional.empty();
        }
        LocalDate next = CalendarPeriods.advance(createdOn, planned.recurrence());
        Optional<LocalDate> end = LedgerDates.parse(planned.endDate());
        if (end.isPresent() && next.isAfter(end.get())) {
            return Optional.empty();
        }
        return Optional.of(next);
    }

    public static boolean isDue(PlannedTransaction planned, LocalDate today) {
        return pendingDate(planned).map(date -> !date.isAfter(today)).orElse(false);
    }

    public static boolean hasReachedEndDate(PlannedTransaction planned) {
        if (planned.recurrence() == Recurrence.NONE) {
            return false;
        }
        Optional<LocalDate> end = LedgerDates.parse(planned.endDate());
        if (end.isEmpty()) {
            return false;
        }
        return pendingDate(planned).map(date -> date.isAfter(end.get())).orElse(false);
    }
}
