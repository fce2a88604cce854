package com.moneytrail.insights.analytics;

import com.moneytrail.insights.model.Amounts;
import com.moneytrail.insights.model.LedgerDates;
import com.moneytrail.insights.model.PlannedStatus;
import com.moneytrail.insights.model.PlannedTransaction;
import com.moneytrail.insights.model.report.DuePlannedTransaction;
import com.moneytrail.insights.model.report.PlannedPaymentMonth;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import org.springframework.stereotype.Component;

@Component
public class PlannedPaymentsCalculator {

    /**
     * Planned amounts per month for {@code months} months starting with the month of {@code today}. Cancelled
     * entries are left out.
     */
    public List<PlannedPaymentMonth> plannedPayments(List<PlannedTransaction> planned, int months, LocalDate today) {
        List<PlannedPaymentMonth> result = new ArrayList<>(Math.max(months, 0));
        for (YearMonth month : CalendarPeriods.months(YearMonth.from(today), months)) {
            List<PlannedTransaction> inMonth = planned.stream()
                    .filter(entry -> entry.status() != PlannedStatus.CANCELLED)
                    .filter(entry -> LedgerDates.parse(entry.scheduledDate()).map(YearMonth::from).map(month::equals).orElse(false))
                    .toList();
            result.add(new PlannedPaymentMonth(
                    CalendarPeriods.monthKey(month),
                    CalendarPeriods.monthLabel(month),
                    Amounts.sum(inMonth, PlannedTransaction::amount),
                    (int) inMonth.stream().filter(entry -> entry.status() == PlannedStatus.PENDING).count(),
                    (int) inMonth.stream().filter(entry -> entry.status() == PlannedStatus.COMPLETED).count()
            ));
        }
        return result;
    }

    /**
     * Entries whose pending date is on or before {@code today} and whose recurrence has not run past its end date,
     * oldest first.
     */
    public List<DuePlannedTransaction> due(List<PlannedTransaction> planned, LocalDate today) {
        List<DuePlannedTransaction> result = new ArrayList<>();
        for (PlannedTransaction entry : planned) {
            if (entry.status() == PlannedStatus.CANCELLED
                    || !PlannedTransactionSchedule.isDue(entry, today)
                    || PlannedTransactionSchedule.hasReachedEndDate(entry)) {
                continue;
            }
            LocalDate dueDate = PlannedTransactionSchedule.pendingDate(entry).orElseThrow();
            result.add(new DuePlannedTransaction(
                    entry.id(),
                    entry.description(),
                    entry.type(),
                    entry.amount(),
                    dueDate,
                    PlannedTransactionSchedule.nextOccurrence(entry, dueDate).orElse(null)
            ));
        }
        result.sort(Comparator.comparing(DuePlannedTransaction::dueDate));
        return result;
    }
}
