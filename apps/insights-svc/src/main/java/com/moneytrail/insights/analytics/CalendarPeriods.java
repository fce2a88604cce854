package com.moneytrail.insights.analytics;

import com.moneytrail.insights.model.BudgetPeriod;
import com.moneytrail.insights.model.Granularity;
import com.moneytrail.insights.model.Recurrence;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Calendar arithmetic for every report. Periods are inclusive on both ends, contiguous, and clamped to the
 * requested range; month ends follow the real month length, leap years included.
 */
public final class CalendarPeriods {

    private static final DateTimeFormatter DAY_KEY = DateTimeFormatter.ISO_LOCAL_DATE;
    private static final DateTimeFormatter DAY_LABEL = DateTimeFormatter.ofPattern("MMM d", Locale.ENGLISH);
    private static final DateTimeFormatter MONTH_KEY = DateTimeFormatter.ofPattern("yyyy-MM", Locale.ENGLISH);
    private static final DateTimeFormatter MONTH_LABEL = DateTimeFormatter.ofPattern("MMM yyyy", Locale.ENGLISH);

    private CalendarPeriods() {
    }

    public static List<CalendarPeriod> split(LocalDate start, LocalDate end, Granularity granularity) {
        if (start == null || end == null || start.isAfter(end)) {
            return List.of();
        }
        List<CalendarPeriod> periods = new ArrayList<>();
        LocalDate cursor = start;
        while (!cursor.isAfter(end)) {
            LocalDate periodEnd = periodEnd(cursor, granularity, end);
            periods.add(describe(cursor, periodEnd, granularity));
            cursor = periodEnd.plusDays(1);
        }
        return periods;
    }

    /**
     * Last day of the period opened at {@code cursor}, never later than {@code limit}.
     */
    public static LocalDate periodEnd(LocalDate cursor, Granularity granularity, LocalDate limit) {
        LocalDate natural = switch (granularity) {
            case DAILY -> cursor;
            case WEEKLY -> cursor.plusDays(6);
            case MONTHLY -> YearMonth.from(cursor).atEndOfMonth();
        };
        return natural.isAfter(limit) ? limit : natural;
    }

    private static CalendarPeriod describe(LocalDate start, LocalDate end, Granularity granularity) {
        return switch (granularity) {
            case DAILY -> new CalendarPeriod(start, end, start.format(DAY_KEY), dayLabel(start));
            case WEEKLY -> new CalendarPeriod(
                    start,
                    end,
                    start.format(DAY_KEY) + "_" + end.format(DAY_KEY),
                    dayLabel(start) + " - " + dayLabel(end));
            case MONTHLY -> new CalendarPeriod(start, end, monthKey(YearMonth.from(start)), monthLabel(YearMonth.from(start)));
        };
    }

    /** Whole days from {@code start} to {@code end}; zero for a single-day range. */
    public static long daySpan(LocalDate start, LocalDate end) {
        return ChronoUnit.DAYS.between(start, end);
    }

    /** The {@code days} calendar days ending with {@code today}, oldest first. */
    public static List<LocalDate> trailingDays(LocalDate today, int days) {
        List<LocalDate> result = new ArrayList<>(Math.max(days, 0));
        for (int offset = days - 1; offset >= 0; offset--) {
            result.add(today.minusDays(offset));
        }
        return result;
    }

    public static List<YearMonth> months(YearMonth first, int count) {
        List<YearMonth> result = new ArrayList<>(Math.max(count, 0));
        for (int i = 0; i < count; i++) {
            result.add(first.plusMonths(i));
        }
        return result;
    }

    public static LocalDate advance(LocalDate date, Recurrence recurrence) {
        return switch (recurrence) {
            case DAILY -> date.plusDays(1);
            case WEEKLY -> date.plusWeeks(1);
            case MONTHLY -> date.plusMonths(1);
            case YEARLY -> date.plusYears(1);
            case NONE -> date;
        };
    }

    /** Last day of a budget window that opens on {@code start} and runs for one {@code period}. */
    public static LocalDate budgetPeriodEnd(LocalDate start, BudgetPeriod period) {
        LocalDate nextStart = switch (period) {
            case WEEKLY -> start.plusWeeks(1);
            case MONTHLY -> start.plusMonths(1);
            case YEARLY -> start.plusYears(1);
        };
        return nextStart.minusDays(1);
    }

    public static String dayLabel(LocalDate date) {
        return date.format(DAY_LABEL);
    }

    public static String monthKey(YearMonth month) {
        return month.format(MONTH_KEY);
    }

    public static String monthLabel(YearMonth month) {
        return month.format(MONTH_LABEL);
    }
}
