package com.moneytrail.insights.analytics;

import java.time.LocalDate;

/**
 * An inclusive run of calendar days with its sortable key and display label.
 */
public record CalendarPeriod(LocalDate start, LocalDate end, String key, String label) {

    public boolean contains(LocalDate date) {
        return date != null && !date.isBefore(start) && !date.isAfter(end);
    }
}
