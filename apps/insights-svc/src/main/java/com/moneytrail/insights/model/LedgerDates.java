package com.moneytrail.insights.model;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Optional;

/**
 * Parses the ISO calendar dates carried by ledger records. Unparseable values become empty so a single bad
 * record drops out of date-bound reports instead of failing the whole computation.
 */
public final class LedgerDates {

    private LedgerDates() {
    }

    public static Optional<LocalDate> parse(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String trimmed = value.trim();
        // tolerate full timestamps, only the calendar day matters
        if (trimmed.length() > 10 && trimmed.charAt(10) == 'T') {
            trimmed = trimmed.substring(0, 10);
        }
        try {
            return Optional.of(LocalDate.parse(trimmed));
        } catch (DateTimeParseException ex) {
            return Optional.empty();
        }
    }

    public static boolean within(LocalDate date, LocalDate fromInclusive, LocalDate toInclusive) {
        return !date.isBefore(fromInclusive) && !date.isAfter(toInclusive);
    }
}
