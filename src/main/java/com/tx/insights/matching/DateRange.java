package com.tx.insights.matching;

import java.time.LocalDate;

/**
 * Inclusive UTC date range a fact covers.
 */
public record DateRange(LocalDate start, LocalDate end) {

    public DateRange {
        if (start == null || end == null) {
            throw new IllegalArgumentException("Date range bounds must not be null");
        }
        if (start.isAfter(end)) {
            throw new IllegalArgumentException("Date range start " + start + " is after end " + end);
        }
    }

    public static DateRange of(String start, String end) {
        return new DateRange(LocalDate.parse(start), LocalDate.parse(end));
    }

    public static DateRange single(LocalDate day) {
        return new DateRange(day, day);
    }

    @Override
    public String toString() {
        return start + ".." + end;
    }
}
