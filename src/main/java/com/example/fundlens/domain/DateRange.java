package com.example.fundlens.domain;

import java.time.Clock;
import java.time.LocalDate;

/** Inclusive calendar range requested from a data source. */
public record DateRange(LocalDate start, LocalDate end) {

    public DateRange {
        if (start.isAfter(end)) {
            throw new IllegalArgumentException("start " + start + " is after end " + end);
        }
    }

    /** Range ending today and reaching back {@code years} of 365 days each. */
    public static DateRange lastYears(int years, Clock clock) {
        LocalDate end = LocalDate.now(clock);
        return new DateRange(end.minusDays(years * 365L), end);
    }

    public boolean contains(LocalDate date) {
        return !date.isBefore(start) && !date.isAfter(end);
    }
}
