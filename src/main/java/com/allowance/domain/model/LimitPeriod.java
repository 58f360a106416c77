package com.allowance.domain.model;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.temporal.TemporalAdjusters;

/**
 * Period a spending limit applies to.
 *
 * Windows are computed in UTC:
 * - DAILY: calendar day
 * - WEEKLY: 7 days starting Monday 00:00
 * - MONTHLY: calendar month
 */
public enum LimitPeriod {
    DAILY("daily"),
    WEEKLY("weekly"),
    MONTHLY("monthly");

    private final String label;

    LimitPeriod(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    /**
     * Canonical [start, end) window of this period containing the given instant.
     */
    public PeriodWindow windowContaining(Instant at) {
        LocalDate day = at.atZone(ZoneOffset.UTC).toLocalDate();
        LocalDate start;
        LocalDate end;
        switch (this) {
            case DAILY:
                start = day;
                end = day.plusDays(1);
                break;
            case WEEKLY:
                start = day.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
                end = start.plusWeeks(1);
                break;
            case MONTHLY:
                start = day.withDayOfMonth(1);
                end = start.plusMonths(1);
                break;
            default:
                throw new IllegalStateException("Unknown period: " + this);
        }
        return new PeriodWindow(
                start.atStartOfDay(ZoneOffset.UTC).toInstant(),
                end.atStartOfDay(ZoneOffset.UTC).toInstant());
    }
}
