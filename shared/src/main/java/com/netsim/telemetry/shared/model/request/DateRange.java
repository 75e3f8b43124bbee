package com.netsim.telemetry.shared.model.request;

import com.netsim.telemetry.shared.error.ConfigurationException;

import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Objects;

/**
 * Half-open time window [start, end) that bounds every generated timestamp.
 *
 * Built from calendar dates with {@link #of(LocalDate, LocalDate)}, where both
 * dates are inclusive: 2025-03-01..2025-03-01 is one full day.
 */
public final class DateRange {

    private final LocalDateTime start;
    private final LocalDateTime end;

    private DateRange(LocalDateTime start, LocalDateTime end) {
        this.start = start;
        this.end = end;
    }

    public static DateRange of(LocalDate startDate, LocalDate endDate) {
        if (startDate == null || endDate == null) {
            throw new ConfigurationException("dateRange", "start and end dates are required");
        }
        if (endDate.isBefore(startDate)) {
            throw new ConfigurationException("dateRange",
                    "end date " + endDate + " is before start date " + startDate);
        }
        return new DateRange(startDate.atStartOfDay(), endDate.plusDays(1).atStartOfDay());
    }

    public static DateRange between(LocalDateTime start, LocalDateTime endExclusive) {
        if (start == null || endExclusive == null) {
            throw new ConfigurationException("dateRange", "start and end are required");
        }
        if (!endExclusive.isAfter(start)) {
            throw new ConfigurationException("dateRange",
                    "empty or inverted range " + start + " .. " + endExclusive);
        }
        return new DateRange(start, endExclusive);
    }

    public LocalDateTime getStart() { return start; }

    /** Exclusive upper bound. */
    public LocalDateTime getEnd() { return end; }

    public long getSeconds() {
        return Duration.between(start, end).getSeconds();
    }

    public boolean contains(LocalDateTime ts) {
        return !ts.isBefore(start) && ts.isBefore(end);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DateRange)) return false;
        DateRange other = (DateRange) o;
        return start.equals(other.start) && end.equals(other.end);
    }

    @Override
    public int hashCode() {
        return Objects.hash(start, end);
    }

    @Override
    public String toString() {
        return "[" + start + " .. " + end + ")";
    }
}
