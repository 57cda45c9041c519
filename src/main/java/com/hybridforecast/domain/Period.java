package com.hybridforecast.domain;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.Objects;

/**
 * Forecast bucket with both bounds inclusive.
 */
public record Period(
    @JsonFormat(pattern = "yyyy-MM-dd") LocalDate start,
    @JsonFormat(pattern = "yyyy-MM-dd") LocalDate end
) {

    public Period {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
    }

    /** Days covered, counting both bounds. Nonpositive when end precedes start. */
    @JsonIgnore
    public long lengthDays() {
        return ChronoUnit.DAYS.between(start, end) + 1;
    }

    public boolean overlaps(Period other) {
        return !start.isAfter(other.end) && !end.isBefore(other.start);
    }

    public Period intersect(Period other) {
        LocalDate from = start.isAfter(other.start) ? start : other.start;
        LocalDate to = end.isBefore(other.end) ? end : other.end;
        return new Period(from, to);
    }
}
