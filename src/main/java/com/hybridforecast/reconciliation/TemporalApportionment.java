package com.hybridforecast.reconciliation;

import com.hybridforecast.domain.Period;

import java.time.LocalDate;
import java.time.temporal.TemporalAdjusters;
import java.util.Locale;

/**
 * Bucket length arithmetic for the time-level labels used by the forecasting models
 * ({@code DAY}, {@code WEEK}, {@code WEEK.2}, {@code MONTH}). Unknown labels fall back
 * to a one-day bucket instead of failing.
 */
public final class TemporalApportionment {

    private TemporalApportionment() {
    }

    public static int durationDays(String timeLevel, LocalDate referenceDate) {
        if (timeLevel == null) {
            return 1;
        }
        String level = timeLevel.toLowerCase(Locale.ROOT);
        if (level.equals("day")) {
            return 1;
        }
        if (level.startsWith("week")) {
            return 7;
        }
        if (level.equals("month") && referenceDate != null) {
            return referenceDate.with(TemporalAdjusters.lastDayOfMonth()).getDayOfMonth();
        }
        return 1;
    }

    /** Inclusive end of the bucket that starts at {@code start}. */
    public static LocalDate periodEnd(String timeLevel, LocalDate start) {
        return start.plusDays(durationDays(timeLevel, start) - 1L);
    }

    /**
     * Scales a bucket total by the share of the nominal bucket the period actually covers.
     * Absent values stay absent.
     */
    public static Double prorate(Double value, Period period, String timeLevel) {
        if (value == null) {
            return null;
        }
        int bucketDays = durationDays(timeLevel, period.start());
        if (bucketDays <= 0) {
            return value;
        }
        return value * period.lengthDays() / bucketDays;
    }

    /**
     * Share of {@code value}, spread evenly over {@code whole}, that falls inside {@code part}.
     */
    public static Double share(Double value, Period whole, Period part) {
        if (value == null) {
            return null;
        }
        long wholeDays = whole.lengthDays();
        if (wholeDays <= 0) {
            return value;
        }
        return value * part.lengthDays() / wholeDays;
    }
}
